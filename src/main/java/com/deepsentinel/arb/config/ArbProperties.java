package com.deepsentinel.arb.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * All tunables of the engine, bound from the {@code arb.*} namespace.
 * Defaults match a testnet deployment with a $10 daily loss budget.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "arb")
public class ArbProperties {

    private Monitoring monitoring = new Monitoring();
    private Arbitrage arbitrage = new Arbitrage();
    private Scoring scoring = new Scoring();
    private Risk risk = new Risk();
    private Sizing sizing = new Sizing();
    private Safety safety = new Safety();
    private Tuning tuning = new Tuning();
    private History history = new History();
    private Execution execution = new Execution();
    private Chain chain = new Chain();
    private Pools pools = new Pools();
    private Outcomes outcomes = new Outcomes();

    @Getter
    @Setter
    public static class Monitoring {
        private long pollIntervalMs = 5000;
        private double minProfitThreshold = 0.1;
        private double minSpreadThreshold = 0.005;
    }

    @Getter
    @Setter
    public static class Arbitrage {
        private double defaultTradeAmount = 1000;
        private double maxSlippage = 0.01;
        private double gasEstimate = 0.001;
        private double flashLoanFeeRate = 0.0009; // 0.09%
        private Duration opportunityTtl = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Scoring {
        private Weights weights = new Weights();
        private double spreadSaturationMultiple = 3.0; // x min spread threshold
        private double liquidityDepthMultiple = 20.0; // x optimal trade size
        private double profitMultipleScale = 25.0;
        private double volatilityPenalty = 1000.0;
        private double gasEfficiencyScale = 10.0;
        private double neutralHistoricalScore = 50.0;
        private Duration staleAfter = Duration.ofSeconds(10);
        private double lowLiquidityConfidenceFactor = 0.8;
        private double staleConfidenceFactor = 0.9;
        private int minOverallScore = 60;
        private double minConfidence = 0.7;
    }

    @Getter
    @Setter
    public static class Weights {
        private double spread = 0.20;
        private double liquidity = 0.20;
        private double profit = 0.25;
        private double volatility = 0.10;
        private double gasEfficiency = 0.15;
        private double historical = 0.10;
    }

    @Getter
    @Setter
    public static class Risk {
        private double initialTolerance = 0.5;
        private double liquidityUtilizationScale = 200.0;
        private double slippageScale = 100.0;
        private double gasScale = 100.0;
        private double executionBaseRisk = 20.0;
        private double maxAgeRisk = 30.0;
        private double subRiskWarningLevel = 50.0;
        private double overallWarningLevel = 70.0;
    }

    @Getter
    @Setter
    public static class Sizing {
        private double maxLiquidityFraction = 0.05;
    }

    @Getter
    @Setter
    public static class Safety {
        private int maxConsecutiveFailures = 5;
        private double maxDailyLoss = 10.0;
        private double maxPositionSize = 1000.0;
        private Duration lossWindow = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Tuning {
        private int interval = 10; // every Nth recorded outcome
        private int window = 50;
        private double highSuccessRate = 0.8;
        private double lowSuccessRate = 0.5;
        private double toleranceStep = 0.05;
        private double minTolerance = 0.3;
        private double maxTolerance = 0.7;
        private double raiseFactor = 1.1;
        private double lowerFactor = 0.9;
    }

    @Getter
    @Setter
    public static class History {
        private int capacity = 100;
    }

    @Getter
    @Setter
    public static class Execution {
        private Mode mode = Mode.PAPER;
        private boolean autonomous = false;
        private SingleFlightScope singleFlightScope = SingleFlightScope.GLOBAL;
    }

    public enum Mode {
        PAPER, CHAIN
    }

    public enum SingleFlightScope {
        GLOBAL, PER_OPPORTUNITY
    }

    @Getter
    @Setter
    public static class Chain {
        private String rpcUrl = "https://polygon-rpc.com";
        private long chainId = 137;
        private String executorAddress = "";
        private int tokenDecimals = 18;
        private long gasPriceGwei = 100;
        private long gasLimit = 500_000;
        private double nativeTokenPrice = 1.0; // gas token priced in the quote token
        private long receiptPollMs = 1000;
        private int receiptAttempts = 60;
    }

    @Getter
    @Setter
    public static class Pools {
        private String sourceUrl = "";
        private double requestsPerSecond = 4.0;
    }

    @Getter
    @Setter
    public static class Outcomes {
        private String logPath = "logs/transactions.jsonl";
    }
}
