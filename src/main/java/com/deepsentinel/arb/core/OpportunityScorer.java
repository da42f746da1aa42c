package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.OpportunityFeatures;
import com.deepsentinel.arb.domain.OpportunityScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Multi-factor scoring of an opportunity.
 *
 * <pre>
 *   spread        spreadPct / (3 x minSpread)         weight 0.20
 *   liquidity     minLiquidity / (20 x optimalSize)   weight 0.20
 *   profit        profit / minProfit x 25             weight 0.25
 *   volatility    100 - volatility x 1000             weight 0.10
 *   gas           profit / gas x 10                   weight 0.15
 *   historical    pool-pair success rate, else 50     weight 0.10
 * </pre>
 *
 * Every sub-score is clipped to [0,100]. Pure function of its arguments.
 */
@Service
@RequiredArgsConstructor
public class OpportunityScorer {

    private final ArbProperties properties;

    public OpportunityScore score(ArbitrageOpportunity opportunity, DynamicParameters parameters,
            HistorySnapshot history, Instant now) {
        ArbProperties.Scoring cfg = properties.getScoring();
        ArbProperties.Weights weights = cfg.getWeights();
        OpportunityFeatures features = extractFeatures(opportunity, now);

        double spreadScore = clip(features.getSpreadPercentage()
                / (cfg.getSpreadSaturationMultiple() * parameters.getMinSpreadThreshold()) * 100);
        double liquidityScore = clip(features.getLiquidity()
                / (cfg.getLiquidityDepthMultiple() * parameters.getOptimalTradeSize()) * 100);
        double profitScore = clip(features.getEstimatedProfit()
                / parameters.getMinProfitThreshold() * cfg.getProfitMultipleScale());
        double volatilityScore = clip(100 - features.getVolatility() * cfg.getVolatilityPenalty());
        double gasScore = clip(features.getProfitToGasRatio() * cfg.getGasEfficiencyScale());
        double historicalScore = clip(history
                .successRateForPools(opportunity.getPoolA().getPoolId(), opportunity.getPoolB().getPoolId())
                .orElse(cfg.getNeutralHistoricalScore() / 100) * 100);

        double total = spreadScore * weights.getSpread()
                + liquidityScore * weights.getLiquidity()
                + profitScore * weights.getProfit()
                + volatilityScore * weights.getVolatility()
                + gasScore * weights.getGasEfficiency()
                + historicalScore * weights.getHistorical();

        return OpportunityScore.builder()
                .overall((int) Math.round(clip(total)))
                .spread(spreadScore)
                .liquidity(liquidityScore)
                .profit(profitScore)
                .volatility(volatilityScore)
                .gasEfficiency(gasScore)
                .historical(historicalScore)
                .confidence(confidence(features, parameters))
                .features(features)
                .build();
    }

    OpportunityFeatures extractFeatures(ArbitrageOpportunity opportunity, Instant now) {
        double gas = opportunity.getGasEstimate();
        double profit = opportunity.getEstimatedProfit();
        double profitToGas = gas > 0 ? profit / gas : (profit > 0 ? Double.MAX_VALUE : 0.0);

        return OpportunityFeatures.builder()
                .spreadPercentage(opportunity.getSpreadPercentage())
                .estimatedProfit(profit)
                .liquidity(opportunity.minLiquidity())
                .volatility(volatility(opportunity))
                .profitToGasRatio(profitToGas)
                .ageMillis(Math.max(0, opportunity.age(now).toMillis()))
                .build();
    }

    // Price divergence between the two pools, relative to the first pool's price
    private double volatility(ArbitrageOpportunity opportunity) {
        double reference = opportunity.getPoolA().getPriceA();
        if (reference <= 0) {
            return 0.0;
        }
        return Math.abs(opportunity.getPoolA().getPriceA() - opportunity.getPoolB().getPriceA()) / reference;
    }

    private double confidence(OpportunityFeatures features, DynamicParameters parameters) {
        ArbProperties.Scoring cfg = properties.getScoring();
        double confidence = 1.0;
        if (features.getLiquidity() < parameters.getOptimalTradeSize()) {
            confidence *= cfg.getLowLiquidityConfidenceFactor();
        }
        if (features.getAgeMillis() > cfg.getStaleAfter().toMillis()) {
            confidence *= cfg.getStaleConfidenceFactor();
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    static double clip(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
