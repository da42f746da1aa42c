package com.deepsentinel.arb;

import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.ExecutionStatus;
import com.deepsentinel.arb.domain.OutcomeRecord;
import com.deepsentinel.arb.domain.PoolSnapshot;

import java.time.Instant;

public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static PoolSnapshot pool(String id, double price, double liquidity) {
        return PoolSnapshot.builder()
                .poolId(id)
                .tokenA("WETH")
                .tokenB("USDC")
                .priceA(price)
                .priceB(price > 0 ? 1.0 / price : 0.0)
                .liquidityA(liquidity)
                .liquidityB(liquidity)
                .observedAt(T0)
                .build();
    }

    public static DynamicParameters defaultParameters() {
        return DynamicParameters.builder()
                .minSpreadThreshold(0.005)
                .minProfitThreshold(0.1)
                .maxSlippage(0.01)
                .optimalTradeSize(1000)
                .riskTolerance(0.5)
                .build();
    }

    /**
     * The 1.00 / 1.03 pair with 100k liquidity each side, as the detector would emit it.
     */
    public static ArbitrageOpportunity threePercentOpportunity(Instant createdAt) {
        PoolSnapshot a = pool("poolA", 1.00, 100_000);
        PoolSnapshot b = pool("poolB", 1.03, 100_000);
        double spread = 1.03 - 1.00;
        return ArbitrageOpportunity.builder()
                .id(ArbitrageOpportunity.idFor("poolA", "poolB", createdAt))
                .poolA(a)
                .poolB(b)
                .spread(spread)
                .spreadPercentage(spread / 1.00)
                .estimatedProfit(1000 * spread - (0.001 + 1000 * 0.0009))
                .gasEstimate(0.001)
                .tradeAmount(1000)
                .createdAt(createdAt)
                .build();
    }

    public static OutcomeRecord outcome(boolean success, double actualProfit, double tradeSize, Instant at) {
        return OutcomeRecord.builder()
                .timestamp(at)
                .opportunityId("arb_poolA_poolB_" + at.toEpochMilli())
                .poolA("poolA")
                .poolB("poolB")
                .tokenA("WETH")
                .tokenB("USDC")
                .score(80)
                .predictedProfit(actualProfit)
                .actualProfit(actualProfit)
                .tradeSize(tradeSize)
                .success(success)
                .status(success ? ExecutionStatus.SUCCESS : ExecutionStatus.EXECUTION_FAILED)
                .build();
    }
}
