package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.OutcomeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.deepsentinel.arb.Fixtures.T0;
import static com.deepsentinel.arb.Fixtures.defaultParameters;
import static com.deepsentinel.arb.Fixtures.outcome;
import static com.deepsentinel.arb.Fixtures.pool;
import static com.deepsentinel.arb.Fixtures.threePercentOpportunity;
import static org.junit.jupiter.api.Assertions.*;

class TradeSizeOptimizerTest {

    private final TradeSizeOptimizer optimizer = new TradeSizeOptimizer(new ArbProperties());

    @Test
    void keepsTargetSizeWhenBelowLiquidityCap() {
        // cap is 5% of 100k = 5000
        ArbitrageOpportunity opp = threePercentOpportunity(T0);

        double size = optimizer.apply(opp, defaultParameters(), HistorySnapshot.empty());

        assertEquals(1000, size);
        assertEquals(1000, opp.getTradeAmount());
    }

    @Test
    void capsAtFivePercentOfThinnerPool() {
        ArbitrageOpportunity opp = ArbitrageOpportunity.builder()
                .id("arb_a_b_0")
                .poolA(pool("poolA", 1.00, 10_000))
                .poolB(pool("poolB", 1.03, 100_000))
                .spread(0.03)
                .spreadPercentage(0.03)
                .estimatedProfit(29)
                .gasEstimate(0.001)
                .tradeAmount(1000)
                .createdAt(T0)
                .build();

        assertEquals(500, optimizer.optimalSize(opp, defaultParameters(), HistorySnapshot.empty()));
    }

    @Test
    void blendsWithHistoricalAverageForTokenPair() {
        List<OutcomeRecord> records = List.of(
                outcome(true, 5, 600, T0),
                outcome(true, 5, 400, T0),
                outcome(false, -1, 5000, T0));

        double size = optimizer.optimalSize(threePercentOpportunity(T0), defaultParameters(),
                new HistorySnapshot(records));

        // (1000 + 500) / 2
        assertEquals(750, size);
    }

    @Test
    void resultIsFloored() {
        double size = optimizer.optimalSize(threePercentOpportunity(T0),
                defaultParameters().withOptimalTradeSize(333.7), HistorySnapshot.empty());

        assertEquals(333, size);
    }
}
