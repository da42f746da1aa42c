package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TradeSizeOptimizer {

    private final ArbProperties properties;

    /**
     * Target size capped at a fraction of the thinner pool, blended with the historical
     * average for the token pair when there is one, floored to whole units.
     */
    public double optimalSize(ArbitrageOpportunity opportunity, DynamicParameters parameters,
            HistorySnapshot history) {
        double fraction = properties.getSizing().getMaxLiquidityFraction();
        double maxSafeSize = Math.min(
                opportunity.getPoolA().getLiquidityA() * fraction,
                opportunity.getPoolB().getLiquidityA() * fraction);

        double size = Math.min(parameters.getOptimalTradeSize(), maxSafeSize);

        double historical = history.averageSuccessfulSize(
                opportunity.getPoolA().getTokenA(), opportunity.getPoolA().getTokenB());
        if (historical > 0) {
            size = (size + historical) / 2;
        }
        return Math.max(0.0, Math.floor(size));
    }

    /**
     * Computes the size and writes it to the opportunity.
     */
    public double apply(ArbitrageOpportunity opportunity, DynamicParameters parameters, HistorySnapshot history) {
        double size = optimalSize(opportunity, parameters, history);
        opportunity.setTradeAmount(size);
        return size;
    }
}
