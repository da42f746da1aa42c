package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.OpportunityScore;
import com.deepsentinel.arb.domain.RiskProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Four-way risk breakdown (liquidity, slippage, gas, execution), each in [0,100], averaged unweighted.
 * The profile is acceptable when the average stays within {@code riskTolerance * 100}.
 */
@Service
@RequiredArgsConstructor
public class RiskAssessor {

    private final ArbProperties properties;

    /**
     * @param plannedSize trade size the optimizer would use for this opportunity
     */
    public RiskProfile assess(ArbitrageOpportunity opportunity, OpportunityScore score, double plannedSize,
            DynamicParameters parameters, Instant now) {
        ArbProperties.Risk cfg = properties.getRisk();
        double minLiquidity = opportunity.minLiquidity();

        double liquidityRisk = cap(ratio(plannedSize, minLiquidity) * cfg.getLiquidityUtilizationScale());
        double slippageRisk = cap(ratio(opportunity.getTradeAmount(), minLiquidity) * cfg.getSlippageScale());
        double gasRisk = gasRisk(opportunity.getGasEstimate(), score.getFeatures().getEstimatedProfit());
        double ageSeconds = Math.max(0, opportunity.age(now).toMillis()) / 1000.0;
        double executionRisk = cap(cfg.getExecutionBaseRisk() + Math.min(cfg.getMaxAgeRisk(), ageSeconds));

        double overall = (liquidityRisk + slippageRisk + gasRisk + executionRisk) / 4;

        RiskProfile.RiskProfileBuilder profile = RiskProfile.builder()
                .overall(overall)
                .liquidityRisk(liquidityRisk)
                .slippageRisk(slippageRisk)
                .gasRisk(gasRisk)
                .executionRisk(executionRisk)
                .acceptable(overall <= parameters.getRiskTolerance() * 100);

        if (overall > cfg.getOverallWarningLevel()) {
            profile.warning("High overall risk");
        }
        if (liquidityRisk > cfg.getSubRiskWarningLevel()) {
            profile.warning("Insufficient liquidity");
        }
        if (slippageRisk > cfg.getSubRiskWarningLevel()) {
            profile.warning("High slippage expected");
        }
        if (gasRisk > cfg.getSubRiskWarningLevel()) {
            profile.warning("Gas costs may exceed profits");
        }
        return profile.build();
    }

    private double gasRisk(double gasEstimate, double estimatedProfit) {
        if (estimatedProfit <= 0) {
            return 100.0;
        }
        return cap(gasEstimate / estimatedProfit * properties.getRisk().getGasScale());
    }

    // Empty pools are maximal risk
    private static double ratio(double amount, double liquidity) {
        if (liquidity <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return amount / liquidity;
    }

    private static double cap(double value) {
        if (Double.isNaN(value)) {
            return 100.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
