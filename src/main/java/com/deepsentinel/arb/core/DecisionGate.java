package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.Decision;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.OpportunityScore;
import com.deepsentinel.arb.domain.RejectionReason;
import com.deepsentinel.arb.domain.RiskProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Accept/reject policy. Checks run in a fixed order and stop at the first failure.
 */
@Component
@RequiredArgsConstructor
public class DecisionGate {

    private final ArbProperties properties;

    public Decision evaluate(OpportunityScore score, RiskProfile risk, DynamicParameters parameters) {
        ArbProperties.Scoring cfg = properties.getScoring();

        if (score.getOverall() < cfg.getMinOverallScore()) {
            return Decision.reject(RejectionReason.SCORE_TOO_LOW);
        }
        if (!risk.isAcceptable()) {
            return Decision.reject(RejectionReason.RISK_UNACCEPTABLE);
        }
        if (score.getConfidence() < cfg.getMinConfidence()) {
            return Decision.reject(RejectionReason.LOW_CONFIDENCE);
        }
        if (score.getFeatures().getEstimatedProfit() < parameters.getMinProfitThreshold()) {
            return Decision.reject(RejectionReason.PROFIT_BELOW_THRESHOLD);
        }
        return Decision.approve();
    }

    public boolean shouldExecute(OpportunityScore score, RiskProfile risk, DynamicParameters parameters) {
        return evaluate(score, risk, parameters).isApproved();
    }
}
