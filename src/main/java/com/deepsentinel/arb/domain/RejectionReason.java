package com.deepsentinel.arb.domain;

/**
 * Decision gate checks, in evaluation order.
 */
public enum RejectionReason {
    SCORE_TOO_LOW,
    RISK_UNACCEPTABLE,
    LOW_CONFIDENCE,
    PROFIT_BELOW_THRESHOLD
}
