package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Composite desirability of an opportunity. Overall and sub-scores are in [0,100], confidence in [0,1].
 */
@Value
@Builder
public class OpportunityScore {
    int overall;
    double spread;
    double liquidity;
    double profit;
    double volatility;
    double gasEfficiency;
    double historical;
    double confidence;
    OpportunityFeatures features;
}
