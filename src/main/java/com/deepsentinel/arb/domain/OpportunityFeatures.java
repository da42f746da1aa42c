package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OpportunityFeatures {
    double spreadPercentage;
    double estimatedProfit;
    double liquidity; // smaller of the two pools
    double volatility;
    double profitToGasRatio;
    long ageMillis;
}
