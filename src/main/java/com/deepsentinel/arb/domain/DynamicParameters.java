package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Decision thresholds retuned from outcome history. Replaced as a whole, never mutated.
 */
@Value
@Builder(toBuilder = true)
@With
public class DynamicParameters {
    double minSpreadThreshold;
    double minProfitThreshold;
    double maxSlippage;
    double optimalTradeSize;
    double riskTolerance; // 0..1
}
