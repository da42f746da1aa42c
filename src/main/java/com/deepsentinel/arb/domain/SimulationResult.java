package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SimulationResult {
    boolean success;
    double estimatedProfit;
    double estimatedGas;
    double estimatedSlippage;
    String error;

    public static SimulationResult failed(String error) {
        return SimulationResult.builder().success(false).error(error).build();
    }
}
