package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubmissionResult {
    boolean success;
    String referenceId; // transaction hash or paper fill id
    double realizedProfit; // gross, before gas
    double gasCost;
    String error;

    public static SubmissionResult failed(String error, double gasCost) {
        return SubmissionResult.builder().success(false).error(error).gasCost(gasCost).build();
    }
}
