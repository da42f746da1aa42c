package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExecutionResult {
    ExecutionStatus status;
    String opportunityId;
    double tradeSize;
    double simulatedProfit;
    double realizedProfit;
    double gasCost;
    String transactionHash;
    String error;
    long executionTimeMs;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public static ExecutionResult rejected(ExecutionStatus status, String opportunityId, double tradeSize,
            String error) {
        return ExecutionResult.builder()
                .status(status)
                .opportunityId(opportunityId)
                .tradeSize(tradeSize)
                .error(error)
                .build();
    }
}
