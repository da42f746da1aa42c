package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One per execution attempt, whatever stage it stopped at.
 */
@Value
@Builder(toBuilder = true)
public class OutcomeRecord {
    Instant timestamp;
    String opportunityId;
    String poolA;
    String poolB;
    String tokenA;
    String tokenB;
    int score;
    double predictedProfit;
    double actualProfit; // net of gas
    double tradeSize;
    double gasCost;
    boolean success;
    ExecutionStatus status;
    String error;
    String transactionHash;
    OpportunityFeatures features;
    long executionTimeMs;

    public boolean involvesPools(String poolAId, String poolBId) {
        return (poolAId.equals(poolA) && poolBId.equals(poolB)) || (poolAId.equals(poolB) && poolBId.equals(poolA));
    }

    public boolean involvesTokens(String first, String second) {
        return (first.equals(tokenA) && second.equals(tokenB)) || (first.equals(tokenB) && second.equals(tokenA));
    }
}
