package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of the engine for operators.
 */
@Value
@Builder
public class EngineStatus {
    Instant timestamp;
    String executionMode;
    boolean autonomous;
    DynamicParameters parameters;
    SafetyState safety;
    int activeOpportunities;
    int inFlightExecutions;
    long totalOutcomes;
    PnlSummary pnl;
}
