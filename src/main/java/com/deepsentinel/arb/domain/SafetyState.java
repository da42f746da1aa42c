package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SafetyState {
    boolean shutdown;
    int consecutiveFailures;
    double dailyLoss;
    Instant lastResetAt;
    CircuitState circuitState;
    @Singular
    List<String> reasons;

    public boolean isOpen() {
        return circuitState == CircuitState.OPEN;
    }
}
