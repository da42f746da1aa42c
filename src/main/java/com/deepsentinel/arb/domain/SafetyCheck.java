package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SafetyCheck {
    boolean passed;
    boolean circuitBreakerActive;
    boolean dailyLossExceeded;
    boolean positionTooLarge;
    boolean shutdown;
    @Singular
    List<String> warnings;
}
