package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Descriptor handed back to the gateway that built it. The engine never looks inside {@code payload}.
 */
@Value
@Builder
public class ArbitrageAction {
    String opportunityId;
    ArbitrageOpportunity opportunity;
    double tradeSize;
    String payload;
    Instant builtAt;
}
