package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskProfile {
    double overall;
    double liquidityRisk;
    double slippageRisk;
    double gasRisk;
    double executionRisk;
    boolean acceptable;
    @Singular
    List<String> warnings;
}
