package com.deepsentinel.arb.domain;

public enum CircuitState {
    CLOSED, // executions allowed
    OPEN // executions blocked
}
