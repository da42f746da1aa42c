package com.deepsentinel.arb.domain;

/**
 * Terminal result of one pass through the execution pipeline.
 */
public enum ExecutionStatus {
    SUCCESS,
    SAFETY_REJECTED, // circuit breaker, position cap, shutdown, stale or unapproved opportunity
    SIMULATION_FAILED, // counts toward the circuit breaker
    UNPROFITABLE_SIMULATION, // normal pass, no counters touched
    EXECUTION_FAILED, // counts toward the circuit breaker and the loss budget
    CONCURRENCY_REJECTED; // single-flight violation

    /** Whether the attempt got past the safety gate and reached the gateway. */
    public boolean reachedGateway() {
        return this != SAFETY_REJECTED && this != CONCURRENCY_REJECTED;
    }

    public boolean isFault() {
        return this == SIMULATION_FAILED || this == EXECUTION_FAILED;
    }
}
