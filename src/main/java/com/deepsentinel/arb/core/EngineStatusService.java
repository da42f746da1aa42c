package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.EngineStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;

@Service
@RequiredArgsConstructor
public class EngineStatusService {

    private final ParameterStore parameterStore;
    private final CircuitBreaker circuitBreaker;
    private final CrossPoolSpreadDetector detector;
    private final ExecutionEngine executionEngine;
    private final OutcomeLedger ledger;
    private final ArbProperties properties;
    private final Clock clock;

    public EngineStatus snapshot() {
        return EngineStatus.builder()
                .timestamp(clock.instant())
                .executionMode(properties.getExecution().getMode().name().toLowerCase())
                .autonomous(properties.getExecution().isAutonomous())
                .parameters(parameterStore.get())
                .safety(circuitBreaker.snapshot())
                .activeOpportunities(detector.getActiveCount())
                .inFlightExecutions(executionEngine.inFlightCount())
                .totalOutcomes(ledger.totalRecorded())
                .pnl(ledger.pnlSummary())
                .build();
    }

    public Collection<ArbitrageOpportunity> openOpportunities() {
        return detector.getActiveOpportunities();
    }
}
