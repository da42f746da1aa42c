package com.deepsentinel.arb.web;

import com.deepsentinel.arb.core.CircuitBreaker;
import com.deepsentinel.arb.core.EngineStatusService;
import com.deepsentinel.arb.core.OutcomeLedger;
import com.deepsentinel.arb.core.ParameterStore;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.EngineStatus;
import com.deepsentinel.arb.domain.HistoricalStats;
import com.deepsentinel.arb.domain.OutcomeRecord;
import com.deepsentinel.arb.domain.SafetyState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;
import java.util.List;

/**
 * Operator surface. Read-only apart from the two safety actions.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineController {

    private final EngineStatusService statusService;
    private final ParameterStore parameterStore;
    private final OutcomeLedger ledger;
    private final CircuitBreaker circuitBreaker;

    @GetMapping("/status")
    public EngineStatus status() {
        return statusService.snapshot();
    }

    @GetMapping("/opportunities")
    public Collection<ArbitrageOpportunity> opportunities() {
        return statusService.openOpportunities();
    }

    @GetMapping("/parameters")
    public DynamicParameters parameters() {
        return parameterStore.get();
    }

    @GetMapping("/outcomes")
    public List<OutcomeRecord> outcomes(@RequestParam(defaultValue = "50") int limit) {
        return ledger.recent(Math.max(0, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<HistoricalStats> stats(@RequestParam(defaultValue = "24") int windowHours) {
        if (windowHours <= 0) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ledger.getHistoricalStats(windowHours));
    }

    @PostMapping("/safety/shutdown")
    public SafetyState shutdown() {
        log.warn("Operator requested emergency shutdown");
        circuitBreaker.shutdown();
        return circuitBreaker.snapshot();
    }

    @PostMapping("/safety/restart")
    public SafetyState restart() {
        log.info("Operator requested restart");
        circuitBreaker.restart();
        return circuitBreaker.snapshot();
    }
}
