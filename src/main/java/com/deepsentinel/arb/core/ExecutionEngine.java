package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageAction;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.ExecutionResult;
import com.deepsentinel.arb.domain.ExecutionStatus;
import com.deepsentinel.arb.domain.OpportunityScore;
import com.deepsentinel.arb.domain.OutcomeRecord;
import com.deepsentinel.arb.domain.SafetyCheck;
import com.deepsentinel.arb.domain.SimulationResult;
import com.deepsentinel.arb.domain.SubmissionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gate, build, simulate, verify, submit, record.
 *
 * <p>{@link #execute} never throws: every path ends in exactly one {@link OutcomeRecord} and a
 * structured {@link ExecutionResult}. Attempts are single-flighted; a call that finds the slot
 * taken is rejected immediately instead of waiting.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private final ActionGateway gateway;
    private final CircuitBreaker circuitBreaker;
    private final OutcomeRecorder recorder;
    private final ArbProperties properties;
    private final Clock clock;
    private final SingleFlightGuard singleFlight;

    // Opportunity ids already attempted, kept until their TTL runs out
    private final Map<String, Instant> attempted = new ConcurrentHashMap<>();

    public enum ExecutionState {
        IDLE,
        GATING,
        BUILDING,
        SIMULATING,
        VERIFYING,
        SUBMITTING,
        RECORDING
    }

    @Autowired
    public ExecutionEngine(ActionGateway gateway, CircuitBreaker circuitBreaker, OutcomeRecorder recorder,
            ArbProperties properties, Clock clock) {
        this(gateway, circuitBreaker, recorder, properties, clock,
                new SingleFlightGuard(properties.getExecution().getSingleFlightScope()));
    }

    ExecutionEngine(ActionGateway gateway, CircuitBreaker circuitBreaker, OutcomeRecorder recorder,
            ArbProperties properties, Clock clock, SingleFlightGuard singleFlight) {
        this.gateway = gateway;
        this.circuitBreaker = circuitBreaker;
        this.recorder = recorder;
        this.properties = properties;
        this.clock = clock;
        this.singleFlight = singleFlight;
    }

    public ExecutionResult execute(ArbitrageOpportunity opp, OpportunityScore score) {
        long startMillis = clock.millis();
        double tradeSize = opp.getTradeAmount();
        ExecutionResult result;

        if (!singleFlight.tryAcquire(opp.getId())) {
            log.warn("[EXECUTION] Rejected {}: execution already in progress", opp.getId());
            result = ExecutionResult.rejected(ExecutionStatus.CONCURRENCY_REJECTED, opp.getId(), tradeSize,
                    "Execution already in progress");
        } else {
            try {
                result = attempt(opp, tradeSize);
            } catch (Exception e) {
                log.error("[EXECUTION] FATAL ERROR while executing {}", opp.getId(), e);
                circuitBreaker.recordExecutionFailure(0);
                result = ExecutionResult.rejected(ExecutionStatus.EXECUTION_FAILED, opp.getId(), tradeSize,
                        "internal");
            } finally {
                singleFlight.release(opp.getId());
            }
        }

        result = result.toBuilder().executionTimeMs(clock.millis() - startMillis).build();
        log.info("[EXECUTION] State: {} | {} -> {}", ExecutionState.RECORDING, opp.getId(), result.getStatus());
        recordOutcome(opp, score, result);
        return result;
    }

    private ExecutionResult attempt(ArbitrageOpportunity opp, double tradeSize) {
        ExecutionState state = ExecutionState.GATING;
        log.info("--- START ARB EXECUTION: {} size={} ---", opp.getId(), tradeSize);

        // Gating
        String staleReason = checkOpportunityUsable(opp);
        if (staleReason != null) {
            log.warn("[EXECUTION] State: {} | {} rejected: {}", state, opp.getId(), staleReason);
            return ExecutionResult.rejected(ExecutionStatus.SAFETY_REJECTED, opp.getId(), tradeSize, staleReason);
        }
        SafetyCheck safety = circuitBreaker.check(tradeSize);
        if (!safety.isPassed()) {
            String reason = "Safety check failed: " + String.join(", ", safety.getWarnings());
            log.warn("[EXECUTION] State: {} | {} rejected: {}", state, opp.getId(), reason);
            return ExecutionResult.rejected(ExecutionStatus.SAFETY_REJECTED, opp.getId(), tradeSize, reason);
        }
        attempted.put(opp.getId(), opp.getCreatedAt());

        state = ExecutionState.BUILDING;
        log.info("[EXECUTION] State: {} | Building action for {}", state, opp.getId());
        ArbitrageAction action = gateway.buildAction(opp, tradeSize);

        state = ExecutionState.SIMULATING;
        log.info("[EXECUTION] State: {} | Simulating {}", state, opp.getId());
        SimulationResult simulation = gateway.simulate(action);
        if (simulation == null || !simulation.isSuccess()) {
            String cause = simulation == null ? "no simulation result" : simulation.getError();
            circuitBreaker.recordSimulationFailure();
            log.warn("[EXECUTION] State: {} | Simulation failed for {}: {}", state, opp.getId(), cause);
            return ExecutionResult.rejected(ExecutionStatus.SIMULATION_FAILED, opp.getId(), tradeSize,
                    "Simulation failed: " + cause);
        }

        state = ExecutionState.VERIFYING;
        if (simulation.getEstimatedProfit() <= 0) {
            log.info("[EXECUTION] State: {} | Simulation shows no profit for {}: {}", state, opp.getId(),
                    String.format("%.4f", simulation.getEstimatedProfit()));
            return ExecutionResult.builder()
                    .status(ExecutionStatus.UNPROFITABLE_SIMULATION)
                    .opportunityId(opp.getId())
                    .tradeSize(tradeSize)
                    .simulatedProfit(simulation.getEstimatedProfit())
                    .error(String.format("Simulation shows no profit: %.4f", simulation.getEstimatedProfit()))
                    .build();
        }

        state = ExecutionState.SUBMITTING;
        log.info("[EXECUTION] State: {} | Submitting {} (simulated profit {})", state, opp.getId(),
                String.format("%.4f", simulation.getEstimatedProfit()));
        SubmissionResult submission = gateway.submit(action);
        if (submission == null || !submission.isSuccess()) {
            double cost = submission == null ? 0 : submission.getGasCost();
            String cause = submission == null ? "no submission result" : submission.getError();
            circuitBreaker.recordExecutionFailure(cost);
            log.error("[EXECUTION] State: {} | Execution failed for {}: {}", state, opp.getId(), cause);
            return ExecutionResult.builder()
                    .status(ExecutionStatus.EXECUTION_FAILED)
                    .opportunityId(opp.getId())
                    .tradeSize(tradeSize)
                    .simulatedProfit(simulation.getEstimatedProfit())
                    .gasCost(cost)
                    .transactionHash(submission == null ? null : submission.getReferenceId())
                    .error(cause)
                    .build();
        }

        circuitBreaker.recordSuccess();
        log.info("--- EXECUTION SUCCESSFUL for Arb {} | profit={} gas={} tx={} ---", opp.getId(),
                String.format("%.4f", submission.getRealizedProfit()), String.format("%.4f", submission.getGasCost()),
                submission.getReferenceId());
        return ExecutionResult.builder()
                .status(ExecutionStatus.SUCCESS)
                .opportunityId(opp.getId())
                .tradeSize(tradeSize)
                .simulatedProfit(simulation.getEstimatedProfit())
                .realizedProfit(submission.getRealizedProfit())
                .gasCost(submission.getGasCost())
                .transactionHash(submission.getReferenceId())
                .build();
    }

    private String checkOpportunityUsable(ArbitrageOpportunity opp) {
        Instant now = clock.instant();
        Duration ttl = properties.getArbitrage().getOpportunityTtl();
        attempted.values().removeIf(createdAt -> Duration.between(createdAt, now).compareTo(ttl) > 0);

        if (opp.isExpired(now, ttl)) {
            return "Opportunity expired";
        }
        if (!opp.isApproved()) {
            return "Opportunity not approved";
        }
        if (attempted.containsKey(opp.getId())) {
            return "Opportunity already attempted";
        }
        return null;
    }

    private void recordOutcome(ArbitrageOpportunity opp, OpportunityScore score, ExecutionResult result) {
        OutcomeRecord record = OutcomeRecord.builder()
                .timestamp(clock.instant())
                .opportunityId(opp.getId())
                .poolA(opp.getPoolA().getPoolId())
                .poolB(opp.getPoolB().getPoolId())
                .tokenA(opp.getPoolA().getTokenA())
                .tokenB(opp.getPoolA().getTokenB())
                .score(score == null ? 0 : score.getOverall())
                .predictedProfit(opp.getEstimatedProfit())
                .actualProfit(result.getRealizedProfit() - result.getGasCost())
                .tradeSize(result.getTradeSize())
                .gasCost(result.getGasCost())
                .success(result.isSuccess())
                .status(result.getStatus())
                .error(result.getError())
                .transactionHash(result.getTransactionHash())
                .features(score == null ? null : score.getFeatures())
                .executionTimeMs(result.getExecutionTimeMs())
                .build();
        try {
            recorder.record(record);
        } catch (Exception e) {
            log.error("[EXECUTION] Failed to record outcome for {}", opp.getId(), e);
        }
    }

    public int inFlightCount() {
        return singleFlight.inFlightCount();
    }
}
