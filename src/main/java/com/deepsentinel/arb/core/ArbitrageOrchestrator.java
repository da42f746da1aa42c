package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.Decision;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.ExecutionResult;
import com.deepsentinel.arb.domain.OpportunityScore;
import com.deepsentinel.arb.domain.PoolSnapshot;
import com.deepsentinel.arb.domain.RiskProfile;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArbitrageOrchestrator {

    private final List<ArbitrageDetector> detectors;
    private final PoolSnapshotSource snapshotSource;
    private final ParameterStore parameterStore;
    private final OutcomeLedger ledger;
    private final OpportunityScorer scorer;
    private final RiskAssessor riskAssessor;
    private final DecisionGate decisionGate;
    private final TradeSizeOptimizer sizeOptimizer;
    private final ExecutionEngine executionEngine;
    private final ArbProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${arb.monitoring.poll-interval-ms:5000}")
    public void runLoop() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Arbitrage loop iteration failed", e);
        }
    }

    /**
     * One detection/decision/execution pass.
     *
     * @return results of the executions attempted in this pass
     */
    public List<ExecutionResult> tick() {
        List<PoolSnapshot> snapshots = snapshotSource.getSnapshots();
        log.debug("Arb Detector Heartbeat: {} pool snapshots", snapshots.size());

        // Read once per tick
        DynamicParameters parameters = parameterStore.get();
        HistorySnapshot history = ledger.snapshot();

        List<ExecutionResult> results = new ArrayList<>();
        for (ArbitrageDetector detector : detectors) {
            try {
                List<ArbitrageOpportunity> opportunities = detector.detect(snapshots, parameters);
                if (!opportunities.isEmpty()) {
                    log.info("Found {} opportunities using strategy: {}", opportunities.size(),
                            detector.getClass().getSimpleName());
                    results.addAll(processOpportunities(opportunities, parameters, history));
                }
            } catch (Exception e) {
                log.error("Error in detector strategy: {}", detector.getClass().getSimpleName(), e);
            }
        }
        return results;
    }

    private List<ExecutionResult> processOpportunities(List<ArbitrageOpportunity> opportunities,
            DynamicParameters parameters, HistorySnapshot history) {
        Instant now = clock.instant();

        // Scoring is side-effect free, so it fans out
        List<Evaluated> evaluated = opportunities.parallelStream()
                .map(opp -> evaluate(opp, parameters, history, now))
                .toList();

        List<ExecutionResult> results = new ArrayList<>();
        for (Evaluated candidate : evaluated) {
            ArbitrageOpportunity opp = candidate.getOpportunity();
            if (!candidate.getDecision().isApproved()) {
                log.info("Rejected {}: {} (score={}, risk={})", opp.getId(), candidate.getDecision().getReason(),
                        candidate.getScore().getOverall(), String.format("%.1f", candidate.getRisk().getOverall()));
                continue;
            }

            opp.setApproved(true);
            double size = sizeOptimizer.apply(opp, parameters, history);
            log.info("Approved {}: score={} confidence={} size={}", opp.getId(), candidate.getScore().getOverall(),
                    String.format("%.2f", candidate.getScore().getConfidence()), size);

            if (!properties.getExecution().isAutonomous()) {
                log.info("[WATCH-ONLY] Would execute {} buying in {} selling in {} for {} units (est. profit {})",
                        opp.getId(), opp.buyPool().getPoolId(), opp.sellPool().getPoolId(), size,
                        String.format("%.4f", opp.getEstimatedProfit()));
                continue;
            }

            try {
                results.add(executionEngine.execute(opp, candidate.getScore()));
            } catch (Exception e) {
                log.error("Failed to execute opportunity {}", opp.getId(), e);
            }
        }
        return results;
    }

    private Evaluated evaluate(ArbitrageOpportunity opp, DynamicParameters parameters, HistorySnapshot history,
            Instant now) {
        OpportunityScore score = scorer.score(opp, parameters, history, now);
        double plannedSize = sizeOptimizer.optimalSize(opp, parameters, history);
        RiskProfile risk = riskAssessor.assess(opp, score, plannedSize, parameters, now);
        Decision decision = decisionGate.evaluate(score, risk, parameters);
        return new Evaluated(opp, score, risk, decision);
    }

    @Value
    private static class Evaluated {
        ArbitrageOpportunity opportunity;
        OpportunityScore score;
        RiskProfile risk;
        Decision decision;
    }
}
