package com.deepsentinel.arb.core;

import com.deepsentinel.arb.MutableClock;
import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ExecutionResult;
import com.deepsentinel.arb.domain.ExecutionStatus;
import com.deepsentinel.arb.domain.OutcomeRecord;
import com.deepsentinel.arb.domain.PoolSnapshot;
import com.deepsentinel.arb.infra.PaperActionGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.deepsentinel.arb.Fixtures.T0;
import static com.deepsentinel.arb.Fixtures.pool;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

class ArbitrageOrchestratorTest {

    private final List<PoolSnapshot> feed = new ArrayList<>();
    private final List<OutcomeRecord> emitted = new ArrayList<>();

    private ArbProperties properties;
    private MutableClock clock;
    private OutcomeLedger ledger;
    private CircuitBreaker breaker;
    private CrossPoolSpreadDetector detector;
    private ParameterStore store;

    @BeforeEach
    void setUp() {
        properties = new ArbProperties();
        properties.getExecution().setAutonomous(true);
        clock = new MutableClock(T0);
        ledger = new OutcomeLedger(properties, clock);
        breaker = new CircuitBreaker(properties, clock);
        detector = new CrossPoolSpreadDetector(properties, clock);
    }

    @Test
    void threePercentSpreadRunsEndToEnd() {
        feed.add(pool("poolA", 1.00, 100_000));
        feed.add(pool("poolB", 1.03, 100_000));

        List<ExecutionResult> results = orchestrator(new PaperActionGateway(properties, store(), clock)).tick();

        assertEquals(1, results.size());
        ExecutionResult result = results.get(0);
        assertEquals(ExecutionStatus.SUCCESS, result.getStatus());
        assertEquals(1000, result.getTradeSize());
        assertTrue(result.getSimulatedProfit() > 28 && result.getSimulatedProfit() < 30,
                "simulated " + result.getSimulatedProfit());

        assertEquals(1, emitted.size());
        OutcomeRecord record = emitted.get(0);
        assertTrue(record.isSuccess());
        assertEquals(92, record.getScore());
        assertEquals(result.getRealizedProfit() - result.getGasCost(), record.getActualProfit(), 1e-9);
        assertTrue(record.getActualProfit() > 28 && record.getActualProfit() < 30);
        assertEquals(1, ledger.totalRecorded());
        assertTrue(detector.getActiveOpportunities().iterator().next().isApproved());
    }

    @Test
    void identicalPoolsProduceNoActivity() {
        feed.add(pool("poolA", 1.00, 100_000));
        feed.add(pool("poolB", 1.00, 100_000));
        ActionGateway gateway = mock(ActionGateway.class);

        assertTrue(orchestrator(gateway).tick().isEmpty());

        verifyNoInteractions(gateway);
        assertTrue(emitted.isEmpty());
    }

    @Test
    void rejectedOpportunityNeverReachesTheGateway() {
        // 0.4% spread clears the coarse floor; against a 5.0 profit floor it scores below 60
        properties.getMonitoring().setMinProfitThreshold(5.0);
        feed.add(pool("poolA", 1.000, 100_000));
        feed.add(pool("poolB", 1.004, 100_000));
        ActionGateway gateway = mock(ActionGateway.class);

        assertTrue(orchestrator(gateway).tick().isEmpty());

        verify(gateway, never()).buildAction(any(), anyDouble());
        assertTrue(emitted.isEmpty());
    }

    @Test
    void watchOnlyModeApprovesButDoesNotExecute() {
        properties.getExecution().setAutonomous(false);
        feed.add(pool("poolA", 1.00, 100_000));
        feed.add(pool("poolB", 1.03, 100_000));
        ActionGateway gateway = mock(ActionGateway.class);

        assertTrue(orchestrator(gateway).tick().isEmpty());

        verifyNoInteractions(gateway);
        assertTrue(detector.getActiveOpportunities().iterator().next().isApproved());
    }

    @Test
    void failingFeedDoesNotBreakTheLoop() {
        ArbitrageOrchestrator orchestrator = orchestrator(new PaperActionGateway(properties, store(), clock),
                () -> {
                    throw new IllegalStateException("feed down");
                });

        assertDoesNotThrow(orchestrator::runLoop);
    }

    @Test
    void laterTicksDetectFreshOpportunities() {
        feed.add(pool("poolA", 1.00, 100_000));
        feed.add(pool("poolB", 1.03, 100_000));
        ArbitrageOrchestrator orchestrator = orchestrator(new PaperActionGateway(properties, store(), clock));

        assertEquals(1, orchestrator.tick().size());
        assertTrue(orchestrator.tick().isEmpty());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(ExecutionStatus.SUCCESS, orchestrator.tick().get(0).getStatus());
        assertEquals(2, ledger.totalRecorded());
    }

    private ArbitrageOrchestrator orchestrator(ActionGateway gateway) {
        return orchestrator(gateway, () -> List.copyOf(feed));
    }

    private ArbitrageOrchestrator orchestrator(ActionGateway gateway, PoolSnapshotSource source) {
        ParameterStore store = store();
        ParameterTuner tuner = new ParameterTuner(store, properties);
        OutcomeRecorder recorder = new OutcomeRecorder(ledger, List.<OutcomeSink>of(emitted::add), tuner, properties);
        ExecutionEngine engine = new ExecutionEngine(gateway, breaker, recorder, properties, clock);
        return new ArbitrageOrchestrator(
                List.of(detector),
                source,
                store,
                ledger,
                new OpportunityScorer(properties),
                new RiskAssessor(properties),
                new DecisionGate(properties),
                new TradeSizeOptimizer(properties),
                engine,
                properties,
                clock);
    }

    // Shared by the gateway and the orchestrator, created after a test has adjusted its properties
    private ParameterStore store() {
        if (store == null) {
            store = new ParameterStore(properties);
        }
        return store;
    }
}
