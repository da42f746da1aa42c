package com.deepsentinel.arb.core;

import com.deepsentinel.arb.MutableClock;
import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.OutcomeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.deepsentinel.arb.Fixtures.T0;
import static com.deepsentinel.arb.Fixtures.outcome;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class OutcomeRecorderTest {

    private final ArbProperties properties = new ArbProperties();
    private final OutcomeLedger ledger = new OutcomeLedger(100, new MutableClock(T0));
    private final ParameterTuner tuner = mock(ParameterTuner.class);

    @Test
    void failingSinkDoesNotStopOthers() {
        OutcomeSink broken = mock(OutcomeSink.class);
        OutcomeSink healthy = mock(OutcomeSink.class);
        doThrow(new IllegalStateException("io")).when(broken).emit(any());
        OutcomeRecorder recorder = new OutcomeRecorder(ledger, List.of(broken, healthy), tuner, properties);

        OutcomeRecord record = outcome(true, 1, 1000, T0);
        assertDoesNotThrow(() -> recorder.record(record));

        verify(healthy).emit(record);
        assertEquals(1, ledger.totalRecorded());
    }

    @Test
    void tunerRunsOnEveryTenthOutcome() {
        OutcomeRecorder recorder = new OutcomeRecorder(ledger, List.of(), tuner, properties);

        for (int i = 0; i < 9; i++) {
            recorder.record(outcome(true, 1, 1000, T0));
        }
        verify(tuner, never()).tune(anyList());

        recorder.record(outcome(true, 1, 1000, T0));
        verify(tuner, times(1)).tune(anyList());

        for (int i = 0; i < 10; i++) {
            recorder.record(outcome(true, 1, 1000, T0));
        }
        verify(tuner, times(2)).tune(anyList());
    }
}
