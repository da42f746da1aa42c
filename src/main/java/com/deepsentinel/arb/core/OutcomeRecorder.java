package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.OutcomeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Appends each outcome to the ledger, hands it to the sinks and triggers the tuner every Nth record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeRecorder {

    private final OutcomeLedger ledger;
    private final List<OutcomeSink> sinks;
    private final ParameterTuner tuner;
    private final ArbProperties properties;

    public void record(OutcomeRecord record) {
        long count = ledger.append(record);

        for (OutcomeSink sink : sinks) {
            try {
                sink.emit(record);
            } catch (Exception e) {
                log.error("Outcome sink {} failed for {}", sink.getClass().getSimpleName(),
                        record.getOpportunityId(), e);
            }
        }

        int interval = properties.getTuning().getInterval();
        if (interval > 0 && count % interval == 0) {
            tuner.tune(ledger.recent(properties.getTuning().getWindow()));
        }
    }
}
