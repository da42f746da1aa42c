package com.deepsentinel.arb.core;

import com.deepsentinel.arb.domain.OutcomeRecord;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Read-only view of recent outcomes, taken once per tick so scoring stays deterministic within it.
 */
public final class HistorySnapshot {

    private static final HistorySnapshot EMPTY = new HistorySnapshot(List.of());

    private final List<OutcomeRecord> records;

    public HistorySnapshot(List<OutcomeRecord> records) {
        this.records = List.copyOf(records);
    }

    public static HistorySnapshot empty() {
        return EMPTY;
    }

    public List<OutcomeRecord> records() {
        return records;
    }

    /**
     * Success rate of attempts on the pool pair that reached the gateway. Safety and concurrency
     * rejections say nothing about the pair itself and are left out.
     */
    public OptionalDouble successRateForPools(String poolAId, String poolBId) {
        long total = 0;
        long successes = 0;
        for (OutcomeRecord r : records) {
            if (r.involvesPools(poolAId, poolBId) && (r.getStatus() == null || r.getStatus().reachedGateway())) {
                total++;
                if (r.isSuccess()) {
                    successes++;
                }
            }
        }
        return total == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) successes / total);
    }

    /**
     * Mean size of successful trades on the token pair, 0 when there are none.
     */
    public double averageSuccessfulSize(String tokenA, String tokenB) {
        return records.stream()
                .filter(OutcomeRecord::isSuccess)
                .filter(r -> r.involvesTokens(tokenA, tokenB))
                .mapToDouble(OutcomeRecord::getTradeSize)
                .filter(size -> size > 0)
                .average()
                .orElse(0.0);
    }
}
