package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.HistoricalStats;
import com.deepsentinel.arb.domain.OutcomeRecord;
import com.deepsentinel.arb.domain.PnlSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory ring of the most recent outcomes, kept in completion order.
 * Durable history belongs to the {@link OutcomeSink}s.
 */
@Component
public class OutcomeLedger implements HistoricalStatsProvider {

    private final int capacity;
    private final Clock clock;
    private final Deque<OutcomeRecord> ring;

    private long totalRecorded;
    private double cumulativePnl;

    @Autowired
    public OutcomeLedger(ArbProperties properties, Clock clock) {
        this(properties.getHistory().getCapacity(), clock);
    }

    public OutcomeLedger(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalStateException("arb.history.capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
        this.ring = new ArrayDeque<>(capacity);
    }

    /**
     * @return the number of outcomes recorded since startup, including this one
     */
    public synchronized long append(OutcomeRecord record) {
        if (ring.size() == capacity) {
            ring.removeFirst();
        }
        ring.addLast(record);
        if (record.isSuccess()) {
            cumulativePnl += record.getActualProfit();
        }
        return ++totalRecorded;
    }

    public synchronized long totalRecorded() {
        return totalRecorded;
    }

    public synchronized HistorySnapshot snapshot() {
        return new HistorySnapshot(new ArrayList<>(ring));
    }

    /**
     * Most recent {@code limit} outcomes, oldest first.
     */
    public synchronized List<OutcomeRecord> recent(int limit) {
        List<OutcomeRecord> all = new ArrayList<>(ring);
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    @Override
    public synchronized HistoricalStats getHistoricalStats(int windowHours) {
        Instant since = clock.instant().minus(Duration.ofHours(windowHours));
        int total = 0;
        int successes = 0;
        double profitSum = 0;
        for (OutcomeRecord r : ring) {
            if (r.getTimestamp().isBefore(since)) {
                continue;
            }
            total++;
            if (r.isSuccess()) {
                successes++;
                profitSum += r.getActualProfit();
            }
        }
        return new HistoricalStats(total, successes, successes == 0 ? 0.0 : profitSum / successes);
    }

    public synchronized PnlSummary pnlSummary() {
        Instant dayAgo = clock.instant().minus(Duration.ofHours(24));
        int trades = 0;
        int wins = 0;
        int losses = 0;
        double profitSum = 0;
        double last24h = 0;
        double largestWin = 0;
        double largestLoss = 0;
        double gas = 0;

        for (OutcomeRecord r : ring) {
            gas += r.getGasCost();
            if (!r.isSuccess()) {
                continue;
            }
            trades++;
            double profit = r.getActualProfit();
            profitSum += profit;
            if (profit > 0) {
                wins++;
            } else if (profit < 0) {
                losses++;
            }
            largestWin = Math.max(largestWin, profit);
            largestLoss = Math.min(largestLoss, profit);
            if (!r.getTimestamp().isBefore(dayAgo)) {
                last24h += profit;
            }
        }

        return PnlSummary.builder()
                .cumulativePnl(cumulativePnl)
                .last24hPnl(last24h)
                .totalTrades(trades)
                .winningTrades(wins)
                .losingTrades(losses)
                .winRate(trades == 0 ? 0.0 : (double) wins / trades)
                .averageProfit(trades == 0 ? 0.0 : profitSum / trades)
                .largestWin(largestWin)
                .largestLoss(largestLoss)
                .totalGasCost(gas)
                .build();
    }
}
