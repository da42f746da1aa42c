package com.deepsentinel.arb.core;

import com.deepsentinel.arb.domain.HistoricalStats;

public interface HistoricalStatsProvider {

    HistoricalStats getHistoricalStats(int windowHours);
}
