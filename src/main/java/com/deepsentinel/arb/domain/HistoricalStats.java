package com.deepsentinel.arb.domain;

import lombok.Value;

@Value
public class HistoricalStats {
    int totalCount;
    int successCount;
    double avgProfit;

    public double successRate() {
        return totalCount == 0 ? 0.0 : (double) successCount / totalCount;
    }
}
