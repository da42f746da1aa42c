package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PnlSummary {
    double cumulativePnl;
    double last24hPnl;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    double winRate;
    double averageProfit;
    double largestWin;
    double largestLoss;
    double totalGasCost;
}
