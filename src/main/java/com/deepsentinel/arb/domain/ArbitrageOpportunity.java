package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * A price discrepancy between two pools quoting the same token pair.
 * Everything except {@code tradeAmount} and {@code approved} is fixed at detection.
 */
@Getter
@Builder
@ToString
public class ArbitrageOpportunity {
    private final String id;
    private final PoolSnapshot poolA;
    private final PoolSnapshot poolB; // oriented to poolA's token order

    // Summary metrics
    private final double spread;
    private final double spreadPercentage;
    private final double estimatedProfit; // at the reference trade amount
    private final double gasEstimate;
    private final Instant createdAt;

    // Set by the size optimizer / decision gate
    @Setter
    private volatile double tradeAmount;
    @Setter
    private volatile boolean approved;

    public static String idFor(String poolAId, String poolBId, Instant createdAt) {
        return "arb_" + poolAId + "_" + poolBId + "_" + createdAt.toEpochMilli();
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public double minLiquidity() {
        return Math.min(poolA.getLiquidityA(), poolB.getLiquidityA());
    }

    public double buyPrice() {
        return Math.min(poolA.getPriceA(), poolB.getPriceA());
    }

    public double sellPrice() {
        return Math.max(poolA.getPriceA(), poolB.getPriceA());
    }

    /** Pool the base token is bought from (the cheaper one). */
    public PoolSnapshot buyPool() {
        return poolA.getPriceA() <= poolB.getPriceA() ? poolA : poolB;
    }

    public PoolSnapshot sellPool() {
        return buyPool() == poolA ? poolB : poolA;
    }
}
