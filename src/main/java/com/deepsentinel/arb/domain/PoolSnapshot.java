package com.deepsentinel.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observation of a pool. priceA is the price of tokenA in tokenB, priceB the inverse.
 */
@Value
@Builder
public class PoolSnapshot {
    String poolId;
    String tokenA;
    String tokenB;
    double priceA;
    double priceB;
    double liquidityA;
    double liquidityB;
    Instant observedAt;

    public boolean sharesTokenPairWith(PoolSnapshot other) {
        return (tokenA.equals(other.tokenA) && tokenB.equals(other.tokenB))
                || (tokenA.equals(other.tokenB) && tokenB.equals(other.tokenA));
    }

    /**
     * This pool quoted in {@code reference}'s token order: tokens, prices and liquidity swapped
     * when the pair is listed the other way round.
     */
    public PoolSnapshot orientedTo(PoolSnapshot reference) {
        if (tokenA.equals(reference.tokenA)) {
            return this;
        }
        return PoolSnapshot.builder()
                .poolId(poolId)
                .tokenA(tokenB)
                .tokenB(tokenA)
                .priceA(priceB)
                .priceB(priceA)
                .liquidityA(liquidityB)
                .liquidityB(liquidityA)
                .observedAt(observedAt)
                .build();
    }

    public boolean hasUsablePrice() {
        return priceA > 0 && Double.isFinite(priceA);
    }
}
