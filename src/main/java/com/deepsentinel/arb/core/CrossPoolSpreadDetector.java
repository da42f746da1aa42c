package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.PoolSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares every pair of pools quoting the same token pair and keeps the discrepancies
 * that clear a coarse spread floor. The real accept/reject call is made later by the decision gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossPoolSpreadDetector implements ArbitrageDetector {

    private final ArbProperties properties;
    private final Clock clock;

    private final Map<String, ArbitrageOpportunity> active = new ConcurrentHashMap<>();

    @Override
    public List<ArbitrageOpportunity> detect(List<PoolSnapshot> snapshots, DynamicParameters parameters) {
        Instant now = clock.instant();
        List<ArbitrageOpportunity> opportunities = new ArrayList<>();

        for (int i = 0; i < snapshots.size(); i++) {
            for (int j = i + 1; j < snapshots.size(); j++) {
                PoolSnapshot poolA = snapshots.get(i);
                if (!poolA.sharesTokenPairWith(snapshots.get(j))) {
                    continue;
                }
                PoolSnapshot poolB = snapshots.get(j).orientedTo(poolA);
                analyzePoolPair(poolA, poolB, parameters, now).ifPresent(opp -> {
                    if (active.putIfAbsent(opp.getId(), opp) == null) {
                        opportunities.add(opp);
                    }
                });
            }
        }

        purgeExpired(now);
        log.debug("Detector scanned {} pools, {} new opportunities, {} active",
                snapshots.size(), opportunities.size(), active.size());
        return opportunities;
    }

    private Optional<ArbitrageOpportunity> analyzePoolPair(PoolSnapshot poolA, PoolSnapshot poolB,
            DynamicParameters parameters, Instant now) {
        if (!poolA.hasUsablePrice() || !poolB.hasUsablePrice()) {
            log.warn("Skipping pair {}/{}: non-positive price", poolA.getPoolId(), poolB.getPoolId());
            return Optional.empty();
        }

        double spread = Math.abs(poolA.getPriceA() - poolB.getPriceA());
        double spreadPercentage = spread / Math.min(poolA.getPriceA(), poolB.getPriceA());

        // Coarse floor only
        if (spreadPercentage < parameters.getMinSpreadThreshold() / 2) {
            return Optional.empty();
        }

        ArbProperties.Arbitrage cfg = properties.getArbitrage();
        double tradeAmount = cfg.getDefaultTradeAmount();
        double gasEstimate = cfg.getGasEstimate();

        // Buy at the lower price, sell at the higher one
        double grossProfit = tradeAmount * spread;
        double fees = gasEstimate + tradeAmount * cfg.getFlashLoanFeeRate();
        double estimatedProfit = grossProfit - fees;
        if (estimatedProfit < 0) {
            return Optional.empty();
        }

        ArbitrageOpportunity opp = ArbitrageOpportunity.builder()
                .id(ArbitrageOpportunity.idFor(poolA.getPoolId(), poolB.getPoolId(), now))
                .poolA(poolA)
                .poolB(poolB)
                .spread(spread)
                .spreadPercentage(spreadPercentage)
                .estimatedProfit(estimatedProfit)
                .gasEstimate(gasEstimate)
                .tradeAmount(tradeAmount)
                .approved(false)
                .createdAt(now)
                .build();

        log.info("Spread found: {} vs {} ({}/{}) spread={}% profit={}",
                poolA.getPoolId(), poolB.getPoolId(), poolA.getTokenA(), poolA.getTokenB(),
                String.format("%.3f", spreadPercentage * 100), String.format("%.4f", estimatedProfit));
        return Optional.of(opp);
    }

    private void purgeExpired(Instant now) {
        Duration ttl = properties.getArbitrage().getOpportunityTtl();
        active.values().removeIf(opp -> opp.isExpired(now, ttl));
    }

    /**
     * Opportunities still inside their TTL, as of now.
     */
    public Collection<ArbitrageOpportunity> getActiveOpportunities() {
        Instant now = clock.instant();
        Duration ttl = properties.getArbitrage().getOpportunityTtl();
        return active.values().stream()
                .filter(opp -> !opp.isExpired(now, ttl))
                .toList();
    }

    public Optional<ArbitrageOpportunity> getOpportunity(String id) {
        return Optional.ofNullable(active.get(id));
    }

    public int getActiveCount() {
        return getActiveOpportunities().size();
    }
}
