package com.deepsentinel.arb.infra;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.core.PoolSnapshotSource;
import com.deepsentinel.arb.domain.PoolSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Pulls the pool list from {@code arb.pools.source-url}. Expects a JSON array of
 * {@code {poolId, tokenA, tokenB, priceA, priceB, liquidityA, liquidityB, lastUpdate}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpPoolSnapshotSource implements PoolSnapshotSource {

    private final PoolApiClient apiClient;
    private final ArbProperties properties;
    private final Clock clock;

    @Override
    public List<PoolSnapshot> getSnapshots() {
        String url = properties.getPools().getSourceUrl();
        if (url == null || url.isBlank()) {
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = apiClient.fetch(url);
        } catch (PoolApiClient.PoolFeedException e) {
            log.error("Pool feed unavailable, skipping this tick: {}", e.getMessage());
            return Collections.emptyList();
        }
        if (root == null || !root.isArray()) {
            log.warn("Pool feed returned {} instead of an array", root == null ? "nothing" : root.getNodeType());
            return Collections.emptyList();
        }

        List<PoolSnapshot> snapshots = new ArrayList<>();
        for (JsonNode node : root) {
            parse(node).ifPresent(snapshots::add);
        }
        return snapshots;
    }

    private Optional<PoolSnapshot> parse(JsonNode node) {
        String poolId = node.path("poolId").asText(null);
        String tokenA = node.path("tokenA").asText(null);
        String tokenB = node.path("tokenB").asText(null);
        if (poolId == null || tokenA == null || tokenB == null
                || !node.path("priceA").isNumber() || !node.path("liquidityA").isNumber()) {
            log.warn("Skipping malformed pool entry: {}", node);
            return Optional.empty();
        }

        Instant observedAt;
        try {
            observedAt = parseTimestamp(node.path("lastUpdate"));
        } catch (DateTimeParseException e) {
            log.warn("Skipping pool {} with unreadable lastUpdate {}", poolId, node.path("lastUpdate"));
            return Optional.empty();
        }

        double priceA = node.path("priceA").asDouble();
        double priceB = node.path("priceB").isNumber()
                ? node.path("priceB").asDouble()
                : (priceA > 0 ? 1.0 / priceA : 0.0);

        return Optional.of(PoolSnapshot.builder()
                .poolId(poolId)
                .tokenA(tokenA)
                .tokenB(tokenB)
                .priceA(priceA)
                .priceB(priceB)
                .liquidityA(node.path("liquidityA").asDouble())
                .liquidityB(node.path("liquidityB").asDouble())
                .observedAt(observedAt)
                .build());
    }

    // Epoch millis or ISO-8601; absent means "now"
    private Instant parseTimestamp(JsonNode lastUpdate) {
        if (lastUpdate.isNumber()) {
            return Instant.ofEpochMilli(lastUpdate.asLong());
        }
        if (lastUpdate.isTextual()) {
            return Instant.parse(lastUpdate.asText());
        }
        return clock.instant();
    }
}
