package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.OutcomeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Nudges risk tolerance and the profit floor toward what recent outcomes support.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterTuner {

    private final ParameterStore parameterStore;
    private final ArbProperties properties;

    public DynamicParameters tune(List<OutcomeRecord> recentHistory) {
        ArbProperties.Tuning cfg = properties.getTuning();
        if (recentHistory.isEmpty()) {
            return parameterStore.get();
        }

        List<OutcomeRecord> window = recentHistory.subList(
                Math.max(0, recentHistory.size() - cfg.getWindow()), recentHistory.size());

        double successRate = (double) window.stream().filter(OutcomeRecord::isSuccess).count() / window.size();
        double avgProfit = window.stream()
                .filter(r -> r.isSuccess() && r.getActualProfit() > 0)
                .mapToDouble(OutcomeRecord::getActualProfit)
                .average()
                .orElse(0.0);

        DynamicParameters updated = parameterStore.update(current -> {
            double tolerance = current.getRiskTolerance();
            if (successRate > cfg.getHighSuccessRate()) {
                tolerance = Math.min(cfg.getMaxTolerance(), tolerance + cfg.getToleranceStep());
            } else if (successRate < cfg.getLowSuccessRate()) {
                tolerance = Math.max(cfg.getMinTolerance(), tolerance - cfg.getToleranceStep());
            }

            double minProfit = current.getMinProfitThreshold();
            if (avgProfit > minProfit * 2) {
                minProfit *= cfg.getRaiseFactor();
            } else if (avgProfit < minProfit * 0.5) {
                minProfit *= cfg.getLowerFactor();
            }

            return current.toBuilder()
                    .riskTolerance(tolerance)
                    .minProfitThreshold(minProfit)
                    .build();
        });

        log.info("[TUNER] Parameters optimized: successRate={}% avgProfit={} -> riskTolerance={} minProfit={}",
                String.format("%.1f", successRate * 100), String.format("%.4f", avgProfit),
                String.format("%.2f", updated.getRiskTolerance()),
                String.format("%.4f", updated.getMinProfitThreshold()));
        return updated;
    }
}
