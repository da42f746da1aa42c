package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.CircuitState;
import com.deepsentinel.arb.domain.SafetyCheck;
import com.deepsentinel.arb.domain.SafetyState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Safety gate consulted before every execution.
 *
 * <p>Opens on any of: too many consecutive failures, daily loss budget spent, operator shutdown.
 * A successful execution clears the failure streak; {@link #restart()} clears the streak and the
 * shutdown flag but leaves the loss counter alone. The loss counter resets on its own once the
 * loss window has elapsed since the last reset.
 *
 * <p>All reads and writes go through this object's monitor.
 */
@Slf4j
@Component
public class CircuitBreaker {

    private final ArbProperties.Safety limits;
    private final Clock clock;

    private boolean shutdown;
    private int consecutiveFailures;
    private double dailyLoss;
    private Instant lastResetAt;

    public CircuitBreaker(ArbProperties properties, Clock clock) {
        this.limits = properties.getSafety();
        this.clock = clock;
        this.lastResetAt = clock.instant();
    }

    public synchronized SafetyCheck check(double tradeSize) {
        rollLossWindowIfNeeded();

        boolean breakerActive = consecutiveFailures >= limits.getMaxConsecutiveFailures();
        boolean lossExceeded = dailyLoss >= limits.getMaxDailyLoss();
        boolean positionTooLarge = tradeSize > limits.getMaxPositionSize();

        SafetyCheck.SafetyCheckBuilder check = SafetyCheck.builder()
                .circuitBreakerActive(breakerActive)
                .dailyLossExceeded(lossExceeded)
                .positionTooLarge(positionTooLarge)
                .shutdown(shutdown)
                .passed(!breakerActive && !lossExceeded && !positionTooLarge && !shutdown);

        if (breakerActive) {
            check.warning("Circuit breaker active: " + consecutiveFailures + " consecutive failures");
        }
        if (lossExceeded) {
            check.warning(String.format("Daily loss limit exceeded: %.2f", dailyLoss));
        }
        if (positionTooLarge) {
            check.warning(String.format("Position size too large: %.2f > %.2f",
                    tradeSize, limits.getMaxPositionSize()));
        }
        if (shutdown) {
            check.warning("Execution engine is shutdown");
        }
        return check.build();
    }

    public synchronized void recordSimulationFailure() {
        consecutiveFailures++;
        logIfTripped();
    }

    public synchronized void recordExecutionFailure(double realizedCost) {
        rollLossWindowIfNeeded();
        consecutiveFailures++;
        if (realizedCost > 0) {
            dailyLoss += realizedCost;
        }
        logIfTripped();
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        rollLossWindowIfNeeded();
    }

    public synchronized void shutdown() {
        log.warn("[SAFETY] Emergency shutdown activated");
        shutdown = true;
    }

    public synchronized void restart() {
        log.info("[SAFETY] Restarting execution engine (dailyLoss={} untouched)", dailyLoss);
        shutdown = false;
        consecutiveFailures = 0;
    }

    public synchronized CircuitState state() {
        rollLossWindowIfNeeded();
        return isOpen() ? CircuitState.OPEN : CircuitState.CLOSED;
    }

    public synchronized SafetyState snapshot() {
        rollLossWindowIfNeeded();
        SafetyState.SafetyStateBuilder state = SafetyState.builder()
                .shutdown(shutdown)
                .consecutiveFailures(consecutiveFailures)
                .dailyLoss(dailyLoss)
                .lastResetAt(lastResetAt)
                .circuitState(isOpen() ? CircuitState.OPEN : CircuitState.CLOSED);
        if (consecutiveFailures >= limits.getMaxConsecutiveFailures()) {
            state.reason("consecutive failures");
        }
        if (dailyLoss >= limits.getMaxDailyLoss()) {
            state.reason("daily loss limit");
        }
        if (shutdown) {
            state.reason("shutdown");
        }
        return state.build();
    }

    private boolean isOpen() {
        return shutdown
                || consecutiveFailures >= limits.getMaxConsecutiveFailures()
                || dailyLoss >= limits.getMaxDailyLoss();
    }

    private void rollLossWindowIfNeeded() {
        Instant now = clock.instant();
        if (Duration.between(lastResetAt, now).compareTo(limits.getLossWindow()) >= 0) {
            if (dailyLoss != 0) {
                log.info("[SAFETY] Resetting daily loss counter (was {})", String.format("%.2f", dailyLoss));
            }
            dailyLoss = 0;
            lastResetAt = now;
        }
    }

    private void logIfTripped() {
        if (isOpen()) {
            log.warn("[SAFETY] Circuit OPEN: consecutiveFailures={} dailyLoss={}",
                    consecutiveFailures, String.format("%.4f", dailyLoss));
        }
    }
}
