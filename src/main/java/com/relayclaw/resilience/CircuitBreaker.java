package com.relayclaw.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Short-term failure suppressor for one (provider, URL, key) triple.
 * <p>
 * CLOSED counts consecutive failures and opens at the threshold. OPEN rejects until the
 * open window elapses; after that the triple becomes eligible again (half-open). Any
 * failure while half-open reopens immediately, any success closes and resets the counter.
 * <p>
 * A rate-limit answer carrying a retry delay also holds the triple back until that delay
 * has passed, whatever the state.
 */
public class CircuitBreaker {

    public record Stats(BreakerKey key, CircuitState state, int consecutiveFailures, Instant openedAt,
                        Instant heldUntil) {}

    private final BreakerKey key;
    private final int failureThreshold;
    private final Duration openWindow;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private Instant heldUntil;

    public CircuitBreaker(BreakerKey key, int failureThreshold, Duration openWindow) {
        this.key = key;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openWindow = openWindow;
    }

    public BreakerKey key() {
        return key;
    }

    /** Read-only: never consumes the half-open trial. */
    public synchronized boolean isAvailable(Instant now) {
        return currentState(now) != CircuitState.OPEN && !isHeld(now);
    }

    public synchronized boolean isOpen(Instant now) {
        return currentState(now) == CircuitState.OPEN;
    }

    /**
     * @return true if the breaker is open after recording this failure
     */
    public synchronized boolean recordFailure(Instant now) {
        return recordFailure(now, Duration.ZERO);
    }

    /**
     * Same as {@link #recordFailure(Instant)}; a positive {@code retryAfter} additionally
     * holds the triple back until {@code now + retryAfter}. The hold never shortens.
     */
    public synchronized boolean recordFailure(Instant now, Duration retryAfter) {
        if (retryAfter != null && retryAfter.compareTo(Duration.ZERO) > 0) {
            var until = now.plus(retryAfter);
            if (heldUntil == null || until.isAfter(heldUntil)) heldUntil = until;
        }
        var current = currentState(now);
        consecutiveFailures++;
        if (current == CircuitState.HALF_OPEN || consecutiveFailures >= failureThreshold) {
            state = CircuitState.OPEN;
            openedAt = now;
            return true;
        }
        return current == CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        heldUntil = null;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized Stats stats(Instant now) {
        return new Stats(key, currentState(now), consecutiveFailures, openedAt, isHeld(now) ? heldUntil : null);
    }

    private boolean isHeld(Instant now) {
        return heldUntil != null && now.isBefore(heldUntil);
    }

    private CircuitState currentState(Instant now) {
        if (state == CircuitState.OPEN && !now.isBefore(openedAt.plus(openWindow))) {
            state = CircuitState.HALF_OPEN;
        }
        return state;
    }
}
