package com.relayclaw.resilience;

import com.relayclaw.shared.config.BreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arena of breakers, one per (provider, URL, key). Breakers are created lazily; each one is
 * its own lock so unrelated triples never contend.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<BreakerKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration openWindow;
    private final Clock clock;

    public CircuitBreakerRegistry(BreakerConfig config, Clock clock) {
        this.failureThreshold = config.failureThreshold();
        this.openWindow = Duration.ofSeconds(config.openSeconds());
        this.clock = clock;
    }

    public boolean isAvailable(BreakerKey key) {
        var breaker = breakers.get(key);
        return breaker == null || breaker.isAvailable(clock.instant());
    }

    public boolean isOpen(BreakerKey key) {
        var breaker = breakers.get(key);
        return breaker != null && breaker.isOpen(clock.instant());
    }

    /** @return true if the breaker is open after this failure */
    public boolean recordFailure(BreakerKey key) {
        return recordFailure(key, Duration.ZERO);
    }

    /** As {@link #recordFailure(BreakerKey)}, also honouring the upstream's retry delay. */
    public boolean recordFailure(BreakerKey key, Duration retryAfter) {
        var now = clock.instant();
        var breaker = breakers.computeIfAbsent(key, k -> new CircuitBreaker(k, failureThreshold, openWindow));
        boolean wasOpen = breaker.isOpen(now);
        boolean open = breaker.recordFailure(now, retryAfter);
        if (retryAfter != null && retryAfter.compareTo(Duration.ZERO) > 0) {
            log.info("{} asked to retry after {}s", key, retryAfter.toSeconds());
        }
        if (open && !wasOpen) {
            log.warn("Circuit opened for {}", key);
        }
        return open;
    }

    public void recordSuccess(BreakerKey key) {
        var breaker = breakers.get(key);
        if (breaker == null) return;
        var before = breaker.stats(clock.instant()).state();
        breaker.recordSuccess();
        if (before != CircuitState.CLOSED) {
            log.info("Circuit closed for {}", key);
        }
    }

    /** Resets every breaker of the provider; returns how many were reset. */
    public int reset(String providerId) {
        int count = 0;
        for (var breaker : breakers.values()) {
            if (breaker.key().providerId().equals(providerId)) {
                breaker.reset();
                count++;
            }
        }
        return count;
    }

    public List<CircuitBreaker.Stats> snapshot() {
        Instant now = clock.instant();
        var out = new ArrayList<CircuitBreaker.Stats>();
        for (var breaker : breakers.values()) {
            out.add(breaker.stats(now));
        }
        out.sort(Comparator.comparing((CircuitBreaker.Stats s) -> s.key().providerId())
                .thenComparing(s -> s.key().url()));
        return out;
    }
}
