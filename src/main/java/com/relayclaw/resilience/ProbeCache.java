package com.relayclaw.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probe verdicts per candidate, valid for a short TTL.
 */
public class ProbeCache {

    private final Map<BreakerKey, ProbeOutcome> outcomes = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ProbeCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<ProbeOutcome> get(BreakerKey key) {
        var outcome = outcomes.get(key);
        if (outcome == null) return Optional.empty();
        if (!clock.instant().isBefore(outcome.probedAt().plus(ttl))) {
            outcomes.remove(key, outcome);
            return Optional.empty();
        }
        return Optional.of(outcome.fromCache());
    }

    public void put(BreakerKey key, ProbeOutcome outcome) {
        outcomes.put(key, outcome);
    }

    public void invalidate(BreakerKey key) {
        outcomes.remove(key);
    }

    public int size() {
        return outcomes.size();
    }
}
