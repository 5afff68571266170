package com.relayclaw.resilience;

import com.relayclaw.providers.Candidate;
import com.relayclaw.providers.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Single place where attempt outcomes reach the breaker, the cooldown manager and the
 * registry, so full requests and probes are booked the same way.
 */
public class HealthRecorder {

    private static final Logger log = LoggerFactory.getLogger(HealthRecorder.class);

    private final ProviderRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final CooldownManager cooldowns;

    public HealthRecorder(ProviderRegistry registry, CircuitBreakerRegistry breakers, CooldownManager cooldowns) {
        this.registry = registry;
        this.breakers = breakers;
        this.cooldowns = cooldowns;
    }

    public void recordFailure(Candidate candidate, UpstreamFailure failure) {
        var retryAfter = failure.kind() == FailureKind.RATE_LIMITED ? failure.retryAfter() : Duration.ZERO;
        boolean open = breakers.recordFailure(candidate.breakerKey(), retryAfter);
        cooldowns.onFailure(candidate, open);
        log.warn("[{}] {} failed: {}", candidate.family().id(), candidate, failure.describe());
    }

    public void recordSuccess(Candidate candidate, long latencyMs) {
        breakers.recordSuccess(candidate.breakerKey());
        registry.recordSuccess(candidate, latencyMs);
        cooldowns.onSuccess(candidate);
    }
}
