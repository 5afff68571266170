package com.relayclaw.providers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of a provider's runtime fields. Selection ranks on snapshots so it
 * never holds a provider lock while sorting.
 */
public record ProviderStateSnapshot(
    long usageCount,
    Instant lastUsedAt,
    Instant cooldownUntil,
    Map<String, Instant> urlCooldownUntil,
    Map<String, Long> urlLatencyMs
) {
    public ProviderStateSnapshot {
        urlCooldownUntil = urlCooldownUntil == null ? Map.of() : Map.copyOf(urlCooldownUntil);
        urlLatencyMs = urlLatencyMs == null ? Map.of() : Map.copyOf(urlLatencyMs);
    }

    public static ProviderStateSnapshot empty() {
        return new ProviderStateSnapshot(0, null, null, Map.of(), Map.of());
    }

    public boolean isCoolingDown(String url, Instant now) {
        if (cooldownUntil != null && now.isBefore(cooldownUntil)) return true;
        var until = urlCooldownUntil.get(url);
        return until != null && now.isBefore(until);
    }

    /** Latest cooldown deadline still in the future, provider-wide or per URL. */
    public Instant activeCooldownUntil(Instant now) {
        Instant latest = null;
        if (cooldownUntil != null && now.isBefore(cooldownUntil)) latest = cooldownUntil;
        for (var until : urlCooldownUntil.values()) {
            if (now.isBefore(until) && (latest == null || until.isAfter(latest))) latest = until;
        }
        return latest;
    }

    public Duration cooldownRemaining(Instant now) {
        var until = activeCooldownUntil(now);
        return until == null ? Duration.ZERO : Duration.between(now, until);
    }

    public long latencyMs(String url) {
        return urlLatencyMs.getOrDefault(url, Long.MAX_VALUE);
    }
}
