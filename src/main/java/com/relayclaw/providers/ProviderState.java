package com.relayclaw.providers;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable runtime fields of one provider. Every method takes this object's monitor, so
 * writes for the same provider are atomic with respect to each other while unrelated
 * providers never contend.
 */
public class ProviderState {

    private long usageCount;
    private Instant lastUsedAt;
    private Instant cooldownUntil;
    private final Map<String, Instant> urlCooldownUntil = new HashMap<>();
    private final Map<String, Long> urlLatencyMs = new HashMap<>();

    public ProviderState(ProviderStateSnapshot initial) {
        this.usageCount = initial.usageCount();
        this.lastUsedAt = initial.lastUsedAt();
        this.cooldownUntil = initial.cooldownUntil();
        this.urlCooldownUntil.putAll(initial.urlCooldownUntil());
        this.urlLatencyMs.putAll(initial.urlLatencyMs());
    }

    public synchronized void recordUse(String url, long latencyMs, Instant now) {
        usageCount++;
        lastUsedAt = now;
        if (latencyMs >= 0) urlLatencyMs.put(url, latencyMs);
    }

    public synchronized void updateLatency(String url, long latencyMs) {
        urlLatencyMs.put(url, latencyMs);
    }

    public synchronized void resetUsage() {
        usageCount = 0;
        lastUsedAt = null;
    }

    public synchronized void setCooldownUntil(Instant until) {
        cooldownUntil = until;
    }

    /** Extends only: a shorter deadline never shortens an active URL cooldown. */
    public synchronized void setUrlCooldownUntil(String url, Instant until) {
        urlCooldownUntil.merge(url, until, (a, b) -> a.isAfter(b) ? a : b);
    }

    /** @return true if any cooldown was active before the call */
    public synchronized boolean clearCooldowns(Instant now) {
        boolean active = snapshotUnlocked().activeCooldownUntil(now) != null;
        cooldownUntil = null;
        urlCooldownUntil.clear();
        return active;
    }

    public synchronized void expireCooldowns(Instant now) {
        if (cooldownUntil != null && !now.isBefore(cooldownUntil)) cooldownUntil = null;
        urlCooldownUntil.values().removeIf(until -> !now.isBefore(until));
    }

    public synchronized ProviderStateSnapshot snapshot() {
        return snapshotUnlocked();
    }

    private ProviderStateSnapshot snapshotUnlocked() {
        return new ProviderStateSnapshot(usageCount, lastUsedAt, cooldownUntil,
                new HashMap<>(urlCooldownUntil), new HashMap<>(urlLatencyMs));
    }
}
