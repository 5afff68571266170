package com.relayclaw.shared.config;

import java.util.List;
import java.util.Map;

/**
 * One provider entry as stored in the config file or the provider store.
 * With {@code batch} set (the default) an entry listing several urls and/or keys stands
 * for one provider instance per (url, key) pair; otherwise it is a single provider whose
 * endpoints are all of those pairs.
 */
public record ProviderEntry(
    String id,
    String name,
    String group,
    String family,
    List<String> urls,
    List<String> keys,
    boolean batch,
    int rotationTier,
    int urlPriority,
    int groupPriority,
    Integer sortIndex,
    long cooldownDurationSeconds,
    Long cooldownUntilEpochSeconds,
    long usageCount,
    Long lastUsedAtEpochMillis,
    Map<String, Long> urlLatencyMs,
    ModelMapping modelMapping
) {
    public static final long DEFAULT_COOLDOWN_SECONDS = 259_200;

    public ProviderEntry {
        urls = urls == null ? List.of() : List.copyOf(urls);
        keys = keys == null ? List.of() : List.copyOf(keys);
        urlLatencyMs = urlLatencyMs == null ? Map.of() : Map.copyOf(urlLatencyMs);
        if (cooldownDurationSeconds <= 0) cooldownDurationSeconds = DEFAULT_COOLDOWN_SECONDS;
        if (modelMapping == null) modelMapping = ModelMapping.none();
    }

    public ProviderEntry(String id, String name, String group, String family, List<String> urls,
                         List<String> keys, boolean batch, int rotationTier, int urlPriority,
                         int groupPriority, Integer sortIndex, long cooldownDurationSeconds,
                         Long cooldownUntilEpochSeconds, long usageCount, Long lastUsedAtEpochMillis,
                         Map<String, Long> urlLatencyMs) {
        this(id, name, group, family, urls, keys, batch, rotationTier, urlPriority, groupPriority,
                sortIndex, cooldownDurationSeconds, cooldownUntilEpochSeconds, usageCount,
                lastUsedAtEpochMillis, urlLatencyMs, ModelMapping.none());
    }

    public boolean isSingleInstance() {
        return urls.size() <= 1 && keys.size() <= 1;
    }

    public ProviderEntry withRuntime(long usageCount, Long lastUsedAtEpochMillis,
                                     Long cooldownUntilEpochSeconds, Map<String, Long> urlLatencyMs) {
        return new ProviderEntry(id, name, group, family, urls, keys, batch, rotationTier, urlPriority,
                groupPriority, sortIndex, cooldownDurationSeconds, cooldownUntilEpochSeconds,
                usageCount, lastUsedAtEpochMillis, urlLatencyMs, modelMapping);
    }
}
