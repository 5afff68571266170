package com.relayclaw.providers;

import com.relayclaw.shared.config.ProviderEntry;
import com.relayclaw.shared.model.AppFamily;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Expands stored provider entries into provider instances and converts them into
 * validated {@link Provider} definitions.
 */
public final class ProviderBatch {

    private ProviderBatch() {}

    /**
     * Batch-creates one entry per (url, key) pair, URL-major. Each instance keeps the URL's
     * position as its url priority and gets a distinct sort index within the group.
     */
    public static List<ProviderEntry> create(String name, String group, AppFamily family,
                                             List<String> urls, List<String> keys,
                                             int rotationTier, Integer sortIndexBase,
                                             Duration cooldownDuration) {
        if (distinct(urls).isEmpty() || distinct(keys).isEmpty()) {
            throw new InvalidProviderException("Batch needs at least one url and one key");
        }
        var entry = new ProviderEntry(null, name, group, family.id(), urls, keys, true,
                rotationTier, 0, 0, sortIndexBase,
                cooldownDuration == null ? 0 : cooldownDuration.toSeconds(),
                null, 0, null, Map.of());
        return expand(entry);
    }

    public static List<ProviderEntry> expand(ProviderEntry entry) {
        var urls = distinct(entry.urls());
        var keys = distinct(entry.keys());
        if (!entry.batch() || urls.isEmpty() || keys.isEmpty()) {
            return List.of(entry);
        }
        if (urls.size() == 1 && keys.size() == 1 && entry.id() != null && !entry.id().isBlank()) {
            return List.of(entry);
        }
        var base = baseId(entry);
        int sortBase = entry.sortIndex() != null ? entry.sortIndex() : 0;
        var out = new ArrayList<ProviderEntry>(urls.size() * keys.size());
        int n = 0;
        for (int u = 0; u < urls.size(); u++) {
            var url = urls.get(u);
            for (var key : keys) {
                var latency = entry.urlLatencyMs().get(url);
                out.add(new ProviderEntry(
                        base + "-" + (n + 1),
                        entry.name(),
                        entry.group(),
                        entry.family(),
                        List.of(url),
                        List.of(key),
                        true,
                        entry.rotationTier(),
                        entry.urlPriority() + u,
                        entry.groupPriority(),
                        sortBase + n,
                        entry.cooldownDurationSeconds(),
                        entry.cooldownUntilEpochSeconds(),
                        0,
                        null,
                        latency == null ? Map.of() : Map.of(url, latency),
                        entry.modelMapping()));
                n++;
            }
        }
        return out;
    }

    public static Provider toProvider(ProviderEntry entry) {
        AppFamily family;
        try {
            family = AppFamily.parse(entry.family());
        } catch (IllegalArgumentException e) {
            throw new InvalidProviderException("Provider " + entry.id() + ": " + e.getMessage());
        }
        var urls = distinct(entry.urls());
        var keys = distinct(entry.keys());
        var endpoints = new ArrayList<Endpoint>();
        for (int u = 0; u < urls.size(); u++) {
            for (var key : keys) {
                endpoints.add(new Endpoint(urls.get(u), key, entry.urlPriority() + u));
            }
        }
        return new Provider(
                entry.id(),
                entry.name(),
                entry.group(),
                family,
                endpoints,
                entry.rotationTier(),
                entry.groupPriority(),
                entry.sortIndex() != null ? entry.sortIndex() : 0,
                Duration.ofSeconds(entry.cooldownDurationSeconds()),
                entry.modelMapping());
    }

    public static ProviderStateSnapshot initialState(ProviderEntry entry) {
        var latency = new HashMap<String, Long>();
        entry.urlLatencyMs().forEach((url, ms) -> latency.put(url.trim().replaceAll("/+$", ""), ms));
        return new ProviderStateSnapshot(
                entry.usageCount(),
                entry.lastUsedAtEpochMillis() == null ? null : Instant.ofEpochMilli(entry.lastUsedAtEpochMillis()),
                entry.cooldownUntilEpochSeconds() == null || entry.cooldownUntilEpochSeconds() <= 0
                        ? null : Instant.ofEpochSecond(entry.cooldownUntilEpochSeconds()),
                Map.of(),
                latency);
    }

    private static String baseId(ProviderEntry entry) {
        if (entry.id() != null && !entry.id().isBlank()) return entry.id();
        if (entry.group() != null && !entry.group().isBlank()) return entry.group();
        if (entry.name() != null && !entry.name().isBlank()) return entry.name();
        throw new InvalidProviderException("Provider entry needs an id, group or name");
    }

    private static List<String> distinct(List<String> values) {
        var set = new LinkedHashSet<String>();
        for (var v : values) {
            if (v != null && !v.isBlank()) set.add(v.trim());
        }
        return List.copyOf(set);
    }
}
