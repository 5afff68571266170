package com.relayclaw.providers;

import com.relayclaw.shared.config.ModelMapping;
import com.relayclaw.shared.model.AppFamily;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable provider definition. Runtime fields (usage, cooldown, latency) live in
 * {@link ProviderState} and are owned by the {@link ProviderRegistry}.
 */
public record Provider(
    String id,
    String name,
    String group,
    AppFamily family,
    List<Endpoint> endpoints,
    int rotationTier,
    int groupPriority,
    int sortIndex,
    Duration cooldownDuration,
    ModelMapping modelMapping
) {
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(259_200);

    public Provider {
        if (id == null || id.isBlank()) throw new InvalidProviderException("Provider id is required");
        if (family == null) throw new InvalidProviderException("Provider " + id + " has no application family");
        if (endpoints == null || endpoints.isEmpty()) {
            throw new InvalidProviderException("Provider " + id + " has no (url, key) pair");
        }
        if (name == null || name.isBlank()) name = id;
        if (group == null || group.isBlank()) group = name;
        endpoints = endpoints.stream()
                .sorted(Comparator.comparingInt(Endpoint::urlPriority))
                .toList();
        if (cooldownDuration == null || cooldownDuration.isZero() || cooldownDuration.isNegative()) {
            cooldownDuration = DEFAULT_COOLDOWN;
        }
        if (modelMapping == null) modelMapping = ModelMapping.none();
    }

    public Provider(String id, String name, String group, AppFamily family, List<Endpoint> endpoints,
                    int rotationTier, int groupPriority, int sortIndex, Duration cooldownDuration) {
        this(id, name, group, family, endpoints, rotationTier, groupPriority, sortIndex, cooldownDuration,
                ModelMapping.none());
    }

    public boolean servesUrl(String url) {
        return endpoints.stream().anyMatch(e -> e.url().equals(url));
    }
}
