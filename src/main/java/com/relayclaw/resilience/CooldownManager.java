package com.relayclaw.resilience;

import com.relayclaw.providers.Candidate;
import com.relayclaw.providers.ProviderRegistry;
import com.relayclaw.shared.model.AppFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Long-term, per-URL failure suppression.
 * <p>
 * A (key, URL) pair that fails while its breaker is open gets a failure marker. When the
 * same key later succeeds on another URL of the same group, the URL still marked for that
 * key is blamed and cooled down on every provider of the group serving it. If every
 * (key, URL) pair of a group is marked at once nothing is cooled down: the outage cannot
 * be pinned on a URL.
 */
public class CooldownManager {

    private static final Logger log = LoggerFactory.getLogger(CooldownManager.class);

    record FailureMarker(String apiKey, String url) {}

    public record CooldownEntry(String providerId, String name, AppFamily family,
                                Instant cooldownUntil, long remainingSeconds) {}

    private final ProviderRegistry registry;
    // family/group -> markers; per-group atomicity comes from compute()
    private final Map<String, Set<FailureMarker>> markers = new ConcurrentHashMap<>();

    public CooldownManager(ProviderRegistry registry) {
        this.registry = registry;
    }

    /** Phase 1. Only failures seen while the triple's breaker is open leave a marker. */
    public void onFailure(Candidate candidate, boolean breakerOpen) {
        if (!breakerOpen) return;
        var combos = groupCombinations(candidate);
        var marker = new FailureMarker(candidate.apiKey(), candidate.url());
        markers.compute(groupKey(candidate), (k, set) -> {
            var next = set == null ? new HashSet<FailureMarker>() : set;
            next.add(marker);
            if (next.containsAll(combos)) {
                log.warn("[{}] Every (key, url) pair of group {} is failing; treating it as an upstream-wide "
                        + "outage, no cooldown set", candidate.family().id(), candidate.group());
                return null;
            }
            return next;
        });
        log.debug("Failure marker recorded for {}", candidate);
    }

    /** Phase 2. Blames the URLs where this key is still marked. */
    public void onSuccess(Candidate candidate) {
        var blamed = new ArrayList<String>();
        markers.computeIfPresent(groupKey(candidate), (k, set) -> {
            set.remove(new FailureMarker(candidate.apiKey(), candidate.url()));
            var it = set.iterator();
            while (it.hasNext()) {
                var m = it.next();
                if (m.apiKey().equals(candidate.apiKey()) && !m.url().equals(candidate.url())) {
                    blamed.add(m.url());
                    it.remove();
                }
            }
            return set.isEmpty() ? null : set;
        });
        if (blamed.isEmpty()) return;

        var now = registry.now();
        for (var url : blamed) {
            for (var provider : registry.group(candidate.family(), candidate.group())) {
                if (!provider.servesUrl(url)) continue;
                var until = now.plus(provider.cooldownDuration());
                registry.setUrlCooldown(provider.id(), url, until);
                log.info("[{}] Cooling down {} on provider {} until {}: same key works on {}",
                        candidate.family().id(), url, provider.id(), until, candidate.url());
            }
        }
    }

    /** Providers whose cooldown is still in the future. */
    public List<CooldownEntry> list() {
        var now = registry.now();
        var out = new ArrayList<CooldownEntry>();
        for (var s : registry.snapshots()) {
            var until = s.state().activeCooldownUntil(now);
            if (until == null) continue;
            out.add(new CooldownEntry(s.provider().id(), s.provider().name(), s.provider().family(),
                    until, s.state().cooldownRemaining(now).toSeconds()));
        }
        out.sort(Comparator.comparing(CooldownEntry::providerId));
        return out;
    }

    public Instant set(String providerId, double hours) {
        if (!(hours > 0) || !Double.isFinite(hours)) {
            throw new IllegalArgumentException("Cooldown hours must be positive");
        }
        var until = registry.now().plus(Duration.ofSeconds((long) (hours * 3600)));
        if (!registry.setCooldown(providerId, until)) {
            throw new NoSuchElementException("Unknown provider: " + providerId);
        }
        log.info("Cooldown set on provider {} until {}", providerId, until);
        return until;
    }

    /**
     * Clears the provider-wide and per-URL cooldowns. Clearing a provider that is not
     * cooling down is a no-op.
     *
     * @return true if a cooldown was active
     */
    public boolean clear(String providerId) {
        var provider = registry.find(providerId)
                .orElseThrow(() -> new NoSuchElementException("Unknown provider: " + providerId));
        boolean had = registry.clearCooldown(providerId);
        var keys = new HashSet<String>();
        provider.endpoints().forEach(e -> keys.add(e.apiKey()));
        markers.computeIfPresent(provider.family() + "/" + provider.group(), (k, set) -> {
            set.removeIf(m -> keys.contains(m.apiKey()) && provider.servesUrl(m.url()));
            return set.isEmpty() ? null : set;
        });
        if (had) log.info("Cooldown cleared on provider {}", providerId);
        return had;
    }

    Set<FailureMarker> markers(Candidate candidate) {
        var set = markers.get(groupKey(candidate));
        return set == null ? Set.of() : Set.copyOf(set);
    }

    private Set<FailureMarker> groupCombinations(Candidate candidate) {
        var combos = new HashSet<FailureMarker>();
        for (var provider : registry.group(candidate.family(), candidate.group())) {
            provider.endpoints().forEach(e -> combos.add(new FailureMarker(e.apiKey(), e.url())));
        }
        return combos;
    }

    private static String groupKey(Candidate candidate) {
        return candidate.family() + "/" + candidate.group();
    }
}
