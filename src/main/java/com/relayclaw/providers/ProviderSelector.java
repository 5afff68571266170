package com.relayclaw.providers;

import com.relayclaw.resilience.BreakerKey;
import com.relayclaw.resilience.CircuitBreakerRegistry;
import com.relayclaw.shared.model.AppFamily;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks the candidates of one family. Nothing is cached between calls: every
 * {@code iterator()} takes a fresh registry snapshot, and eligibility (cooldown, open
 * breaker) is checked lazily as the sequence is consumed.
 */
public class ProviderSelector {

    /** One ranked candidate with the state it was ranked on. */
    public record Ranking(Candidate candidate, ProviderStateSnapshot state, boolean eligible) {}

    private final ProviderRegistry registry;
    private final CircuitBreakerRegistry breakers;

    public ProviderSelector(ProviderRegistry registry, CircuitBreakerRegistry breakers) {
        this.registry = registry;
        this.breakers = breakers;
    }

    /** Restartable: each iteration re-ranks from current state. */
    public Iterable<Candidate> candidates(AppFamily family) {
        return () -> rank(family).stream()
                .map(Ranking::candidate)
                .filter(this::isEligible)
                .iterator();
    }

    public Optional<Candidate> next(AppFamily family, Set<BreakerKey> excluded) {
        for (var candidate : candidates(family)) {
            if (!excluded.contains(candidate.breakerKey())) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /** Full ranking including ineligible candidates, for the admin view. */
    public List<Ranking> rankings(AppFamily family) {
        var now = registry.now();
        var out = new ArrayList<Ranking>();
        for (var r : rank(family)) {
            var c = r.candidate();
            boolean eligible = !r.state().isCoolingDown(c.url(), now) && breakers.isAvailable(c.breakerKey());
            out.add(new Ranking(c, r.state(), eligible));
        }
        return out;
    }

    public boolean isEligible(Candidate candidate) {
        Instant now = registry.now();
        var state = registry.state(candidate.provider().id());
        if (state.isEmpty() || state.get().isCoolingDown(candidate.url(), now)) return false;
        return breakers.isAvailable(candidate.breakerKey());
    }

    private List<Ranking> rank(AppFamily family) {
        var activeGroup = registry.activeProvider(family).map(Provider::group).orElse(null);
        var ranked = new ArrayList<Ranking>();
        for (var snapshot : registry.snapshots(family)) {
            for (var endpoint : snapshot.provider().endpoints()) {
                ranked.add(new Ranking(new Candidate(snapshot.provider(), endpoint), snapshot.state(), true));
            }
        }
        ranked.sort(order(activeGroup));
        return ranked;
    }

    static Comparator<Ranking> order(String activeGroup) {
        return Comparator
                .comparingInt((Ranking r) -> r.candidate().group().equals(activeGroup) ? 0 : 1)
                .thenComparing(r -> r.candidate().group())
                .thenComparingInt(r -> r.candidate().provider().rotationTier())
                .thenComparingInt(r -> r.candidate().endpoint().urlPriority())
                .thenComparingLong(r -> r.state().latencyMs(r.candidate().url()))
                .thenComparingInt(r -> r.candidate().provider().groupPriority())
                .thenComparingLong(r -> r.state().usageCount())
                .thenComparing(r -> r.state().lastUsedAt(), Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingInt(r -> r.candidate().provider().sortIndex())
                // sort index 不唯一时保证全序
                .thenComparing(r -> r.candidate().provider().id())
                .thenComparing(r -> r.candidate().url())
                .thenComparing(r -> r.candidate().apiKey());
    }
}
