package com.relayclaw.providers;

import com.relayclaw.shared.config.ProviderEntry;
import com.relayclaw.shared.model.AppFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory view of all providers and their runtime state, refreshed from a
 * {@link ProviderRepository}. Holds no routing logic; each provider's state object is its
 * own lock.
 */
public class ProviderRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private record Entry(Provider provider, ProviderState state) {}

    public record Snapshot(Provider provider, ProviderStateSnapshot state) {}

    private final ProviderRepository repository;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<AppFamily, String> activeProviders = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;

    public ProviderRegistry(ProviderRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public ProviderRegistry(ProviderRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Clock clock() {
        return clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Re-reads every definition from the repository. Runtime state of providers that
     * survive the refresh is kept; malformed entries are logged and skipped.
     *
     * @return number of providers now registered
     */
    public synchronized int refresh() {
        var fresh = new HashMap<String, Provider>();
        var initial = new HashMap<String, ProviderStateSnapshot>();
        int skipped = 0;
        for (var stored : repository.findAll()) {
            try {
                for (var entry : ProviderBatch.expand(stored)) {
                    var provider = ProviderBatch.toProvider(entry);
                    if (fresh.putIfAbsent(provider.id(), provider) != null) {
                        throw new InvalidProviderException("Duplicate provider id: " + provider.id());
                    }
                    initial.put(provider.id(), ProviderBatch.initialState(entry));
                }
            } catch (InvalidProviderException e) {
                skipped++;
                log.warn("Skipping invalid provider {}: {}", stored.id(), e.getMessage());
            }
        }
        warnOnDuplicateSortIndex(fresh.values());

        entries.keySet().retainAll(fresh.keySet());
        for (var provider : fresh.values()) {
            entries.compute(provider.id(), (id, existing) -> existing != null
                    ? new Entry(provider, existing.state())
                    : new Entry(provider, new ProviderState(initial.get(id))));
        }
        activeProviders.values().removeIf(id -> !entries.containsKey(id));
        log.debug("Provider registry refreshed: {} providers, {} skipped", entries.size(), skipped);
        return entries.size();
    }

    public synchronized void startAutoRefresh(Duration interval) {
        if (scheduler != null || interval.isZero() || interval.isNegative()) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "registry-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                refresh();
            } catch (RuntimeException e) {
                log.error("Provider registry refresh failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    public List<Snapshot> snapshots(AppFamily family) {
        var out = new ArrayList<Snapshot>();
        for (var e : entries.values()) {
            if (e.provider().family() == family) {
                out.add(new Snapshot(e.provider(), e.state().snapshot()));
            }
        }
        return out;
    }

    public List<Snapshot> snapshots() {
        var out = new ArrayList<Snapshot>();
        for (var e : entries.values()) {
            out.add(new Snapshot(e.provider(), e.state().snapshot()));
        }
        return out;
    }

    public Optional<Provider> find(String id) {
        var e = entries.get(id);
        return e == null ? Optional.empty() : Optional.of(e.provider());
    }

    public Optional<ProviderStateSnapshot> state(String id) {
        var e = entries.get(id);
        return e == null ? Optional.empty() : Optional.of(e.state().snapshot());
    }

    public List<Provider> group(AppFamily family, String group) {
        var out = new ArrayList<Provider>();
        for (var e : entries.values()) {
            if (e.provider().family() == family && e.provider().group().equals(group)) {
                out.add(e.provider());
            }
        }
        return out;
    }

    public Optional<Provider> activeProvider(AppFamily family) {
        var id = activeProviders.get(family);
        return id == null ? Optional.empty() : find(id);
    }

    public void setActiveProvider(AppFamily family, String providerId) {
        if (!entries.containsKey(providerId)) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        var previous = activeProviders.put(family, providerId);
        if (!providerId.equals(previous)) {
            log.info("[{}] Active provider is now {}", family.id(), providerId);
        }
    }

    public void recordSuccess(Candidate candidate, long latencyMs) {
        var e = entries.get(candidate.provider().id());
        if (e == null) return;
        e.state().recordUse(candidate.url(), latencyMs, now());
        setActiveProvider(candidate.family(), candidate.provider().id());
        persist(candidate.provider().id(), e.state());
    }

    public void updateLatency(String providerId, String url, long latencyMs) {
        var e = entries.get(providerId);
        if (e != null) e.state().updateLatency(url, latencyMs);
    }

    public boolean resetUsage(String providerId) {
        var e = entries.get(providerId);
        if (e == null) return false;
        e.state().resetUsage();
        persist(providerId, e.state());
        return true;
    }

    public void setUrlCooldown(String providerId, String url, Instant until) {
        var e = entries.get(providerId);
        if (e == null) return;
        e.state().setUrlCooldownUntil(url, until);
        persist(providerId, e.state());
    }

    public boolean setCooldown(String providerId, Instant until) {
        var e = entries.get(providerId);
        if (e == null) return false;
        e.state().setCooldownUntil(until);
        persist(providerId, e.state());
        return true;
    }

    /** @return true if the provider had an active cooldown */
    public boolean clearCooldown(String providerId) {
        var e = entries.get(providerId);
        if (e == null) return false;
        boolean had = e.state().clearCooldowns(now());
        persist(providerId, e.state());
        return had;
    }

    /** Stores new entries and refreshes; returns the ids of the registered providers. */
    public List<String> add(List<ProviderEntry> newEntries) {
        var singles = new ArrayList<ProviderEntry>();
        for (var entry : newEntries) {
            for (var single : ProviderBatch.expand(entry)) {
                ProviderBatch.toProvider(single);
                if (repository.find(single.id()).isPresent()) {
                    throw new IllegalArgumentException("Provider already exists: " + single.id());
                }
                singles.add(single);
            }
        }
        var ids = new ArrayList<String>();
        for (var single : singles) {
            repository.save(single);
            ids.add(single.id());
        }
        refresh();
        return ids;
    }

    public boolean remove(String providerId) {
        boolean removed = repository.remove(providerId);
        if (removed) refresh();
        return removed;
    }

    private void persist(String providerId, ProviderState state) {
        try {
            // 持有 state 锁写入，避免较旧的快照覆盖较新的
            synchronized (state) {
                repository.saveState(providerId, state.snapshot());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to persist state for provider {}: {}", providerId, e.getMessage());
        }
    }

    private static void warnOnDuplicateSortIndex(Iterable<Provider> providers) {
        var seen = new HashSet<String>();
        for (var p : providers) {
            var key = p.family() + "/" + p.group() + "/" + p.sortIndex();
            if (!seen.add(key)) {
                log.warn("Duplicate sort index {} in group {} ({}); ordering falls back to provider id",
                        p.sortIndex(), p.group(), p.family().id());
            }
        }
    }
}
