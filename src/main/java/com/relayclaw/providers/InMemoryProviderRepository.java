package com.relayclaw.providers;

import com.relayclaw.shared.config.ProviderEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Provider store kept in memory, seeded from the config file. Batch entries are expanded
 * on the way in so every stored entry has a stable id.
 */
public class InMemoryProviderRepository implements ProviderRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProviderRepository.class);

    private final Map<String, ProviderEntry> entries = new LinkedHashMap<>();

    public InMemoryProviderRepository() {
        this(List.of());
    }

    public InMemoryProviderRepository(List<ProviderEntry> seed) {
        for (var entry : seed) {
            try {
                ProviderBatch.expand(entry).forEach(this::save);
            } catch (InvalidProviderException e) {
                log.warn("Skipping provider entry {}: {}", entry.name(), e.getMessage());
            }
        }
    }

    @Override
    public synchronized List<ProviderEntry> findAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public synchronized Optional<ProviderEntry> find(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized void save(ProviderEntry entry) {
        if (entry.id() == null || entry.id().isBlank()) {
            throw new InvalidProviderException("Cannot store provider entry without id");
        }
        entries.put(entry.id(), entry);
    }

    @Override
    public synchronized boolean remove(String id) {
        return entries.remove(id) != null;
    }

    @Override
    public synchronized void saveState(String id, ProviderStateSnapshot state) {
        var entry = entries.get(id);
        if (entry == null) return;
        Instant cooldown = state.activeCooldownUntil(Instant.now());
        entries.put(id, entry.withRuntime(
                state.usageCount(),
                state.lastUsedAt() == null ? null : state.lastUsedAt().toEpochMilli(),
                cooldown == null ? null : cooldown.getEpochSecond(),
                state.urlLatencyMs().entrySet().stream()
                        .filter(e -> e.getValue() != Long.MAX_VALUE)
                        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue))));
    }
}
