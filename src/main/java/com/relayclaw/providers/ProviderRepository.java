package com.relayclaw.providers;

import com.relayclaw.shared.config.ProviderEntry;

import java.util.List;
import java.util.Optional;

/**
 * The persisted provider store. The registry reads definitions from it on every refresh
 * and writes runtime fields (usage, last use, cooldown, latency) back.
 */
public interface ProviderRepository {

    List<ProviderEntry> findAll();

    Optional<ProviderEntry> find(String id);

    void save(ProviderEntry entry);

    boolean remove(String id);

    void saveState(String id, ProviderStateSnapshot state);
}
