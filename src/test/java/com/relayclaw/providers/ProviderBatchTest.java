package com.relayclaw.providers;

import com.relayclaw.shared.config.ModelMapping;
import com.relayclaw.shared.config.ProviderEntry;
import com.relayclaw.shared.model.AppFamily;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProviderBatchTest {

    private static final List<String> URLS = List.of("https://u1.example.com", "https://u2.example.com", "https://u3.example.com");
    private static final List<String> KEYS = List.of("k1", "k2");

    @Test
    void batchCreatesOneInstancePerUrlKeyPair() {
        var entries = ProviderBatch.create("relay", "relay", AppFamily.CLAUDE, URLS, KEYS, 0, null, null);

        assertEquals(6, entries.size());
        var pairs = entries.stream()
                .map(e -> e.urls().get(0) + "|" + e.keys().get(0))
                .collect(Collectors.toSet());
        assertEquals(6, pairs.size());
        assertEquals(List.of("relay-1", "relay-2", "relay-3", "relay-4", "relay-5", "relay-6"),
                entries.stream().map(ProviderEntry::id).toList());
        entries.forEach(e -> assertTrue(e.isSingleInstance()));
    }

    @Test
    void urlPositionBecomesUrlPriority() {
        var entries = ProviderBatch.create("relay", "relay", AppFamily.CODEX, URLS, KEYS, 0, 10, null);

        assertEquals(List.of(0, 0, 1, 1, 2, 2), entries.stream().map(ProviderEntry::urlPriority).toList());
        // sort index 在组内唯一
        assertEquals(List.of(10, 11, 12, 13, 14, 15), entries.stream().map(ProviderEntry::sortIndex).toList());
    }

    @Test
    void cooldownDurationIsCarriedOrDefaulted() {
        var custom = ProviderBatch.create("r", "r", AppFamily.GEMINI, URLS, KEYS, 0, null, Duration.ofHours(1));
        custom.forEach(e -> assertEquals(3600, e.cooldownDurationSeconds()));

        var defaulted = ProviderBatch.create("r", "r", AppFamily.GEMINI, URLS, KEYS, 0, null, null);
        defaulted.forEach(e -> assertEquals(259_200, e.cooldownDurationSeconds()));
    }

    @Test
    void duplicateUrlsCollapse() {
        var entries = ProviderBatch.create("relay", "relay", AppFamily.CLAUDE,
                List.of("https://u1.example.com", " https://u1.example.com "), List.of("k1"), 0, null, null);
        assertEquals(1, entries.size());
        assertEquals("relay-1", entries.get(0).id());
    }

    @Test
    void batchWithoutUrlsOrKeysIsRejected() {
        assertThrows(InvalidProviderException.class, () ->
                ProviderBatch.create("relay", "relay", AppFamily.CLAUDE, List.of(), KEYS, 0, null, null));
        assertThrows(InvalidProviderException.class, () ->
                ProviderBatch.create("relay", "relay", AppFamily.CLAUDE, URLS, List.of(" "), 0, null, null));
    }

    @Test
    void nonBatchEntryIsOneProviderWithAllEndpoints() {
        var entry = new ProviderEntry("multi", "multi", "multi", "claude",
                List.of("https://b.example.com", "https://a.example.com"), KEYS, false,
                0, 0, 0, null, 0, null, 0, null, Map.of());

        var expanded = ProviderBatch.expand(entry);
        assertEquals(1, expanded.size());

        var provider = ProviderBatch.toProvider(expanded.get(0));
        assertEquals(4, provider.endpoints().size());
        assertEquals("https://b.example.com", provider.endpoints().get(0).url());
        assertEquals(1, provider.endpoints().get(3).urlPriority());
        assertTrue(provider.servesUrl("https://a.example.com"));
    }

    @Test
    void expandedInstancesKeepTheModelMapping() {
        var mapping = new ModelMapping(null, "claude-sonnet-relay", null, null, null);
        var entry = new ProviderEntry(null, "relay", "relay", "claude", URLS, KEYS, true,
                0, 0, 0, null, 0, null, 0, null, Map.of(), mapping);

        var expanded = ProviderBatch.expand(entry);
        assertEquals(6, expanded.size());
        assertTrue(expanded.stream().allMatch(e -> e.modelMapping().equals(mapping)));
        assertEquals("claude-sonnet-relay", ProviderBatch.toProvider(expanded.get(5)).modelMapping().sonnet());
    }

    @Test
    void toProviderRejectsUnknownFamily() {
        var entry = new ProviderEntry("p", "p", "p", "cobol", List.of("https://a.example.com"), List.of("k"),
                true, 0, 0, 0, null, 0, null, 0, null, Map.of());
        assertThrows(InvalidProviderException.class, () -> ProviderBatch.toProvider(entry));
    }

    @Test
    void endpointRejectsNonHttpUrl() {
        assertThrows(InvalidProviderException.class, () -> new Endpoint("ftp://a.example.com", "k", 0));
        assertEquals("https://a.example.com", new Endpoint("https://a.example.com//", "k", 0).url());
    }

    @Test
    void initialStateRestoresPersistedRuntimeFields() {
        var entry = new ProviderEntry("p", "p", "p", "claude", List.of("https://a.example.com/"), List.of("k"),
                true, 0, 0, 0, null, 0, 2_000L, 7, 5_000L, Map.of("https://a.example.com/", 80L));

        var state = ProviderBatch.initialState(entry);
        assertEquals(7, state.usageCount());
        assertEquals(Instant.ofEpochMilli(5_000), state.lastUsedAt());
        assertEquals(Instant.ofEpochSecond(2_000), state.cooldownUntil());
        assertEquals(80, state.latencyMs("https://a.example.com"));
    }

    @Test
    void maskKeyHidesTheMiddle() {
        assertEquals("****", Endpoint.maskKey("short"));
        assertFalse(Endpoint.maskKey("sk-abcdefghijklmnop").contains("efghijkl"));
        assertFalse(new Endpoint("https://a.example.com", "sk-abcdefghijklmnop", 0).toString().contains("efghijkl"));
    }
}
