package com.relayclaw.gateway.http;

import com.relayclaw.MutableClock;
import com.relayclaw.observability.ProxyStatusTracker;
import com.relayclaw.providers.Candidate;
import com.relayclaw.providers.InMemoryProviderRepository;
import com.relayclaw.providers.ProviderBatch;
import com.relayclaw.providers.ProviderRegistry;
import com.relayclaw.providers.ProviderSelector;
import com.relayclaw.resilience.BreakerKey;
import com.relayclaw.resilience.CircuitBreakerRegistry;
import com.relayclaw.resilience.CooldownManager;
import com.relayclaw.shared.config.BreakerConfig;
import com.relayclaw.shared.model.AppFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdminControllerTest {

    private static final String A = "https://a.example.com";
    private static final String B = "https://b.example.com";
    private static final String KEY = "sk-admin-secret-0042";

    private MutableClock clock;
    private ProviderRegistry registry;
    private CircuitBreakerRegistry breakers;
    private CooldownManager cooldowns;
    private ProxyStatusTracker status;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        registry = new ProviderRegistry(new InMemoryProviderRepository(), clock);
        registry.add(ProviderBatch.create("relay", "relay", AppFamily.CLAUDE, List.of(A, B), List.of(KEY),
                0, null, null));
        breakers = new CircuitBreakerRegistry(new BreakerConfig(1, 60), clock);
        cooldowns = new CooldownManager(registry);
        status = new ProxyStatusTracker("127.0.0.1", 15721, clock);
        var controller = new AdminController(cooldowns, status, breakers, new ProviderSelector(registry, breakers),
                registry);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void healthAndStatus() throws Exception {
        mvc.perform(get("/relay/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        status.requestStarted();
        status.recordFailure("boom");
        status.requestFinished();
        mvc.perform(get("/relay/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.port").value(15721))
                .andExpect(jsonPath("$.totalRequests").value(1))
                .andExpect(jsonPath("$.failedRequests").value(1))
                .andExpect(jsonPath("$.lastError").value("boom"));
    }

    @Test
    void cooldownLifecycle() throws Exception {
        mvc.perform(put("/relay/cooldowns/relay-1").param("hours", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerId").value("relay-1"));

        mvc.perform(get("/relay/cooldowns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].providerId").value("relay-1"))
                .andExpect(jsonPath("$[0].remainingSeconds").value(7200));

        mvc.perform(delete("/relay/cooldowns/relay-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(true));
        assertTrue(cooldowns.list().isEmpty());
    }

    @Test
    void cooldownErrorsUseEnvelope() throws Exception {
        mvc.perform(put("/relay/cooldowns/relay-1").param("hours", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        mvc.perform(put("/relay/cooldowns/ghost").param("hours", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mvc.perform(put("/relay/cooldowns/relay-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void breakersAreListedWithMaskedKeysAndCanBeReset() throws Exception {
        breakers.recordFailure(new BreakerKey("relay-1", A, KEY));

        var body = mvc.perform(get("/relay/breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].providerId").value("relay-1"))
                .andExpect(jsonPath("$[0].state").value("OPEN"))
                .andReturn().getResponse().getContentAsString();
        assertFalse(body.contains(KEY));

        mvc.perform(delete("/relay/breakers/relay-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(1));
        assertTrue(breakers.isAvailable(new BreakerKey("relay-1", A, KEY)));
    }

    @Test
    void rankingShowsEligibility() throws Exception {
        breakers.recordFailure(new BreakerKey("relay-1", A, KEY));

        var body = mvc.perform(get("/relay/providers/claude"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].rank").value(1))
                .andExpect(jsonPath("$[?(@.providerId == 'relay-1')].eligible").value(false))
                .andExpect(jsonPath("$[?(@.providerId == 'relay-2')].eligible").value(true))
                .andReturn().getResponse().getContentAsString();
        assertFalse(body.contains(KEY));

        mvc.perform(get("/relay/providers/cobol"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void usageCounterCanBeReset() throws Exception {
        var relay1 = registry.find("relay-1").orElseThrow();
        var candidate = new Candidate(relay1, relay1.endpoints().get(0));
        registry.recordSuccess(candidate, 120);
        registry.recordSuccess(candidate, 80);
        assertEquals(2, registry.state("relay-1").orElseThrow().usageCount());

        mvc.perform(delete("/relay/providers/relay-1/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerId").value("relay-1"))
                .andExpect(jsonPath("$.usageCount").value(0));
        assertEquals(0, registry.state("relay-1").orElseThrow().usageCount());

        mvc.perform(delete("/relay/providers/ghost/usage"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void batchCreatesOneProviderPerPair() throws Exception {
        var json = """
                {"name":"fresh","group":"fresh","family":"codex",
                 "urls":["https://x.example.com","https://y.example.com"],
                 "keys":["sk-one-0000001","sk-two-0000002"],
                 "cooldownSeconds":600}
                """;
        mvc.perform(post("/relay/providers/batch").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ids", hasSize(4)));

        assertEquals(4, registry.snapshots(AppFamily.CODEX).size());
    }

    @Test
    void emptyBatchIsRejected() throws Exception {
        var json = """
                {"name":"empty","group":"empty","family":"gemini","urls":[],"keys":["k"]}
                """;
        mvc.perform(post("/relay/providers/batch").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        assertTrue(registry.snapshots(AppFamily.GEMINI).isEmpty());
    }
}
