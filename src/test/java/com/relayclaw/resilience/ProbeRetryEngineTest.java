package com.relayclaw.resilience;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayclaw.MutableClock;
import com.relayclaw.ScriptedUpstreamClient;
import com.relayclaw.dispatch.DispatchCancelledException;
import com.relayclaw.dispatch.DispatchContext;
import com.relayclaw.observability.RelayMetrics;
import com.relayclaw.providers.Candidate;
import com.relayclaw.providers.InMemoryProviderRepository;
import com.relayclaw.providers.ProviderBatch;
import com.relayclaw.providers.ProviderRegistry;
import com.relayclaw.routing.TransparentRouter;
import com.relayclaw.shared.config.BreakerConfig;
import com.relayclaw.shared.config.ProbeConfig;
import com.relayclaw.shared.config.RouterConfig;
import com.relayclaw.shared.model.AppFamily;
import com.relayclaw.shared.model.OutboundRequest;
import com.relayclaw.shared.model.UpstreamResponse;
import com.relayclaw.waf.WafBypassHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static com.relayclaw.ScriptedUpstreamClient.*;
import static org.junit.jupiter.api.Assertions.*;

class ProbeRetryEngineTest {

    private static final String A = "https://a.example.com";
    private static final String KEY = "sk-test-key-0001";

    private MutableClock clock;
    private ProviderRegistry registry;
    private CircuitBreakerRegistry breakers;
    private RelayMetrics metrics;
    private HealthRecorder health;
    private DispatchContext ctx;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        registry = new ProviderRegistry(new InMemoryProviderRepository(), clock);
        registry.add(ProviderBatch.create("relay", "relay", AppFamily.CLAUDE,
                List.of(A, "https://b.example.com"), List.of(KEY), 0, null, null));
        breakers = new CircuitBreakerRegistry(new BreakerConfig(4, 60), clock);
        health = new HealthRecorder(registry, breakers, new CooldownManager(registry));
        metrics = new RelayMetrics();
        ctx = new DispatchContext("probe-test");
    }

    @Test
    void failedProbeIsBookedOnceAndCached() {
        var client = new ScriptedUpstreamClient(r -> respond(500, "{\"error\":\"down\"}"));
        var engine = engine(client);

        var first = engine.probe(candidate(), ctx);
        assertFalse(first.passed());
        assertFalse(first.cached());
        assertEquals(FailureKind.UPSTREAM_ERROR, first.failure().kind());
        assertEquals(1, breakers.snapshot().get(0).consecutiveFailures());

        clock.advance(Duration.ofSeconds(59));
        var second = engine.probe(candidate(), ctx);
        assertFalse(second.passed());
        assertTrue(second.cached());
        assertEquals(1, client.sent().size());
        // 缓存命中不重复记账
        assertEquals(1, breakers.snapshot().get(0).consecutiveFailures());

        clock.advance(Duration.ofSeconds(2));
        var third = engine.probe(candidate(), ctx);
        assertFalse(third.cached());
        assertEquals(2, client.sent().size());
    }

    @Test
    void passingProbeChangesNoHealthState() {
        var engine = engine(new ScriptedUpstreamClient(r -> respond(200, "{\"content\":[]}")));

        var outcome = engine.probe(candidate(), ctx);
        assertTrue(outcome.passed());
        assertNull(outcome.failure());
        assertTrue(breakers.snapshot().isEmpty());
        assertEquals(0, registry.state("relay-1").orElseThrow().usageCount());
    }

    @Test
    void callerFaultAndChallengeStillPass() {
        assertTrue(engine(new ScriptedUpstreamClient(r -> respond(400, "{\"error\":\"bad model\"}")))
                .probe(candidate(), ctx).passed());

        var challenge = "<html><script>var arg1='3A1E9C50F0C6D4A9B2E7F1843D5C6A7B8E9F0A1B';</script></html>";
        assertTrue(engine(new ScriptedUpstreamClient(r -> html(200, challenge)))
                .probe(candidate(), ctx).passed());
    }

    @Test
    void transportErrorFailsProbe() {
        var engine = engine(new ScriptedUpstreamClient(r -> failWith(new ConnectException("refused"))));
        var outcome = engine.probe(candidate(), ctx);
        assertFalse(outcome.passed());
        assertEquals(FailureKind.NETWORK_FAILURE, outcome.failure().kind());
    }

    @Test
    void probeRequestIsMinimal() throws Exception {
        var client = new ScriptedUpstreamClient(r -> respond(200, "{}"));
        engine(client).probe(candidate(), ctx);

        var sent = client.sent().get(0);
        assertEquals("POST", sent.method());
        assertEquals(A + "/v1/messages", sent.url());
        assertEquals(KEY, sent.header("x-api-key"));

        var body = new ObjectMapper().readTree(sent.body());
        assertEquals(1, body.get("max_tokens").asInt());
        assertEquals(ProbeConfig.defaults().modelFor(AppFamily.CLAUDE), body.get("model").asText());
    }

    @Test
    void invalidateForcesFreshProbe() {
        var client = new ScriptedUpstreamClient(r -> respond(200, "{}"));
        var engine = engine(client);
        engine.probe(candidate(), ctx);
        engine.invalidate(candidate());
        engine.probe(candidate(), ctx);
        assertEquals(2, client.sent().size());
    }

    @Test
    void cancelledContextSendsNothing() {
        var client = new ScriptedUpstreamClient(r -> respond(200, "{}"));
        ctx.cancel();
        assertThrows(DispatchCancelledException.class, () -> engine(client).probe(candidate(), ctx));
        assertTrue(client.sent().isEmpty());
    }

    @Test
    void outcomesAreCounted() {
        Function<OutboundRequest, CompletableFuture<UpstreamResponse>> script = r -> respond(502, "bad gateway");
        var engine = engine(new ScriptedUpstreamClient(script));
        engine.probe(candidate(), ctx);
        engine.probe(candidate(), ctx);

        assertEquals(1.0, metrics.probes("failed").count());
        assertEquals(1.0, metrics.probes("cached").count());
        assertEquals(0.0, metrics.probes("passed").count());
    }

    @Test
    void cacheEntriesExpireAtTtl() {
        var cache = new ProbeCache(Duration.ofSeconds(60), clock);
        var key = candidate().breakerKey();
        cache.put(key, ProbeOutcome.passed(clock.instant()));
        assertTrue(cache.get(key).orElseThrow().cached());

        clock.advance(Duration.ofSeconds(60));
        assertTrue(cache.get(key).isEmpty());
        assertEquals(0, cache.size());
    }

    private ProbeRetryEngine engine(ScriptedUpstreamClient client) {
        var cache = new ProbeCache(Duration.ofSeconds(60), clock);
        return new ProbeRetryEngine(new TransparentRouter(RouterConfig.defaults()), client, cache, health,
                WafBypassHandler.withDefaults(), ProbeConfig.defaults(), metrics, clock);
    }

    private Candidate candidate() {
        var provider = registry.find("relay-1").orElseThrow();
        return new Candidate(provider, provider.endpoints().get(0));
    }
}
