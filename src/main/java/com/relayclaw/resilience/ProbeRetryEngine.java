package com.relayclaw.resilience;

import com.relayclaw.dispatch.DispatchContext;
import com.relayclaw.dispatch.UpstreamClient;
import com.relayclaw.observability.RelayMetrics;
import com.relayclaw.providers.Candidate;
import com.relayclaw.routing.TransparentRouter;
import com.relayclaw.shared.config.ProbeConfig;
import com.relayclaw.shared.model.UpstreamResponse;
import com.relayclaw.waf.WafBypassHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * Checks a failover candidate with a one-token request before a full retry is sent to it.
 * <p>
 * A fresh probe failure is booked like a full-request failure. A cached verdict is reused
 * without touching the network or re-booking anything. A passing probe changes no health
 * state: only the full request's own outcome closes a breaker.
 */
public class ProbeRetryEngine {

    private static final Logger log = LoggerFactory.getLogger(ProbeRetryEngine.class);

    private final TransparentRouter router;
    private final UpstreamClient client;
    private final ProbeCache cache;
    private final HealthRecorder health;
    private final WafBypassHandler waf;
    private final ProbeConfig config;
    private final RelayMetrics metrics;
    private final Clock clock;

    public ProbeRetryEngine(TransparentRouter router, UpstreamClient client, ProbeCache cache,
                            HealthRecorder health, WafBypassHandler waf, ProbeConfig config,
                            RelayMetrics metrics, Clock clock) {
        this.router = router;
        this.client = client;
        this.cache = cache;
        this.health = health;
        this.waf = waf;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    public boolean enabled() {
        return config.enabled();
    }

    public ProbeOutcome probe(Candidate candidate, DispatchContext ctx) {
        var key = candidate.breakerKey();
        var cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Probe cache hit for {}: {}", candidate, cached.get().passed() ? "passed" : "failed");
            metrics.probes("cached").increment();
            return cached.get();
        }

        ctx.checkCancelled();
        var request = router.probeRequest(candidate, config.modelFor(candidate.family()));
        UpstreamFailure failure;
        try {
            var response = ctx.await(client.send(request, Duration.ofSeconds(config.timeoutSeconds())));
            failure = judge(response);
        } catch (CompletionException e) {
            failure = FailureClassifier.classify(e);
        }

        var now = clock.instant();
        if (failure == null) {
            log.debug("Probe passed for {}", candidate);
            metrics.probes("passed").increment();
            var outcome = ProbeOutcome.passed(now);
            cache.put(key, outcome);
            return outcome;
        }
        log.info("Probe failed for {}, skipping it: {}", candidate, failure.describe());
        metrics.probes("failed").increment();
        health.recordFailure(candidate, failure);
        var outcome = ProbeOutcome.failed(failure, now);
        cache.put(key, outcome);
        return outcome;
    }

    /** Drops a cached verdict, e.g. after the promoted full request failed. */
    public void invalidate(Candidate candidate) {
        cache.invalidate(candidate.breakerKey());
    }

    /**
     * A challenge or a rejected probe body still proves the endpoint answers with this key;
     * the full request sorts those out.
     */
    private UpstreamFailure judge(UpstreamResponse response) {
        if (response.isSuccess() || waf.isChallenge(response)
                || FailureClassifier.isCallerFault(response.statusCode())) {
            return null;
        }
        return FailureClassifier.classify(response).orElse(null);
    }
}
