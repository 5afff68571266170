package com.relayclaw.dispatch;

import com.relayclaw.observability.ProxyStatusTracker;
import com.relayclaw.observability.RelayMetrics;
import com.relayclaw.providers.Candidate;
import com.relayclaw.providers.ProviderSelector;
import com.relayclaw.resilience.BreakerKey;
import com.relayclaw.resilience.FailureClassifier;
import com.relayclaw.resilience.FailureKind;
import com.relayclaw.resilience.HealthRecorder;
import com.relayclaw.resilience.ProbeRetryEngine;
import com.relayclaw.resilience.UpstreamFailure;
import com.relayclaw.routing.TransparentRouter;
import com.relayclaw.shared.config.ProxyConfig;
import com.relayclaw.shared.model.AppFamily;
import com.relayclaw.shared.model.InboundRequest;
import com.relayclaw.shared.model.RelayException;
import com.relayclaw.shared.model.UpstreamResponse;
import com.relayclaw.waf.WafBypassHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Drives one inbound request through classify, select, (probe), send and record until a
 * candidate answers or the attempt bound is reached.
 * <p>
 * Each candidate is selected at most once per request, and at most {@code maxAttempts}
 * candidates are selected, so the loop always terminates. After the first failed full
 * request every further candidate is probed before it gets the full request.
 */
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    /** Result of one SEND: exactly one of response / failure is set. */
    private record Attempt(UpstreamResponse response, UpstreamFailure failure, long latencyMs) {
        static Attempt answered(UpstreamResponse response, long latencyMs) {
            return new Attempt(response, null, latencyMs);
        }

        static Attempt failed(UpstreamFailure failure) {
            return new Attempt(null, failure, -1);
        }
    }

    private final TransparentRouter router;
    private final ProviderSelector selector;
    private final UpstreamClient client;
    private final HealthRecorder health;
    private final ProbeRetryEngine probes;
    private final WafBypassHandler waf;
    private final RelayMetrics metrics;
    private final ProxyStatusTracker status;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration requestTimeout;

    public RequestDispatcher(TransparentRouter router, ProviderSelector selector, UpstreamClient client,
                             HealthRecorder health, ProbeRetryEngine probes, WafBypassHandler waf,
                             RelayMetrics metrics, ProxyStatusTracker status, ProxyConfig config, Clock clock) {
        this.router = router;
        this.selector = selector;
        this.client = client;
        this.health = health;
        this.probes = probes;
        this.waf = waf;
        this.metrics = metrics;
        this.status = status;
        this.clock = clock;
        this.maxAttempts = Math.max(1, config.maxAttempts());
        this.requestTimeout = Duration.ofSeconds(config.requestTimeoutSeconds());
    }

    public DispatchResult dispatch(InboundRequest request, DispatchContext ctx) {
        status.requestStarted();
        try {
            return run(request, ctx);
        } catch (DispatchCancelledException e) {
            log.info("Request {} cancelled by caller, stopping failover", ctx.requestId());
            status.recordFailure(e.getMessage());
            throw e;
        } catch (RelayException e) {
            status.recordFailure(e.getMessage());
            throw e;
        } finally {
            status.requestFinished();
        }
    }

    private DispatchResult run(InboundRequest request, DispatchContext ctx) {
        var state = DispatchState.CLASSIFY;
        AppFamily family = null;
        Candidate candidate = null;
        Attempt attempt = null;
        Set<BreakerKey> tried = new HashSet<>();
        List<String> failures = new ArrayList<>();
        int selections = 0;
        int fullFailures = 0;

        while (true) {
            switch (state) {
                case CLASSIFY -> {
                    family = router.classify(request);
                    log.debug("{} {} classified as {}", request.method(), request.path(), family.id());
                    state = DispatchState.SELECT_CANDIDATE;
                }
                case SELECT_CANDIDATE -> {
                    ctx.checkCancelled();
                    var next = selections < maxAttempts ? selector.next(family, tried) : Optional.<Candidate>empty();
                    if (next.isEmpty()) {
                        state = DispatchState.EXHAUSTED;
                    } else {
                        candidate = next.get();
                        tried.add(candidate.breakerKey());
                        selections++;
                        log.debug("Attempt {}/{}: {}", selections, maxAttempts, candidate);
                        state = fullFailures > 0 && probes.enabled() ? DispatchState.PROBE_NEXT : DispatchState.SEND;
                    }
                }
                case PROBE_NEXT -> {
                    var outcome = probes.probe(candidate, ctx);
                    if (outcome.passed()) {
                        state = DispatchState.SEND;
                    } else {
                        var msg = candidate + " (probe" + (outcome.cached() ? ", cached" : "") + "): "
                                + outcome.failure().describe();
                        failures.add(msg);
                        status.recordAttemptError(msg);
                        state = DispatchState.SELECT_CANDIDATE;
                    }
                }
                case SEND -> {
                    attempt = send(request, candidate, family, ctx);
                    state = attempt.response() != null ? DispatchState.DONE : DispatchState.RECORD_FAILURE;
                }
                case RECORD_FAILURE -> {
                    fullFailures++;
                    health.recordFailure(candidate, attempt.failure());
                    probes.invalidate(candidate);
                    var msg = candidate + ": " + attempt.failure().describe();
                    failures.add(msg);
                    status.recordAttemptError(msg);
                    state = DispatchState.SELECT_CANDIDATE;
                }
                case DONE -> {
                    return finish(family, candidate, attempt, selections);
                }
                case EXHAUSTED -> {
                    metrics.exhausted(family).increment();
                    metrics.requests(family, "exhausted").increment();
                    log.warn("[{}] No provider left after {} attempt(s)", family.id(), selections);
                    throw new ProviderExhaustedException(family, failures);
                }
            }
        }
    }

    private DispatchResult finish(AppFamily family, Candidate candidate, Attempt attempt, int selections) {
        var response = attempt.response();
        if (!response.isSuccess()) {
            // 调用方自身的错误：原样返回，不计入健康状态
            log.debug("Upstream rejected the request itself ({}), returning it unchanged", response.statusCode());
            metrics.requests(family, "rejected").increment();
            status.recordFailure("Upstream rejected request: HTTP " + response.statusCode());
            return new DispatchResult(family, candidate, response, selections, attempt.latencyMs());
        }
        health.recordSuccess(candidate, attempt.latencyMs());
        metrics.recordLatency(family, attempt.latencyMs());
        metrics.requests(family, "success").increment();
        boolean failedOver = selections > 1;
        if (failedOver) {
            metrics.failovers(family).increment();
            log.info("[{}] Recovered via {} after {} attempt(s)", family.id(), candidate, selections);
        }
        status.recordSuccess(family, candidate.provider().id(), candidate.provider().name(), failedOver);
        return new DispatchResult(family, candidate, response, selections, attempt.latencyMs());
    }

    private Attempt send(InboundRequest request, Candidate candidate, AppFamily family, DispatchContext ctx) {
        var outbound = router.rewrite(request, candidate);
        long start = clock.millis();
        UpstreamResponse response;
        try {
            response = ctx.await(client.send(outbound, requestTimeout));
        } catch (CompletionException e) {
            return Attempt.failed(FailureClassifier.classify(e));
        }

        var solver = waf.detect(response);
        if (solver.isPresent()) {
            var vendor = solver.get().vendor();
            var retry = waf.prepareRetry(outbound, response);
            if (retry.isEmpty()) {
                metrics.wafBypasses(vendor, "unsolved").increment();
                return Attempt.failed(new UpstreamFailure(FailureKind.WAF_CHALLENGE, response.statusCode(),
                        vendor + " challenge could not be solved", Duration.ZERO));
            }
            ctx.checkCancelled();
            try {
                response = ctx.await(client.send(retry.get().request(), requestTimeout));
            } catch (CompletionException e) {
                metrics.wafBypasses(vendor, "failed").increment();
                return Attempt.failed(FailureClassifier.classify(e));
            }
            if (waf.isChallenge(response)) {
                metrics.wafBypasses(vendor, "failed").increment();
                return Attempt.failed(new UpstreamFailure(FailureKind.NETWORK_FAILURE, response.statusCode(),
                        vendor + " challenge persisted after bypass", Duration.ZERO));
            }
            metrics.wafBypasses(vendor, response.isSuccess() ? "solved" : "failed").increment();
        }

        long latency = clock.millis() - start;
        if (response.isSuccess() || FailureClassifier.isCallerFault(response.statusCode())) {
            return Attempt.answered(response, latency);
        }
        var failure = FailureClassifier.classify(response)
                .orElseThrow(() -> new IllegalStateException("Non-success response without failure"));
        log.debug("[{}] {} answered {} in {} ms", family.id(), candidate, response.statusCode(), latency);
        return Attempt.failed(failure);
    }
}
