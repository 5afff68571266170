package com.relayclaw.observability;

import com.relayclaw.shared.model.AppFamily;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter requests(AppFamily family, String outcome) {
        return Counter.builder("relayclaw.requests")
                .tag("family", family.id())
                .tag("outcome", outcome)
                .register(registry);
    }

    public Counter failovers(AppFamily family) {
        return Counter.builder("relayclaw.failovers").tag("family", family.id()).register(registry);
    }

    public Counter probes(String outcome) {
        return Counter.builder("relayclaw.probes").tag("outcome", outcome).register(registry);
    }

    public Counter wafBypasses(String vendor, String outcome) {
        return Counter.builder("relayclaw.waf.bypasses")
                .tag("vendor", vendor)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Counter exhausted(AppFamily family) {
        return Counter.builder("relayclaw.exhausted").tag("family", family.id()).register(registry);
    }

    public Timer upstreamLatency(AppFamily family) {
        return Timer.builder("relayclaw.upstream.latency").tag("family", family.id()).register(registry);
    }

    public void recordLatency(AppFamily family, long millis) {
        upstreamLatency(family).record(Duration.ofMillis(millis));
    }
}
