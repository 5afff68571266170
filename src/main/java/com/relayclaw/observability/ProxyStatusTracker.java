package com.relayclaw.observability;

import com.relayclaw.shared.model.AppFamily;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running counters for the status endpoint.
 */
public class ProxyStatusTracker {

    public record CurrentProvider(String id, String name) {}

    public record Status(
        String address,
        int port,
        int activeConnections,
        long totalRequests,
        long successRequests,
        long failedRequests,
        double successRate,
        long uptimeSeconds,
        Instant lastRequestAt,
        String lastError,
        long failoverCount,
        Map<AppFamily, CurrentProvider> currentProviders
    ) {}

    private final String address;
    private final int port;
    private final Clock clock;
    private final Instant startedAt;

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong success = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong failovers = new AtomicLong();
    private final AtomicReference<Instant> lastRequestAt = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final Map<AppFamily, CurrentProvider> current = new EnumMap<>(AppFamily.class);

    public ProxyStatusTracker(String address, int port, Clock clock) {
        this.address = address;
        this.port = port;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void requestStarted() {
        active.incrementAndGet();
        total.incrementAndGet();
        lastRequestAt.set(clock.instant());
    }

    public void requestFinished() {
        active.decrementAndGet();
    }

    public void recordSuccess(AppFamily family, String providerId, String providerName, boolean failedOver) {
        success.incrementAndGet();
        if (failedOver) failovers.incrementAndGet();
        lastError.set(null);
        synchronized (current) {
            current.put(family, new CurrentProvider(providerId, providerName));
        }
    }

    public void recordFailure(String error) {
        failed.incrementAndGet();
        lastError.set(error);
    }

    /** A failed attempt that was recovered from within the same request. */
    public void recordAttemptError(String error) {
        lastError.set(error);
    }

    public Status snapshot() {
        long t = total.get();
        long s = success.get();
        Map<AppFamily, CurrentProvider> providers;
        synchronized (current) {
            providers = Map.copyOf(current);
        }
        return new Status(address, port, active.get(), t, s, failed.get(),
                t == 0 ? 0.0 : s * 100.0 / t,
                Duration.between(startedAt, clock.instant()).toSeconds(),
                lastRequestAt.get(), lastError.get(), failovers.get(), providers);
    }
}
