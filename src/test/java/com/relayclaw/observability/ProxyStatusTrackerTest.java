package com.relayclaw.observability;

import com.relayclaw.MutableClock;
import com.relayclaw.shared.model.AppFamily;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProxyStatusTrackerTest {

    @Test
    void emptyTrackerReportsZeroRate() {
        var clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        var status = new ProxyStatusTracker("127.0.0.1", 15721, clock).snapshot();
        assertEquals(0, status.totalRequests());
        assertEquals(0.0, status.successRate());
        assertNull(status.lastRequestAt());
        assertTrue(status.currentProviders().isEmpty());
    }

    @Test
    void countsRequestsAndFailovers() {
        var clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        var tracker = new ProxyStatusTracker("127.0.0.1", 15721, clock);

        tracker.requestStarted();
        tracker.recordAttemptError("relay-1: UPSTREAM_ERROR (500)");
        tracker.recordSuccess(AppFamily.CLAUDE, "relay-2", "relay", true);
        tracker.requestFinished();

        tracker.requestStarted();
        tracker.recordFailure("All providers failed");
        tracker.requestFinished();

        tracker.requestStarted();
        clock.advance(Duration.ofSeconds(90));

        var status = tracker.snapshot();
        assertEquals(3, status.totalRequests());
        assertEquals(1, status.successRequests());
        assertEquals(1, status.failedRequests());
        assertEquals(1, status.activeConnections());
        assertEquals(1, status.failoverCount());
        assertEquals(100.0 / 3, status.successRate(), 0.0001);
        assertEquals(90, status.uptimeSeconds());
        assertEquals("All providers failed", status.lastError());
        assertEquals("relay-2", status.currentProviders().get(AppFamily.CLAUDE).id());
    }

    @Test
    void successClearsLastError() {
        var tracker = new ProxyStatusTracker("127.0.0.1", 15721, MutableClock.startingAt("2025-01-01T00:00:00Z"));
        tracker.recordFailure("boom");
        tracker.recordSuccess(AppFamily.GEMINI, "g-1", "google", false);
        var status = tracker.snapshot();
        assertNull(status.lastError());
        assertEquals(0, status.failoverCount());
    }
}
