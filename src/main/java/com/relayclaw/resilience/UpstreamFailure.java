package com.relayclaw.resilience;

import java.time.Duration;

/**
 * A classified upstream failure. {@code statusCode} is 0 when no response was received.
 */
public record UpstreamFailure(FailureKind kind, int statusCode, String message, Duration retryAfter) {

    public UpstreamFailure {
        retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public static UpstreamFailure network(String message) {
        return new UpstreamFailure(FailureKind.NETWORK_FAILURE, 0, message, Duration.ZERO);
    }

    public String describe() {
        return statusCode > 0 ? kind + " (" + statusCode + "): " + message : kind + ": " + message;
    }
}
