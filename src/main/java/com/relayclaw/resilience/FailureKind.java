package com.relayclaw.resilience;

/**
 * Upstream failure taxonomy. Every kind is recovered locally by failing over to the next
 * candidate; only exhaustion reaches the caller.
 */
public enum FailureKind {
    NETWORK_FAILURE,
    AUTH_FAILURE,
    WAF_CHALLENGE,
    RATE_LIMITED,
    UPSTREAM_ERROR
}
