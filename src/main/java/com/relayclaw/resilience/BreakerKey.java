package com.relayclaw.resilience;

import com.relayclaw.providers.Endpoint;

/**
 * Identity of one circuit breaker: (provider, URL, key).
 */
public record BreakerKey(String providerId, String url, String apiKey) {

    @Override
    public String toString() {
        return providerId + "@" + url + "#" + Endpoint.maskKey(apiKey);
    }
}
