package com.relayclaw.providers;

import com.relayclaw.resilience.BreakerKey;
import com.relayclaw.shared.model.AppFamily;

/**
 * One routable target: a provider together with one of its endpoints. Identity within a
 * dispatch (exclusion, probe cache, breaker) is {@link #breakerKey()}.
 */
public record Candidate(Provider provider, Endpoint endpoint) {

    public String url() {
        return endpoint.url();
    }

    public String apiKey() {
        return endpoint.apiKey();
    }

    public String group() {
        return provider.group();
    }

    public AppFamily family() {
        return provider.family();
    }

    public BreakerKey breakerKey() {
        return new BreakerKey(provider.id(), endpoint.url(), endpoint.apiKey());
    }

    @Override
    public String toString() {
        return provider.name() + "(" + provider.id() + ")@" + endpoint.url();
    }
}
