package com.relayclaw.shared.config;

import java.util.List;

public record RelayClawConfig(
    ProxyConfig proxy,
    BreakerConfig breaker,
    ProbeConfig probe,
    RouterConfig router,
    List<ProviderEntry> providers
) {
    public RelayClawConfig {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public static RelayClawConfig defaults() {
        return new RelayClawConfig(ProxyConfig.defaults(), BreakerConfig.defaults(),
                ProbeConfig.defaults(), RouterConfig.defaults(), List.of());
    }
}
