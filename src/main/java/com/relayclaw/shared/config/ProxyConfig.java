package com.relayclaw.shared.config;

public record ProxyConfig(
    String listenAddress,
    int listenPort,
    int maxAttempts,
    long requestTimeoutSeconds,
    long connectTimeoutSeconds,
    long registryRefreshSeconds,
    int dispatchThreads
) {
    public static ProxyConfig defaults() {
        return new ProxyConfig("127.0.0.1", 15721, 3, 600, 10, 30, 32);
    }
}
