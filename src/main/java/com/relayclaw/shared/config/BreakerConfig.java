package com.relayclaw.shared.config;

public record BreakerConfig(int failureThreshold, long openSeconds) {
    public BreakerConfig {
        if (failureThreshold < 1) throw new IllegalArgumentException("failure-threshold must be >= 1");
        if (openSeconds < 0) throw new IllegalArgumentException("open-seconds must be >= 0");
    }

    public static BreakerConfig defaults() {
        return new BreakerConfig(4, 60);
    }
}
