package com.relayclaw.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
