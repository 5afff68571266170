package com.relayclaw.resilience;

import java.time.Instant;

/**
 * Verdict of one probe. {@code failure} is null when the probe passed.
 */
public record ProbeOutcome(boolean passed, UpstreamFailure failure, Instant probedAt, boolean cached) {

    public static ProbeOutcome passed(Instant at) {
        return new ProbeOutcome(true, null, at, false);
    }

    public static ProbeOutcome failed(UpstreamFailure failure, Instant at) {
        return new ProbeOutcome(false, failure, at, false);
    }

    public ProbeOutcome fromCache() {
        return new ProbeOutcome(passed, failure, probedAt, true);
    }
}
