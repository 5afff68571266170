package com.relayclaw.dispatch;

import com.relayclaw.providers.Candidate;
import com.relayclaw.shared.model.AppFamily;
import com.relayclaw.shared.model.UpstreamResponse;

/**
 * Answer returned to the caller together with the candidate that produced it.
 */
public record DispatchResult(
    AppFamily family,
    Candidate candidate,
    UpstreamResponse response,
    int attempts,
    long latencyMs
) {
    public boolean failedOver() {
        return attempts > 1;
    }
}
