package com.relayclaw.dispatch;

import com.relayclaw.shared.model.OutboundRequest;
import com.relayclaw.shared.model.UpstreamResponse;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one rewritten request upstream. The returned future completes exceptionally on
 * transport errors and timeouts; cancelling it abandons the exchange.
 */
public interface UpstreamClient {

    CompletableFuture<UpstreamResponse> send(OutboundRequest request, Duration timeout);
}
