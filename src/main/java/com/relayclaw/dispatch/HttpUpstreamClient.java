package com.relayclaw.dispatch;

import com.relayclaw.shared.model.OutboundRequest;
import com.relayclaw.shared.model.UpstreamResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

public class HttpUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClient.class);

    private final HttpClient httpClient;

    public HttpUpstreamClient(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public CompletableFuture<UpstreamResponse> send(OutboundRequest request, Duration timeout) {
        HttpRequest httpReq;
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(request.url()))
                    .timeout(timeout)
                    .method(request.method(), request.body().length > 0
                            ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                            : HttpRequest.BodyPublishers.noBody());
            request.headers().forEach(builder::header);
            httpReq = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("-> {} {}", request.method(), request.url());
        var exchange = httpClient.sendAsync(httpReq, HttpResponse.BodyHandlers.ofByteArray());
        var mapped = exchange.thenApply(resp -> new UpstreamResponse(resp.statusCode(), resp.headers().map(), resp.body()));
        // 取消派生 future 时同时中止底层交换
        mapped.whenComplete((r, e) -> {
            if (mapped.isCancelled()) exchange.cancel(true);
        });
        return mapped;
    }
}
