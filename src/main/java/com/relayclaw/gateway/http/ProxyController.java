package com.relayclaw.gateway.http;

import com.relayclaw.dispatch.DispatchCancelledException;
import com.relayclaw.dispatch.DispatchContext;
import com.relayclaw.dispatch.RequestDispatcher;
import com.relayclaw.shared.config.RelayClawConfig;
import com.relayclaw.shared.model.InboundRequest;
import com.relayclaw.shared.model.UpstreamResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single HTTP surface for all three families. The dispatch runs on the dispatch pool so
 * servlet threads never block on upstream I/O.
 */
@RestController
public class ProxyController {

    private static final Logger log = LoggerFactory.getLogger(ProxyController.class);

    private static final Set<String> RESPONSE_HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "trailers", "transfer-encoding", "upgrade", "content-length");

    private final RequestDispatcher dispatcher;
    private final ExecutorService executor;
    private final long timeoutMs;

    public ProxyController(RequestDispatcher dispatcher,
                           @Qualifier("dispatchExecutor") ExecutorService executor,
                           RelayClawConfig config) {
        this.dispatcher = dispatcher;
        this.executor = executor;
        // 每次尝试最多一个完整超时，再留出探测时间
        var proxy = config.proxy();
        this.timeoutMs = (proxy.requestTimeoutSeconds() * proxy.maxAttempts()
                + config.probe().timeoutSeconds() * proxy.maxAttempts()) * 1000L;
    }

    @RequestMapping("/**")
    public DeferredResult<ResponseEntity<byte[]>> proxy(HttpServletRequest request,
                                                        @RequestBody(required = false) byte[] body) {
        var inbound = toInbound(request, body);
        var requestId = MDC.get(RequestIdFilter.MDC_KEY);
        var ctx = new DispatchContext(requestId != null ? requestId : UUID.randomUUID().toString());

        var result = new DeferredResult<ResponseEntity<byte[]>>(timeoutMs);
        result.onTimeout(() -> {
            ctx.cancel();
            result.setErrorResult(new DispatchCancelledException("Request " + ctx.requestId() + " timed out"));
        });
        result.onError(e -> {
            log.debug("Caller connection error, cancelling {}: {}", ctx.requestId(), e.getMessage());
            ctx.cancel();
        });

        var mdc = MDC.getCopyOfContextMap();
        try {
            executor.execute(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    var dispatched = dispatcher.dispatch(inbound, ctx);
                    result.setResult(toResponse(dispatched.response()));
                } catch (RuntimeException e) {
                    result.setErrorResult(e);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch pool rejected request {}", ctx.requestId());
            result.setErrorResult(e);
        }
        return result;
    }

    static InboundRequest toInbound(HttpServletRequest request, byte[] body) {
        var headers = new LinkedHashMap<String, List<String>>();
        for (var name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }
        return new InboundRequest(request.getMethod(), request.getRequestURI(), request.getQueryString(),
                headers, body);
    }

    static ResponseEntity<byte[]> toResponse(UpstreamResponse response) {
        var headers = new HttpHeaders();
        response.headers().forEach((name, values) -> {
            if (name == null || name.startsWith(":")) return;
            if (RESPONSE_HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) return;
            headers.put(name, values);
        });
        return ResponseEntity.status(response.statusCode()).headers(headers).body(response.body());
    }
}
