package com.relayclaw.dispatch;

import com.relayclaw.shared.model.OutboundRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class HttpUpstreamClientTest {

    private final HttpUpstreamClient client = new HttpUpstreamClient(Duration.ofSeconds(1));

    @Test
    void malformedUrlFailsWithoutSending() {
        var request = new OutboundRequest("POST", "ht tp://bad url", Map.of(), new byte[0]);
        var future = client.send(request, Duration.ofSeconds(1));
        assertTrue(future.isCompletedExceptionally());
        var ex = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void restrictedHeaderIsRejectedUpFront() {
        // Host 由 HttpClient 自己设置
        var request = new OutboundRequest("GET", "https://a.example.com/v1/models", Map.of("Host", "evil"),
                new byte[0]);
        assertTrue(client.send(request, Duration.ofSeconds(1)).isCompletedExceptionally());
    }
}
