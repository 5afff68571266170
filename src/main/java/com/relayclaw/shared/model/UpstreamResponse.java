package com.relayclaw.shared.model;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public record UpstreamResponse(
    int statusCode,
    Map<String, List<String>> headers,
    byte[] body
) {
    public UpstreamResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String header(String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return null;
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public static UpstreamResponse of(int statusCode, String contentType, String body) {
        return new UpstreamResponse(statusCode,
                Map.of("content-type", List.of(contentType)),
                body.getBytes(StandardCharsets.UTF_8));
    }
}
