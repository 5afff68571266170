package com.relayclaw.shared.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A caller request as received by the proxy listener. Header names are kept as sent;
 * lookups are case-insensitive.
 */
public record InboundRequest(
    String method,
    String path,
    String query,
    Map<String, List<String>> headers,
    byte[] body
) {
    public InboundRequest {
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        path = path == null || path.isEmpty() ? "/" : path;
        headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
        body = body == null ? new byte[0] : body;
    }

    public InboundRequest(String method, String path, Map<String, List<String>> headers, byte[] body) {
        this(method, path, null, headers, body);
    }

    public String header(String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return null;
    }

    public boolean hasBody() {
        return body.length > 0;
    }
}
