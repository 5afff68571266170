package com.relayclaw.shared.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request rewritten for one concrete upstream candidate.
 */
public record OutboundRequest(
    String method,
    String url,
    Map<String, String> headers,
    byte[] body
) {
    public OutboundRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public OutboundRequest withHeader(String name, String value) {
        var copy = new LinkedHashMap<>(headers);
        copy.keySet().removeIf(k -> k.equalsIgnoreCase(name));
        copy.put(name, value);
        return new OutboundRequest(method, url, copy, body);
    }

    public String header(String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }
}
