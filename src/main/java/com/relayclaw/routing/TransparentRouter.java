package com.relayclaw.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayclaw.providers.Candidate;
import com.relayclaw.shared.config.ModelMapping;
import com.relayclaw.shared.config.RouterConfig;
import com.relayclaw.shared.model.AppFamily;
import com.relayclaw.shared.model.InboundRequest;
import com.relayclaw.shared.model.OutboundRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies inbound requests into an {@link AppFamily} and rewrites them for one
 * concrete candidate. Both operations are pure: no I/O, no shared state.
 */
public class TransparentRouter {

    private static final Logger log = LoggerFactory.getLogger(TransparentRouter.class);

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "proxy-connection",
            "te", "trailer", "trailers", "transfer-encoding", "upgrade");
    // 由 HttpClient 自己管理或不允许设置的头
    private static final Set<String> DROPPED = Set.of("host", "content-length", "expect", "accept-encoding");
    private static final Set<String> CREDENTIALS = Set.of(
            "authorization", "x-api-key", "x-goog-api-key", "api-key");
    private static final Pattern VERSION_SEGMENT = Pattern.compile("v\\d+(?:alpha|beta)?\\d*");
    static final String DEFAULT_ANTHROPIC_VERSION = "2023-06-01";
    private static final String PROBE_PROMPT = "hi";

    private final RouterConfig config;
    private final ObjectMapper mapper = new ObjectMapper();

    public TransparentRouter(RouterConfig config) {
        this.config = config;
    }

    // ---- classification ----

    public AppFamily classify(InboundRequest request) {
        var path = request.path();
        var byTable = classifyByPath(path);
        if (byTable != null) return byTable;

        var body = parseObject(request.body());
        if (path.contains(":generateContent") || path.contains(":streamGenerateContent")
                || body != null && body.has("contents")) {
            return AppFamily.GEMINI;
        }
        if (path.startsWith("/v1/responses") || path.startsWith("/v1/completions")
                || body != null && (body.has("instructions") || body.has("input"))) {
            return AppFamily.CODEX;
        }
        if (request.header("anthropic-version") != null
                || body != null && (body.has("system") || body.has("anthropic_version"))) {
            return AppFamily.CLAUDE;
        }
        if (body != null && body.has("messages")) {
            return AppFamily.CODEX;
        }
        throw new UnclassifiedRequestException("Cannot determine application family for " + request.method() + " " + path);
    }

    /** Routing-table lookup only; null when the path names no family. */
    public static AppFamily classifyByPath(String path) {
        for (var family : AppFamily.values()) {
            var prefix = family.pathPrefix();
            if (path.equals(prefix) || path.startsWith(prefix + "/")) return family;
        }
        if (path.equals("/v1/messages")) return AppFamily.CLAUDE;
        if (path.equals("/v1/chat/completions")) return AppFamily.CODEX;
        if (path.startsWith("/v1beta/")) return AppFamily.GEMINI;
        return null;
    }

    // ---- rewriting ----

    public OutboundRequest rewrite(InboundRequest request, Candidate candidate) {
        var family = candidate.family();
        var url = targetUrl(candidate.url(), stripFamilyPrefix(request.path(), family), withoutKeyParam(request.query()));

        var headers = new LinkedHashMap<String, String>();
        request.headers().forEach((name, values) -> {
            var lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || DROPPED.contains(lower) || CREDENTIALS.contains(lower)) return;
            if (values.isEmpty()) return;
            headers.put(name, String.join(", ", values));
        });
        injectCredentials(headers, family, candidate.apiKey());
        config.customHeaders().forEach((k, v) -> put(headers, k, v));

        return new OutboundRequest(request.method(), url, headers, rewriteBody(request.body(), family, candidate.provider().modelMapping()));
    }

    /** Minimal request (one output token) used to check a candidate before a full retry. */
    public OutboundRequest probeRequest(Candidate candidate, String model) {
        var body = mapper.createObjectNode();
        String path = switch (candidate.family()) {
            case CLAUDE -> {
                body.put("model", model);
                body.put("max_tokens", 1);
                body.putArray("messages").addObject().put("role", "user").put("content", PROBE_PROMPT);
                yield "/v1/messages";
            }
            case CODEX -> {
                body.put("model", model);
                body.put("max_tokens", 1);
                body.putArray("messages").addObject().put("role", "user").put("content", PROBE_PROMPT);
                yield "/v1/chat/completions";
            }
            case GEMINI -> {
                var content = body.putArray("contents").addObject();
                content.put("role", "user");
                content.putArray("parts").addObject().put("text", PROBE_PROMPT);
                body.putObject("generationConfig").put("maxOutputTokens", 1);
                yield "/v1beta/models/" + model + ":generateContent";
            }
        };
        var inbound = new InboundRequest("POST", path,
                Map.of("Content-Type", List.of("application/json")), toBytes(body));
        return rewrite(inbound, candidate);
    }

    byte[] rewriteBody(byte[] raw, AppFamily family, ModelMapping mapping) {
        if (raw.length == 0) return raw;
        var body = parseObject(raw);
        if (body == null) return raw;
        boolean changed = SystemInstructions.relocate(body, family);
        if (family == AppFamily.CLAUDE) {
            changed |= SystemInstructions.applyReplacement(body, config);
            changed |= ModelRewriter.applyMapping(body, mapping);
        } else if (family == AppFamily.CODEX) {
            changed |= ModelRewriter.sanitizeModel(body);
        }
        if (!changed) return raw;
        log.debug("Request body rewritten for {}", family.id());
        return toBytes(body);
    }

    private static void injectCredentials(Map<String, String> headers, AppFamily family, String apiKey) {
        switch (family) {
            case CLAUDE -> {
                if (apiKey.startsWith("Bearer ")) {
                    put(headers, "Authorization", apiKey);
                } else {
                    put(headers, "x-api-key", apiKey);
                }
                if (headers.keySet().stream().noneMatch(k -> k.equalsIgnoreCase("anthropic-version"))) {
                    headers.put("anthropic-version", DEFAULT_ANTHROPIC_VERSION);
                }
            }
            case CODEX -> put(headers, "Authorization", apiKey.startsWith("Bearer ") ? apiKey : "Bearer " + apiKey);
            case GEMINI -> put(headers, "x-goog-api-key", apiKey);
        }
    }

    static String stripFamilyPrefix(String path, AppFamily family) {
        var prefix = family.pathPrefix();
        if (path.equals(prefix)) return "/";
        if (path.startsWith(prefix + "/")) return path.substring(prefix.length());
        return path;
    }

    /** Joins base URL and path, dropping a version segment both already carry ({@code /v1/v1}). */
    static String targetUrl(String baseUrl, String path, String query) {
        var base = baseUrl.replaceAll("/+$", "");
        var p = path.startsWith("/") ? path : "/" + path;
        var lastSegment = base.substring(base.lastIndexOf('/') + 1);
        if (VERSION_SEGMENT.matcher(lastSegment).matches()
                && (p.equals("/" + lastSegment) || p.startsWith("/" + lastSegment + "/"))) {
            p = p.substring(lastSegment.length() + 1);
            if (p.isEmpty()) p = "/";
        }
        var url = p.equals("/") ? base : base + p;
        return query == null || query.isEmpty() ? url : url + "?" + query;
    }

    static String withoutKeyParam(String query) {
        if (query == null || query.isEmpty()) return null;
        var kept = new ArrayList<String>();
        for (var part : query.split("&")) {
            if (part.isEmpty() || part.equals("key") || part.startsWith("key=")) continue;
            kept.add(part);
        }
        return kept.isEmpty() ? null : String.join("&", kept);
    }

    private static void put(Map<String, String> headers, String name, String value) {
        headers.keySet().removeIf(k -> k.equalsIgnoreCase(name));
        headers.put(name, value);
    }

    private ObjectNode parseObject(byte[] raw) {
        if (raw == null || raw.length == 0) return null;
        try {
            JsonNode node = mapper.readTree(raw);
            return node instanceof ObjectNode obj ? obj : null;
        } catch (IOException e) {
            log.debug("Body is not JSON, forwarding unchanged: {}", e.getMessage());
            return null;
        }
    }

    private byte[] toBytes(JsonNode node) {
        try {
            return mapper.writeValueAsString(node).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }
}
