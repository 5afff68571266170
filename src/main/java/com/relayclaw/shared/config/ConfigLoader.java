package com.relayclaw.shared.config;

import com.relayclaw.shared.model.AppFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".relayclaw", "config.yaml"
    );

    public static RelayClawConfig load() {
        var override = System.getenv("RELAYCLAW_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static RelayClawConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var proxy = (Map<String, Object>) raw.getOrDefault("proxy", Map.of());
        var breaker = (Map<String, Object>) raw.getOrDefault("breaker", Map.of());
        var probe = (Map<String, Object>) raw.getOrDefault("probe", Map.of());
        var router = (Map<String, Object>) raw.getOrDefault("router", Map.of());
        var providers = (List<Object>) raw.getOrDefault("providers", List.of());

        return new RelayClawConfig(
            parseProxyConfig(proxy),
            parseBreakerConfig(breaker),
            parseProbeConfig(probe),
            parseRouterConfig(router),
            parseProviders(providers)
        );
    }

    private static ProxyConfig parseProxyConfig(Map<String, Object> proxy) {
        var d = ProxyConfig.defaults();
        return new ProxyConfig(
            String.valueOf(proxy.getOrDefault("listen-address", d.listenAddress())),
            Integer.parseInt(envOrDefault("RELAYCLAW_PORT",
                String.valueOf(proxy.getOrDefault("port", d.listenPort())))),
            intValue(proxy.getOrDefault("max-attempts", d.maxAttempts())),
            longValue(proxy.getOrDefault("request-timeout", d.requestTimeoutSeconds())),
            longValue(proxy.getOrDefault("connect-timeout", d.connectTimeoutSeconds())),
            longValue(proxy.getOrDefault("registry-refresh", d.registryRefreshSeconds())),
            intValue(proxy.getOrDefault("dispatch-threads", d.dispatchThreads()))
        );
    }

    private static BreakerConfig parseBreakerConfig(Map<String, Object> breaker) {
        var d = BreakerConfig.defaults();
        return new BreakerConfig(
            intValue(breaker.getOrDefault("failure-threshold", d.failureThreshold())),
            longValue(breaker.getOrDefault("open-seconds", d.openSeconds()))
        );
    }

    @SuppressWarnings("unchecked")
    private static ProbeConfig parseProbeConfig(Map<String, Object> probe) {
        var d = ProbeConfig.defaults();
        var models = new EnumMap<AppFamily, String>(AppFamily.class);
        var rawModels = (Map<String, Object>) probe.getOrDefault("models", Map.of());
        rawModels.forEach((k, v) -> models.put(AppFamily.parse(k), String.valueOf(v)));
        return new ProbeConfig(
            Boolean.TRUE.equals(probe.getOrDefault("enabled", d.enabled())),
            longValue(probe.getOrDefault("cache-ttl", d.cacheTtlSeconds())),
            longValue(probe.getOrDefault("timeout", d.timeoutSeconds())),
            models
        );
    }

    @SuppressWarnings("unchecked")
    private static RouterConfig parseRouterConfig(Map<String, Object> router) {
        var d = RouterConfig.defaults();
        var headers = new HashMap<String, String>();
        var rawHeaders = (Map<String, Object>) router.getOrDefault("custom-headers", Map.of());
        rawHeaders.forEach((k, v) -> headers.put(k, String.valueOf(v)));
        var prompt = (Map<String, Object>) router.getOrDefault("system-prompt", Map.of());
        var replacement = prompt.get("replacement");
        return new RouterConfig(
            headers,
            replacement == null ? null : String.valueOf(replacement),
            String.valueOf(prompt.getOrDefault("keyword", d.systemPromptKeyword())),
            Boolean.TRUE.equals(prompt.getOrDefault("insert-if-missing", d.insertIfMissing()))
        );
    }

    @SuppressWarnings("unchecked")
    private static List<ProviderEntry> parseProviders(List<Object> providers) {
        var out = new ArrayList<ProviderEntry>();
        for (int i = 0; i < providers.size(); i++) {
            var item = providers.get(i);
            if (!(item instanceof Map)) {
                log.warn("Skipping provider entry #{}: not a mapping", i);
                continue;
            }
            try {
                out.add(parseProvider((Map<String, Object>) item));
            } catch (RuntimeException e) {
                log.warn("Skipping provider entry #{}: {}", i, e.getMessage());
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    static ProviderEntry parseProvider(Map<String, Object> p) {
        var name = stringOrNull(p.get("name"));
        var latency = new HashMap<String, Long>();
        var rawLatency = (Map<String, Object>) p.getOrDefault("url-latency", Map.of());
        rawLatency.forEach((k, v) -> latency.put(k, longValue(v)));
        return new ProviderEntry(
            stringOrNull(p.get("id")),
            name,
            String.valueOf(p.getOrDefault("group", name == null ? "" : name)),
            stringOrNull(p.get("family")),
            stringList(p, "urls", "url"),
            stringList(p, "keys", "key"),
            !Boolean.FALSE.equals(p.getOrDefault("batch", true)),
            intValue(p.getOrDefault("rotation-tier", 0)),
            intValue(p.getOrDefault("url-priority", 0)),
            intValue(p.getOrDefault("group-priority", 0)),
            p.containsKey("sort-index") ? intValue(p.get("sort-index")) : null,
            longValue(p.getOrDefault("cooldown-duration", ProviderEntry.DEFAULT_COOLDOWN_SECONDS)),
            p.containsKey("cooldown-until") ? longValue(p.get("cooldown-until")) : null,
            longValue(p.getOrDefault("usage-count", 0)),
            p.containsKey("last-used-at") ? longValue(p.get("last-used-at")) : null,
            latency,
            ModelMapping.fromMap((Map<String, Object>) p.getOrDefault("model-mapping", Map.of()))
        );
    }

    private static List<String> stringList(Map<String, Object> p, String plural, String singular) {
        var v = p.containsKey(plural) ? p.get(plural) : p.get(singular);
        if (v == null) return List.of();
        if (v instanceof List<?> list) {
            return list.stream().map(String::valueOf).map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        var out = new ArrayList<String>();
        for (var part : String.valueOf(v).split(",")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    private static String stringOrNull(Object v) {
        return v == null ? null : String.valueOf(v);
    }

    private static int intValue(Object v) {
        return Integer.parseInt(String.valueOf(v).trim());
    }

    private static long longValue(Object v) {
        return Long.parseLong(String.valueOf(v).trim());
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
