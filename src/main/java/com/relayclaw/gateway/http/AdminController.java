package com.relayclaw.gateway.http;

import com.relayclaw.observability.ProxyStatusTracker;
import com.relayclaw.providers.Endpoint;
import com.relayclaw.providers.ProviderBatch;
import com.relayclaw.providers.ProviderRegistry;
import com.relayclaw.providers.ProviderSelector;
import com.relayclaw.resilience.CircuitBreakerRegistry;
import com.relayclaw.resilience.CircuitState;
import com.relayclaw.resilience.CooldownManager;
import com.relayclaw.shared.model.AppFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Local management surface: cooldowns, breakers, candidate ranking and proxy status.
 * API keys never leave the process unmasked.
 */
@RestController
@RequestMapping("/relay")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    public record BreakerView(String providerId, String url, String apiKey, CircuitState state,
                              int consecutiveFailures, Instant openedAt, Instant heldUntil) {}

    public record RankedView(int rank, String providerId, String name, String group, String url,
                             String apiKey, int rotationTier, int urlPriority, long usageCount,
                             Long latencyMs, boolean eligible) {}

    public record BatchRequest(String name, String group, String family, List<String> urls, List<String> keys,
                               Integer rotationTier, Integer sortIndex, Long cooldownSeconds) {}

    private final CooldownManager cooldowns;
    private final ProxyStatusTracker status;
    private final CircuitBreakerRegistry breakers;
    private final ProviderSelector selector;
    private final ProviderRegistry registry;

    public AdminController(CooldownManager cooldowns, ProxyStatusTracker status, CircuitBreakerRegistry breakers,
                           ProviderSelector selector, ProviderRegistry registry) {
        this.cooldowns = cooldowns;
        this.status = status;
        this.breakers = breakers;
        this.selector = selector;
        this.registry = registry;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/status")
    public ProxyStatusTracker.Status status() {
        return status.snapshot();
    }

    @GetMapping("/cooldowns")
    public List<CooldownManager.CooldownEntry> cooldowns() {
        return cooldowns.list();
    }

    @PutMapping("/cooldowns/{providerId}")
    public Map<String, Object> setCooldown(@PathVariable String providerId, @RequestParam double hours) {
        var until = cooldowns.set(providerId, hours);
        var out = new LinkedHashMap<String, Object>();
        out.put("providerId", providerId);
        out.put("cooldownUntil", until);
        return out;
    }

    @DeleteMapping("/cooldowns/{providerId}")
    public Map<String, Object> clearCooldown(@PathVariable String providerId) {
        boolean cleared = cooldowns.clear(providerId);
        var out = new LinkedHashMap<String, Object>();
        out.put("providerId", providerId);
        out.put("cleared", cleared);
        return out;
    }

    @GetMapping("/breakers")
    public List<BreakerView> breakers() {
        return breakers.snapshot().stream()
                .map(s -> new BreakerView(s.key().providerId(), s.key().url(), Endpoint.maskKey(s.key().apiKey()),
                        s.state(), s.consecutiveFailures(), s.openedAt(), s.heldUntil()))
                .toList();
    }

    @DeleteMapping("/breakers/{providerId}")
    public Map<String, Object> resetBreakers(@PathVariable String providerId) {
        int reset = breakers.reset(providerId);
        log.info("Reset {} breaker(s) of provider {}", reset, providerId);
        var out = new LinkedHashMap<String, Object>();
        out.put("providerId", providerId);
        out.put("reset", reset);
        return out;
    }

    @GetMapping("/providers/{family}")
    public List<RankedView> ranking(@PathVariable String family) {
        var rankings = selector.rankings(AppFamily.parse(family));
        var out = new ArrayList<RankedView>(rankings.size());
        for (int i = 0; i < rankings.size(); i++) {
            var r = rankings.get(i);
            var c = r.candidate();
            long latency = r.state().latencyMs(c.url());
            out.add(new RankedView(i + 1, c.provider().id(), c.provider().name(), c.group(), c.url(),
                    Endpoint.maskKey(c.apiKey()), c.provider().rotationTier(), c.endpoint().urlPriority(),
                    r.state().usageCount(), latency == Long.MAX_VALUE ? null : latency, r.eligible()));
        }
        return out;
    }

    @DeleteMapping("/providers/{providerId}/usage")
    public Map<String, Object> resetUsage(@PathVariable String providerId) {
        if (!registry.resetUsage(providerId)) {
            throw new NoSuchElementException("Unknown provider: " + providerId);
        }
        log.info("Usage counter of provider {} reset", providerId);
        var out = new LinkedHashMap<String, Object>();
        out.put("providerId", providerId);
        out.put("usageCount", 0);
        return out;
    }

    @PostMapping("/providers/batch")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> createBatch(@RequestBody BatchRequest request) {
        var entries = ProviderBatch.create(
                request.name(),
                request.group(),
                AppFamily.parse(request.family()),
                request.urls() == null ? List.of() : request.urls(),
                request.keys() == null ? List.of() : request.keys(),
                request.rotationTier() == null ? 0 : request.rotationTier(),
                request.sortIndex(),
                request.cooldownSeconds() == null ? null : Duration.ofSeconds(request.cooldownSeconds()));
        var ids = registry.add(entries);
        log.info("Created {} provider(s) in group {}", ids.size(), request.group());
        return Map.of("ids", ids);
    }
}
