package com.relayclaw.gateway;

import com.relayclaw.dispatch.HttpUpstreamClient;
import com.relayclaw.dispatch.RequestDispatcher;
import com.relayclaw.dispatch.UpstreamClient;
import com.relayclaw.observability.ProxyStatusTracker;
import com.relayclaw.observability.RelayMetrics;
import com.relayclaw.providers.InMemoryProviderRepository;
import com.relayclaw.providers.ProviderRegistry;
import com.relayclaw.providers.ProviderSelector;
import com.relayclaw.resilience.CircuitBreakerRegistry;
import com.relayclaw.resilience.CooldownManager;
import com.relayclaw.resilience.HealthRecorder;
import com.relayclaw.resilience.ProbeCache;
import com.relayclaw.resilience.ProbeRetryEngine;
import com.relayclaw.routing.TransparentRouter;
import com.relayclaw.shared.config.ConfigLoader;
import com.relayclaw.shared.config.RelayClawConfig;
import com.relayclaw.waf.WafBypassHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine. Every component gets its collaborators passed in; the shared state
 * (registry, breakers, cooldown markers, probe cache) lives in exactly one instance each.
 */
@Configuration
public class RelayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RelayConfiguration.class);

    @Bean
    public RelayClawConfig relayClawConfig() {
        var config = ConfigLoader.load();
        log.info("Loaded {} provider entries", config.providers().size());
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Binds the listener to the configured loopback address and port. */
    @Bean
    public WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> listenerCustomizer(RelayClawConfig config) {
        return factory -> {
            try {
                factory.setAddress(InetAddress.getByName(config.proxy().listenAddress()));
            } catch (UnknownHostException e) {
                throw new IllegalStateException("Invalid listen address: " + config.proxy().listenAddress(), e);
            }
            factory.setPort(config.proxy().listenPort());
        };
    }

    @Bean(destroyMethod = "close")
    public ProviderRegistry providerRegistry(RelayClawConfig config, Clock clock) {
        var registry = new ProviderRegistry(new InMemoryProviderRepository(config.providers()), clock);
        int count = registry.refresh();
        registry.startAutoRefresh(Duration.ofSeconds(config.proxy().registryRefreshSeconds()));
        log.info("Provider registry ready with {} providers", count);
        return registry;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RelayClawConfig config, Clock clock) {
        return new CircuitBreakerRegistry(config.breaker(), clock);
    }

    @Bean
    public CooldownManager cooldownManager(ProviderRegistry registry) {
        return new CooldownManager(registry);
    }

    @Bean
    public HealthRecorder healthRecorder(ProviderRegistry registry, CircuitBreakerRegistry breakers,
                                         CooldownManager cooldowns) {
        return new HealthRecorder(registry, breakers, cooldowns);
    }

    @Bean
    public ProviderSelector providerSelector(ProviderRegistry registry, CircuitBreakerRegistry breakers) {
        return new ProviderSelector(registry, breakers);
    }

    @Bean
    public TransparentRouter transparentRouter(RelayClawConfig config) {
        return new TransparentRouter(config.router());
    }

    @Bean
    public WafBypassHandler wafBypassHandler() {
        return WafBypassHandler.withDefaults();
    }

    @Bean
    public RelayMetrics relayMetrics() {
        return new RelayMetrics();
    }

    @Bean
    public ProxyStatusTracker proxyStatusTracker(RelayClawConfig config, Clock clock) {
        return new ProxyStatusTracker(config.proxy().listenAddress(), config.proxy().listenPort(), clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService dispatchExecutor(RelayClawConfig config) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, config.proxy().dispatchThreads()), r -> {
            var t = new Thread(r, "relay-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public UpstreamClient upstreamClient(RelayClawConfig config) {
        return new HttpUpstreamClient(Duration.ofSeconds(config.proxy().connectTimeoutSeconds()));
    }

    @Bean
    public ProbeRetryEngine probeRetryEngine(RelayClawConfig config, TransparentRouter router, UpstreamClient client,
                                             HealthRecorder health, WafBypassHandler waf, RelayMetrics metrics,
                                             Clock clock) {
        var cache = new ProbeCache(Duration.ofSeconds(config.probe().cacheTtlSeconds()), clock);
        return new ProbeRetryEngine(router, client, cache, health, waf, config.probe(), metrics, clock);
    }

    @Bean
    public RequestDispatcher requestDispatcher(RelayClawConfig config, TransparentRouter router,
                                               ProviderSelector selector, UpstreamClient client,
                                               HealthRecorder health, ProbeRetryEngine probes,
                                               WafBypassHandler waf, RelayMetrics metrics,
                                               ProxyStatusTracker status, Clock clock) {
        return new RequestDispatcher(router, selector, client, health, probes, waf, metrics, status,
                config.proxy(), clock);
    }
}
