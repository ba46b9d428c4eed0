package io.llmgate.core.gateway;

import io.llmgate.core.config.ConfigPaths;
import io.llmgate.core.config.model.AuditConfig;
import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.config.model.ProviderConfig;
import io.llmgate.core.config.model.RoutingConfig;
import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.model.Purpose;
import io.llmgate.core.observability.AuditEventSink;
import io.llmgate.core.observability.CompositeEventSink;
import io.llmgate.core.observability.FileAuditStore;
import io.llmgate.core.observability.GenerationEventSink;
import io.llmgate.core.observability.LoggingEventSink;
import io.llmgate.core.observability.ObservabilityService;
import io.llmgate.core.provider.OpenAiCompatProvider;
import io.llmgate.core.provider.ProviderRegistry;
import io.llmgate.core.route.RoutePolicy;
import io.llmgate.core.route.TimeoutPolicy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds an already-resolved {@link GatewayConfig} into a ready gateway.
 */
public final class GatewayFactory {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayFactory.class);

    private GatewayFactory() {
    }

    public static LlmGateway create(GatewayConfig config) {
        return create(config, defaultSink(config));
    }

    public static LlmGateway create(GatewayConfig config, GenerationEventSink sink) {
        Objects.requireNonNull(config, "config must not be null");
        ProviderRegistry registry = buildRegistry(config);
        RoutePolicy policy = buildPolicy(config.routing());
        TimeoutPolicy timeouts = buildTimeouts(config.routing());
        LOG.info(
            "Gateway ready providers={} enabled={} default_route={}",
            registry.names(),
            registry.enabledNames(),
            policy.defaultRoute()
        );
        return new LlmGateway(registry, policy, timeouts, sink);
    }

    public static ProviderRegistry buildRegistry(GatewayConfig config) {
        ProviderRegistry.Builder builder = ProviderRegistry.builder();
        for (ProviderConfig provider : config.providerConfigs()) {
            builder.register(
                new OpenAiCompatProvider(provider.name(), provider.apiKey(), provider.apiBase(), provider.model()),
                provider.active(),
                provider.timeoutMs()
            );
            if (Boolean.TRUE.equals(provider.enabled()) && !provider.active()) {
                LOG.warn("Provider {} is enabled but has no endpoint or model; skipping it in routes", provider.name());
            }
        }
        return builder.build();
    }

    public static RoutePolicy buildPolicy(RoutingConfig routing) {
        List<String> defaultRoute = routing.effectiveDefaultRoute();
        if (defaultRoute.stream().allMatch(String::isBlank)) {
            throw new ConfigurationException("No primary provider configured");
        }
        Map<Purpose, List<String>> routes = new EnumMap<>(Purpose.class);
        routing.routes().forEach((key, route) -> routes.put(purpose(key), new ArrayList<>(route)));
        return new RoutePolicy(routes, defaultRoute);
    }

    public static TimeoutPolicy buildTimeouts(RoutingConfig routing) {
        Map<Purpose, Long> timeouts = new EnumMap<>(Purpose.class);
        routing.purposeTimeoutsMs().forEach((key, timeout) -> timeouts.put(purpose(key), timeout));
        return new TimeoutPolicy(timeouts);
    }

    public static ObservabilityService observability(AuditConfig audit) {
        return new ObservabilityService(new FileAuditStore(ConfigPaths.resolve(audit.path())), Clock.systemUTC());
    }

    private static GenerationEventSink defaultSink(GatewayConfig config) {
        LoggingEventSink logging = new LoggingEventSink();
        if (!config.audit().active()) {
            return logging;
        }
        return new CompositeEventSink(List.of(logging, new AuditEventSink(observability(config.audit()))));
    }

    private static Purpose purpose(String key) {
        return Purpose.fromKey(key)
            .orElseThrow(() -> new ConfigurationException("Unknown purpose in routing config: " + key));
    }
}
