package io.llmgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    Map<String, ProviderConfig> providers,
    RoutingConfig routing,
    AuditConfig audit
) {

    public GatewayConfig {
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        routing = routing == null ? RoutingConfig.defaults() : routing;
        audit = audit == null ? AuditConfig.defaults() : audit;
    }

    public static GatewayConfig defaults() {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("deepseek", ProviderConfig.of("https://api.deepseek.com", "deepseek-chat", true));
        providers.put("openai", ProviderConfig.of("https://api.openai.com/v1", "gpt-4o-mini", true));
        providers.put("local", ProviderConfig.of("", "", false));
        return new GatewayConfig(providers, RoutingConfig.defaults(), AuditConfig.defaults());
    }

    /**
     * Provider entries with their name taken from the map key.
     */
    public List<ProviderConfig> providerConfigs() {
        List<ProviderConfig> configs = new ArrayList<>();
        providers.forEach((name, config) -> {
            if (config != null) {
                configs.add(config.withName(name));
            }
        });
        return configs;
    }

    public GatewayConfig withProvider(String name, ProviderConfig config) {
        Map<String, ProviderConfig> updated = new LinkedHashMap<>(providers);
        updated.put(name, config);
        return new GatewayConfig(updated, routing, audit);
    }

    public GatewayConfig withRouting(RoutingConfig value) {
        return new GatewayConfig(providers, value, audit);
    }
}
