package io.llmgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.llmgate.core.error.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param primary           provider answering purposes without a route entry
 * @param defaultRoute      overrides {@code [primary]} when non-empty
 * @param routes            purpose key to ordered provider names
 * @param purposeTimeoutsMs purpose key to attempt deadline
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(
    String primary,
    @JsonAlias({"default_route"}) List<String> defaultRoute,
    Map<String, List<String>> routes,
    @JsonAlias({"purpose_timeouts_ms"}) Map<String, Long> purposeTimeoutsMs
) {

    public RoutingConfig {
        primary = primary == null ? "" : primary.trim();
        defaultRoute = defaultRoute == null ? List.of() : copyRoute("default route", defaultRoute);
        routes = routes == null ? Map.of() : copyRoutes(routes);
        purposeTimeoutsMs = purposeTimeoutsMs == null ? Map.of() : copyTimeouts(purposeTimeoutsMs);
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig("deepseek", List.of(), Map.of(), Map.of());
    }

    public List<String> effectiveDefaultRoute() {
        return defaultRoute.isEmpty() ? List.of(primary) : defaultRoute;
    }

    public RoutingConfig withPrimary(String value) {
        return new RoutingConfig(value, defaultRoute, routes, purposeTimeoutsMs);
    }

    public RoutingConfig withRoute(String purpose, List<String> route) {
        Map<String, List<String>> updated = new LinkedHashMap<>(routes);
        updated.put(purpose, route);
        return new RoutingConfig(primary, defaultRoute, updated, purposeTimeoutsMs);
    }

    public RoutingConfig withPurposeTimeout(String purpose, long timeoutMs) {
        Map<String, Long> updated = new LinkedHashMap<>(purposeTimeoutsMs);
        updated.put(purpose, timeoutMs);
        return new RoutingConfig(primary, defaultRoute, routes, updated);
    }

    private static Map<String, List<String>> copyRoutes(Map<String, List<String>> routes) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        routes.forEach((purpose, route) ->
            copy.put(purpose, route == null ? List.of() : copyRoute("route for " + purpose, route)));
        return Collections.unmodifiableMap(copy);
    }

    private static List<String> copyRoute(String source, List<String> route) {
        // Immutable lists reject contains(null), so walk the elements.
        for (String name : route) {
            if (name == null) {
                throw new ConfigurationException("Provider names in " + source + " must not be null");
            }
        }
        return List.copyOf(route);
    }

    private static Map<String, Long> copyTimeouts(Map<String, Long> timeouts) {
        Map<String, Long> copy = new LinkedHashMap<>();
        timeouts.forEach((purpose, timeout) -> {
            if (timeout == null) {
                throw new ConfigurationException("Timeout for purpose " + purpose + " must not be null");
            }
            copy.put(purpose, timeout);
        });
        return Collections.unmodifiableMap(copy);
    }
}
