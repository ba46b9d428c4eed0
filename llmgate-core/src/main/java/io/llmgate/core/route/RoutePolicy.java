package io.llmgate.core.route;

import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.model.Purpose;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declared routing intent: an ordered provider list per purpose plus the default route.
 * Availability is not considered here; {@link RouteResolver} filters against enabled providers.
 */
public final class RoutePolicy {
    private final Map<Purpose, List<String>> routes;
    private final List<String> defaultRoute;

    public RoutePolicy(Map<Purpose, List<String>> routes, List<String> defaultRoute) {
        Objects.requireNonNull(defaultRoute, "defaultRoute must not be null");
        if (defaultRoute.isEmpty()) {
            throw new ConfigurationException("Default route must name at least one provider");
        }
        EnumMap<Purpose, List<String>> copy = new EnumMap<>(Purpose.class);
        if (routes != null) {
            routes.forEach((purpose, route) -> copy.put(
                Objects.requireNonNull(purpose, "purpose must not be null"),
                List.copyOf(route)
            ));
        }
        this.routes = Collections.unmodifiableMap(copy);
        this.defaultRoute = List.copyOf(defaultRoute);
    }

    public static RoutePolicy defaultOnly(String primary) {
        return new RoutePolicy(Map.of(), List.of(primary));
    }

    public List<String> declaredRoute(Purpose purpose) {
        return routes.getOrDefault(purpose, defaultRoute);
    }

    public boolean hasExplicitRoute(Purpose purpose) {
        return routes.containsKey(purpose);
    }

    public Map<Purpose, List<String>> routes() {
        return routes;
    }

    public List<String> defaultRoute() {
        return defaultRoute;
    }
}
