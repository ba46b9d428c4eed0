package io.llmgate.core.route;

import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.model.Purpose;
import io.llmgate.core.provider.ProviderRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a purpose (or an explicit caller route) into the ordered providers to try.
 * Resolution depends only on its inputs and the immutable registry and policy, so the same
 * purpose and override always yield the same route.
 */
public final class RouteResolver {
    private final ProviderRegistry registry;
    private final RoutePolicy policy;

    public RouteResolver(ProviderRegistry registry, RoutePolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        requireRegistered(policy.defaultRoute(), "default route");
        policy.routes().forEach((purpose, route) -> requireRegistered(route, "route for " + purpose.key()));
    }

    public List<String> resolve(Purpose purpose) {
        return resolve(purpose, null);
    }

    /**
     * @param override explicit route from the caller, or {@code null} to use the policy
     * @throws ConfigurationException if a name is unknown or no enabled provider remains
     */
    public List<String> resolve(Purpose purpose, List<String> override) {
        Objects.requireNonNull(purpose, "purpose must not be null");
        List<String> declared;
        String source;
        if (override != null) {
            requireRegistered(override, "route override");
            declared = override;
            source = "route override";
        } else {
            declared = policy.declaredRoute(purpose);
            source = policy.hasExplicitRoute(purpose) ? "route for " + purpose.key() : "default route";
        }

        List<String> effective = filterEnabled(declared);
        if (effective.isEmpty()) {
            throw new ConfigurationException(
                "No enabled provider in " + source + " " + declared + " for purpose " + purpose.key()
            );
        }
        return effective;
    }

    public RoutePolicy policy() {
        return policy;
    }

    private List<String> filterEnabled(List<String> declared) {
        // Each provider gets at most one attempt, so repeated names collapse to the first.
        Set<String> ordered = new LinkedHashSet<>();
        for (String name : declared) {
            String key = ProviderRegistry.normalize(name);
            if (registry.isEnabled(key)) {
                ordered.add(key);
            }
        }
        return List.copyOf(ordered);
    }

    private void requireRegistered(List<String> route, String source) {
        for (String name : route) {
            if (!registry.isRegistered(name)) {
                throw new ConfigurationException("Unknown provider '" + name + "' in " + source);
            }
        }
    }
}
