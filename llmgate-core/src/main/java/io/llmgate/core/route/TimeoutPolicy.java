package io.llmgate.core.route;

import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.Purpose;
import io.llmgate.core.provider.ProviderRegistry;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Effective attempt deadline: request override, else purpose default, else provider default,
 * else unbounded.
 */
public final class TimeoutPolicy {
    private final Map<Purpose, Long> purposeTimeoutsMs;

    public TimeoutPolicy(Map<Purpose, Long> purposeTimeoutsMs) {
        EnumMap<Purpose, Long> copy = new EnumMap<>(Purpose.class);
        if (purposeTimeoutsMs != null) {
            purposeTimeoutsMs.forEach((purpose, timeout) -> {
                Objects.requireNonNull(purpose, "purpose must not be null");
                if (timeout == null || timeout <= 0) {
                    throw new ConfigurationException("Timeout for purpose " + purpose.key() + " must be positive");
                }
                copy.put(purpose, timeout);
            });
        }
        this.purposeTimeoutsMs = Collections.unmodifiableMap(copy);
    }

    public static TimeoutPolicy none() {
        return new TimeoutPolicy(Map.of());
    }

    public OptionalLong resolve(LlmRequest request, ProviderRegistry registry, String provider) {
        if (request.timeoutMs() != null) {
            return OptionalLong.of(request.timeoutMs());
        }
        Long purposeTimeout = purposeTimeoutsMs.get(request.purpose());
        if (purposeTimeout != null) {
            return OptionalLong.of(purposeTimeout);
        }
        return registry.defaultTimeoutMs(provider);
    }

    public Map<Purpose, Long> purposeTimeoutsMs() {
        return purposeTimeoutsMs;
    }
}
