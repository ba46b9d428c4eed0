package io.llmgate.core.provider;

import io.llmgate.core.error.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Every configured provider, enabled or not. Built once at startup and read-only afterwards,
 * so it is shared across requests without locking.
 */
public final class ProviderRegistry {
    private final Map<String, Entry> entries;

    private ProviderRegistry(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<LlmProvider> find(String name) {
        Entry entry = entries.get(normalize(name));
        return entry == null ? Optional.empty() : Optional.of(entry.provider());
    }

    public LlmProvider require(String name) {
        return find(name).orElseThrow(() -> new ConfigurationException("Unknown provider: " + name));
    }

    public boolean isRegistered(String name) {
        return entries.containsKey(normalize(name));
    }

    public boolean isEnabled(String name) {
        Entry entry = entries.get(normalize(name));
        return entry != null && entry.enabled();
    }

    public OptionalLong defaultTimeoutMs(String name) {
        Entry entry = entries.get(normalize(name));
        if (entry == null || entry.defaultTimeoutMs() == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(entry.defaultTimeoutMs());
    }

    public Set<String> names() {
        return entries.keySet();
    }

    public Set<String> enabledNames() {
        Set<String> enabled = new LinkedHashSet<>();
        entries.forEach((name, entry) -> {
            if (entry.enabled()) {
                enabled.add(name);
            }
        });
        return Collections.unmodifiableSet(enabled);
    }

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private record Entry(LlmProvider provider, boolean enabled, Long defaultTimeoutMs) {
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(LlmProvider provider) {
            return register(provider, true, null);
        }

        public Builder register(LlmProvider provider, boolean enabled, Long defaultTimeoutMs) {
            Objects.requireNonNull(provider, "provider must not be null");
            String key = normalize(provider.name());
            if (key.isEmpty()) {
                throw new ConfigurationException("Provider name must not be blank");
            }
            if (entries.containsKey(key)) {
                throw new ConfigurationException("Duplicate provider: " + provider.name());
            }
            if (defaultTimeoutMs != null && defaultTimeoutMs <= 0) {
                throw new ConfigurationException("Default timeout of provider " + provider.name() + " must be positive");
            }
            entries.put(key, new Entry(provider, enabled, defaultTimeoutMs));
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(entries);
        }
    }
}
