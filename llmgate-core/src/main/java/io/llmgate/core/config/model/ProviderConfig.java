package io.llmgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderConfig(
    String name,
    @JsonAlias({"api_base", "base_url"}) String apiBase,
    @JsonAlias({"api_key"}) String apiKey,
    String model,
    Boolean enabled,
    @JsonAlias({"timeout_ms"}) Long timeoutMs
) {

    public static ProviderConfig of(String apiBase, String model, boolean enabled) {
        return new ProviderConfig(null, apiBase, "", model, enabled, null);
    }

    /**
     * Enabled and carrying both an endpoint and a model. A missing credential does not make a
     * provider inactive; the backend rejects the call instead.
     */
    public boolean active() {
        return Boolean.TRUE.equals(enabled)
            && apiBase != null && !apiBase.isBlank()
            && model != null && !model.isBlank();
    }

    public boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }

    public ProviderConfig withName(String value) {
        return new ProviderConfig(value, apiBase, apiKey, model, enabled, timeoutMs);
    }

    public ProviderConfig withApiBase(String value) {
        return new ProviderConfig(name, value, apiKey, model, enabled, timeoutMs);
    }

    public ProviderConfig withApiKey(String value) {
        return new ProviderConfig(name, apiBase, value, model, enabled, timeoutMs);
    }

    public ProviderConfig withModel(String value) {
        return new ProviderConfig(name, apiBase, apiKey, value, enabled, timeoutMs);
    }

    public ProviderConfig withEnabled(boolean value) {
        return new ProviderConfig(name, apiBase, apiKey, model, value, timeoutMs);
    }

    public ProviderConfig withTimeoutMs(Long value) {
        return new ProviderConfig(name, apiBase, apiKey, model, enabled, value);
    }
}
