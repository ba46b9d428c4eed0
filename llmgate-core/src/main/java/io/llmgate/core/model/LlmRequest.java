package io.llmgate.core.model;

import java.util.Objects;
import java.util.OptionalLong;

public record LlmRequest(
    Purpose purpose,
    String systemPrompt,
    String userPrompt,
    double temperature,
    boolean jsonMode,
    Long timeoutMs
) {
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public LlmRequest {
        Objects.requireNonNull(purpose, "purpose must not be null");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        userPrompt = userPrompt == null ? "" : userPrompt;
        if (Double.isNaN(temperature) || temperature < 0) {
            throw new IllegalArgumentException("temperature must be a non-negative number");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive when set");
        }
    }

    public static LlmRequest of(Purpose purpose, String systemPrompt, String userPrompt) {
        return new LlmRequest(purpose, systemPrompt, userPrompt, DEFAULT_TEMPERATURE, false, null);
    }

    public LlmRequest withTemperature(double value) {
        return new LlmRequest(purpose, systemPrompt, userPrompt, value, jsonMode, timeoutMs);
    }

    public LlmRequest withJsonMode(boolean value) {
        return new LlmRequest(purpose, systemPrompt, userPrompt, temperature, value, timeoutMs);
    }

    public LlmRequest withTimeoutMs(Long value) {
        return new LlmRequest(purpose, systemPrompt, userPrompt, temperature, jsonMode, value);
    }

    public OptionalLong timeout() {
        return timeoutMs == null ? OptionalLong.empty() : OptionalLong.of(timeoutMs);
    }
}
