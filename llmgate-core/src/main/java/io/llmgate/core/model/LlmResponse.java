package io.llmgate.core.model;

import java.util.Objects;

/**
 * Outcome of a successful generation. {@code latencyMs} covers the winning attempt only;
 * {@code attempts} counts every provider tried, failures included.
 */
public record LlmResponse(
    String content,
    String provider,
    String model,
    long latencyMs,
    int attempts,
    boolean usedFallback
) {
    public LlmResponse {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        model = model == null ? "" : model;
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        if (usedFallback != attempts > 1) {
            throw new IllegalArgumentException("usedFallback must be true exactly when attempts > 1");
        }
        latencyMs = Math.max(0, latencyMs);
    }

    public static LlmResponse of(String content, String provider, String model, long latencyMs, int attempts) {
        return new LlmResponse(content, provider, model, latencyMs, attempts, attempts > 1);
    }
}
