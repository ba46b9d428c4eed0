package io.llmgate.core.observability;

import io.llmgate.core.error.FailureKind;
import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.LlmResponse;
import io.llmgate.core.model.Purpose;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal record of one generation request. Carries prompt sizes, never prompt or response text.
 */
public record GenerationEvent(
    Outcome outcome,
    Purpose purpose,
    String provider,
    String model,
    boolean jsonMode,
    int systemPromptChars,
    int userPromptChars,
    long latencyMs,
    int attempts,
    boolean usedFallback,
    List<String> attemptedProviders,
    FailureKind failureKind
) {
    public enum Outcome {
        SUCCEEDED("generation_succeeded"),
        EXHAUSTED("generation_exhausted");

        private final String eventType;

        Outcome(String eventType) {
            this.eventType = eventType;
        }

        public String eventType() {
            return eventType;
        }
    }

    public GenerationEvent {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(purpose, "purpose must not be null");
        provider = provider == null ? "" : provider;
        model = model == null ? "" : model;
        attemptedProviders = attemptedProviders == null ? List.of() : List.copyOf(attemptedProviders);
    }

    public static GenerationEvent succeeded(LlmRequest request, LlmResponse response, List<String> attempted) {
        return new GenerationEvent(
            Outcome.SUCCEEDED,
            request.purpose(),
            response.provider(),
            response.model(),
            request.jsonMode(),
            request.systemPrompt().length(),
            request.userPrompt().length(),
            response.latencyMs(),
            response.attempts(),
            response.usedFallback(),
            attempted,
            null
        );
    }

    /**
     * @param elapsedMs wall-clock time of the whole failed chain
     */
    public static GenerationEvent exhausted(
        LlmRequest request,
        List<String> attempted,
        FailureKind lastFailure,
        long elapsedMs
    ) {
        String last = attempted.isEmpty() ? "" : attempted.get(attempted.size() - 1);
        return new GenerationEvent(
            Outcome.EXHAUSTED,
            request.purpose(),
            last,
            "",
            request.jsonMode(),
            request.systemPrompt().length(),
            request.userPrompt().length(),
            elapsedMs,
            attempted.size(),
            attempted.size() > 1,
            attempted,
            lastFailure
        );
    }

    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("purpose", purpose.key());
        attributes.put("provider", provider);
        attributes.put("model", model);
        attributes.put("json_mode", jsonMode);
        attributes.put("system_chars", systemPromptChars);
        attributes.put("user_chars", userPromptChars);
        attributes.put("latency_ms", latencyMs);
        attributes.put("attempts", attempts);
        attributes.put("used_fallback", usedFallback);
        if (outcome == Outcome.EXHAUSTED) {
            attributes.put("attempted_providers", attemptedProviders);
            attributes.put("failure_kind", failureKind == null ? "" : failureKind.key());
        }
        return attributes;
    }
}
