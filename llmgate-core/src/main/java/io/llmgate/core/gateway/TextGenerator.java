package io.llmgate.core.gateway;

import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.Purpose;
import java.util.List;
import java.util.Objects;

/**
 * Caller-facing shortcut that returns only the generated text.
 */
public final class TextGenerator {
    private final LlmGateway gateway;

    public TextGenerator(LlmGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
    }

    public String generate(Purpose purpose, String systemPrompt, String userPrompt) {
        return generate(purpose, systemPrompt, userPrompt, LlmRequest.DEFAULT_TEMPERATURE, false, null, null);
    }

    public String generate(
        Purpose purpose,
        String systemPrompt,
        String userPrompt,
        double temperature,
        boolean jsonMode,
        Long timeoutMs,
        List<String> route
    ) {
        LlmRequest request = new LlmRequest(purpose, systemPrompt, userPrompt, temperature, jsonMode, timeoutMs);
        return gateway.generate(request, route).content();
    }
}
