package io.llmgate.core.error;

import java.util.List;

/**
 * The caller abandoned the request while an attempt was in flight. Unlike a per-attempt
 * timeout this stops the whole route.
 */
public final class GenerationCancelledException extends GatewayException {
    private final List<String> attemptedProviders;

    public GenerationCancelledException(List<String> attemptedProviders) {
        super("Generation cancelled by caller after " + attemptedProviders);
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public List<String> attemptedProviders() {
        return attemptedProviders;
    }
}
