package io.llmgate.core.provider;

import io.llmgate.core.model.LlmRequest;
import java.util.concurrent.CompletableFuture;

/**
 * One configured backend bound to one model.
 *
 * <p>The returned future completes with the generated text, or exceptionally with a
 * {@link io.llmgate.core.error.ProviderInvocationException}. Cancelling the future must abort
 * the underlying call and release its connection. Implementations neither retry nor enforce
 * deadlines; the gateway owns both.
 */
public interface LlmProvider {
    String name();

    String model();

    CompletableFuture<String> generate(LlmRequest request);
}
