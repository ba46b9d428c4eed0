package io.llmgate.core.observability;

/**
 * Receives one event per terminal generation outcome. {@link #emit} runs on the caller's
 * request path and must not block on I/O.
 */
@FunctionalInterface
public interface GenerationEventSink extends AutoCloseable {
    void emit(GenerationEvent event);

    /**
     * Flushes anything still pending. Called once by the owning gateway on close.
     */
    @Override
    default void close() {
    }
}
