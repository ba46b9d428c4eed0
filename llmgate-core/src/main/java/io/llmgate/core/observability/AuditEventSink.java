package io.llmgate.core.observability;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists generation events to the audit trail behind {@link ObservabilityService}. Writes run
 * on a single background thread in emit order; {@link #close()} drains them.
 */
public final class AuditEventSink implements GenerationEventSink {
    private static final Logger LOG = LoggerFactory.getLogger(AuditEventSink.class);
    private static final long DRAIN_TIMEOUT_SECONDS = 10;

    private final ObservabilityService observability;
    private final ExecutorService writer;

    public AuditEventSink(ObservabilityService observability) {
        this.observability = Objects.requireNonNull(observability, "observability must not be null");
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "llmgate-audit");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void emit(GenerationEvent event) {
        try {
            writer.execute(() -> write(event));
        } catch (RejectedExecutionException e) {
            LOG.warn("Dropping {} event: audit sink is closed", event.outcome().eventType());
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Audit writer did not drain within {} s", DRAIN_TIMEOUT_SECONDS);
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void write(GenerationEvent event) {
        try {
            observability.record(event.outcome().eventType(), event.attributes());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not record {} event: {}", event.outcome().eventType(), e.getMessage());
        }
    }
}
