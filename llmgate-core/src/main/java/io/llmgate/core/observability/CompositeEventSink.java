package io.llmgate.core.observability;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans one event out to several sinks. A failing sink is logged and skipped.
 */
public final class CompositeEventSink implements GenerationEventSink {
    private static final Logger LOG = LoggerFactory.getLogger(CompositeEventSink.class);
    private final List<GenerationEventSink> sinks;

    public CompositeEventSink(List<GenerationEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void emit(GenerationEvent event) {
        for (GenerationEventSink sink : sinks) {
            try {
                sink.emit(event);
            } catch (RuntimeException e) {
                LOG.warn("Event sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        for (GenerationEventSink sink : sinks) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                LOG.warn("Event sink {} failed to close: {}", sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
