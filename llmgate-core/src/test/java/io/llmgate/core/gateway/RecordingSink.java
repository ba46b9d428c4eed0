package io.llmgate.core.gateway;

import io.llmgate.core.observability.GenerationEvent;
import io.llmgate.core.observability.GenerationEventSink;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingSink implements GenerationEventSink {
    private final List<GenerationEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(GenerationEvent event) {
        events.add(event);
    }

    List<GenerationEvent> events() {
        return events;
    }
}
