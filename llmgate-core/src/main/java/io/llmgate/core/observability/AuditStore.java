package io.llmgate.core.observability;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public interface AuditStore {
    List<AuditEvent> load() throws IOException;

    void save(List<AuditEvent> events) throws IOException;

    /**
     * Appends {@code event}, keeping only the newest {@code capacity} entries.
     */
    default void append(AuditEvent event, int capacity) throws IOException {
        List<AuditEvent> events = new ArrayList<>(load());
        events.add(event);
        int overflow = events.size() - capacity;
        save(overflow > 0 ? events.subList(overflow, events.size()) : events);
    }
}
