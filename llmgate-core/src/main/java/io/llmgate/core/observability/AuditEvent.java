package io.llmgate.core.observability;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One persisted line of the audit trail. Attribute values come back from JSON as plain
 * numbers, booleans and strings, so the typed accessors parse leniently.
 */
public record AuditEvent(
    String id,
    Instant recordedAt,
    String type,
    Map<String, Object> attributes
) {
    public AuditEvent {
        id = id == null ? "" : id.trim();
        recordedAt = recordedAt == null ? Instant.EPOCH : recordedAt;
        type = type == null ? "" : type.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean is(GenerationEvent.Outcome outcome) {
        return outcome.eventType().equalsIgnoreCase(type);
    }

    public String provider() {
        Object value = attributes.get("provider");
        return value == null ? "" : String.valueOf(value).trim();
    }

    public boolean usedFallback() {
        return Boolean.parseBoolean(String.valueOf(attributes.get("used_fallback")).trim());
    }

    public OptionalDouble latencyMs() {
        Object value = attributes.get("latency_ms");
        if (value instanceof Number number) {
            return number.doubleValue() < 0 ? OptionalDouble.empty() : OptionalDouble.of(number.doubleValue());
        }
        if (value == null) {
            return OptionalDouble.empty();
        }
        try {
            double parsed = Double.parseDouble(String.valueOf(value).trim());
            return parsed < 0 ? OptionalDouble.empty() : OptionalDouble.of(parsed);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
