package io.llmgate.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Audit trail of terminal generation outcomes and the rollup shown by {@code llmgate stats}.
 */
public final class ObservabilityService {
    static final int MAX_EVENTS = 20_000;

    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), clock.instant(), type, attributes);
        store.append(event, MAX_EVENTS);
        return event;
    }

    /**
     * Newest first.
     */
    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::recordedAt).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    public synchronized GatewaySummary summary() throws IOException {
        List<AuditEvent> events = store.load();
        List<AuditEvent> succeeded = events.stream().filter(e -> e.is(GenerationEvent.Outcome.SUCCEEDED)).toList();
        long exhausted = events.stream().filter(e -> e.is(GenerationEvent.Outcome.EXHAUSTED)).count();
        int requests = succeeded.size() + (int) exhausted;
        long fallbacks = succeeded.stream().filter(AuditEvent::usedFallback).count();

        double[] latencies = succeeded.stream()
            .map(AuditEvent::latencyMs)
            .filter(OptionalDouble::isPresent)
            .mapToDouble(OptionalDouble::getAsDouble)
            .sorted()
            .toArray();

        Map<String, Integer> successesByProvider = new TreeMap<>();
        succeeded.stream()
            .map(AuditEvent::provider)
            .filter(provider -> !provider.isBlank())
            .forEach(provider -> successesByProvider.merge(provider, 1, Integer::sum));

        return new GatewaySummary(
            requests,
            succeeded.size(),
            (int) exhausted,
            ratePercent(succeeded.size(), requests),
            ratePercent(fallbacks, succeeded.size()),
            nearestRank(latencies, 0.50),
            nearestRank(latencies, 0.95),
            successesByProvider,
            events.size()
        );
    }

    // Nearest-rank percentile over an ascending array.
    private static double nearestRank(double[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(quantile * sorted.length);
        return twoDecimals(sorted[Math.min(sorted.length, Math.max(1, rank)) - 1]);
    }

    private static double ratePercent(long part, long whole) {
        return whole <= 0 ? 0.0 : twoDecimals(part * 100.0 / whole);
    }

    private static double twoDecimals(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
