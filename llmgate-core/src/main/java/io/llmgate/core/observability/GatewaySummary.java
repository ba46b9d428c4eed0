package io.llmgate.core.observability;

import java.util.Map;

public record GatewaySummary(
    int requests,
    int succeeded,
    int exhausted,
    double successRate,
    double fallbackRate,
    double p50LatencyMs,
    double p95LatencyMs,
    Map<String, Integer> successesByProvider,
    int auditEvents
) {
    public GatewaySummary {
        successesByProvider = successesByProvider == null ? Map.of() : Map.copyOf(successesByProvider);
    }
}
