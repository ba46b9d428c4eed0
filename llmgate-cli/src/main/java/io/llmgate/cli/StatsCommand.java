package io.llmgate.cli;

import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.gateway.GatewayFactory;
import io.llmgate.core.observability.GatewaySummary;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "stats", description = "Summarize recorded generations from the audit trail")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            GatewayConfig config = context.loadConfig();
            if (!config.audit().active()) {
                System.out.println("Audit trail is disabled; nothing to summarize.");
                return 0;
            }
            GatewaySummary summary = GatewayFactory.observability(config.audit()).summary();
            System.out.println("Requests: " + summary.requests());
            System.out.println("Succeeded: " + summary.succeeded());
            System.out.println("Exhausted: " + summary.exhausted());
            System.out.println("Success rate: " + summary.successRate() + "%");
            System.out.println("Fallback rate: " + summary.fallbackRate() + "%");
            System.out.println("Latency p50: " + summary.p50LatencyMs() + " ms");
            System.out.println("Latency p95: " + summary.p95LatencyMs() + " ms");
            summary.successesByProvider().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> System.out.println("Provider " + entry.getKey() + ": " + entry.getValue()));
            return 0;
        } catch (Exception e) {
            System.err.println("Stats command failed: " + e.getMessage());
            return 1;
        }
    }
}
