package io.llmgate.cli;

import io.llmgate.core.error.GatewayExhaustedException;
import io.llmgate.core.gateway.LlmGateway;
import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.LlmResponse;
import io.llmgate.core.model.Purpose;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "generate", description = "Send one prompt through the gateway and print the content")
public final class GenerateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User prompt")
    String prompt;

    @Option(names = {"-p", "--purpose"}, defaultValue = "generate", description = "Purpose key used for routing")
    String purpose;

    @Option(names = {"-s", "--system"}, defaultValue = "", description = "System prompt")
    String systemPrompt;

    @Option(names = {"-t", "--temperature"}, defaultValue = "0.7", description = "Sampling temperature")
    double temperature;

    @Option(names = "--json", description = "Require a JSON object as output")
    boolean jsonMode;

    @Option(names = "--timeout-ms", description = "Per-attempt deadline override")
    Long timeoutMs;

    @Option(names = {"-r", "--route"}, split = ",", description = "Provider order override, comma separated")
    List<String> route;

    @Option(names = "--meta", description = "Print provider, attempts and latency to stderr")
    boolean meta;

    public GenerateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LlmGateway gateway = context.openGateway()) {
            LlmRequest request = new LlmRequest(
                Purpose.parse(purpose),
                systemPrompt,
                prompt,
                temperature,
                jsonMode,
                timeoutMs
            );
            LlmResponse response = gateway.generate(request, route);
            System.out.println(response.content());
            if (meta) {
                System.err.println(
                    "provider=" + response.provider()
                        + " model=" + response.model()
                        + " attempts=" + response.attempts()
                        + " fallback=" + response.usedFallback()
                        + " latency_ms=" + response.latencyMs()
                );
            }
            return 0;
        } catch (GatewayExhaustedException e) {
            System.err.println("Generate failed: all providers failed " + e.attemptedProviders()
                + " (last failure: " + e.lastFailureKind().key() + ")");
            System.err.println(e.lastFailureMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Generate failed: " + e.getMessage());
            return 1;
        }
    }
}
