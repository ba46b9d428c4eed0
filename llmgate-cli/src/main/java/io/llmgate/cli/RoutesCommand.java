package io.llmgate.cli;

import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.gateway.LlmGateway;
import io.llmgate.core.model.Purpose;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "routes", description = "Show the effective provider order for every purpose")
public final class RoutesCommand implements Callable<Integer> {
    private final CliContext context;

    public RoutesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LlmGateway gateway = context.openGateway()) {
            System.out.println("Default route: " + gateway.policy().defaultRoute());
            for (Purpose purpose : Purpose.values()) {
                String source = gateway.policy().hasExplicitRoute(purpose) ? "static" : "default";
                System.out.println(purpose.key() + " (" + source + "): " + effective(gateway, purpose));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Routes command failed: " + e.getMessage());
            return 1;
        }
    }

    private String effective(LlmGateway gateway, Purpose purpose) {
        try {
            List<String> route = gateway.resolveRoute(purpose, null);
            return String.join(" -> ", route);
        } catch (ConfigurationException e) {
            return "<unroutable: " + e.getMessage() + ">";
        }
    }
}
