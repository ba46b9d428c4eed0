package io.llmgate.cli;

import io.llmgate.core.config.ConfigPaths;
import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.config.model.ProviderConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and provider status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            GatewayConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Primary provider: " + config.routing().primary());
            for (ProviderConfig provider : config.providerConfigs()) {
                System.out.println(
                    "Provider " + provider.name() + ": " + (provider.active() ? "active" : "inactive")
                        + " model=" + blankAsDash(provider.model())
                        + " base=" + blankAsDash(provider.apiBase())
                        + " credential=" + (provider.hasCredential() ? "set" : "missing")
                        + (provider.timeoutMs() == null ? "" : " timeout_ms=" + provider.timeoutMs())
                );
            }
            System.out.println("Audit trail: " + (config.audit().active()
                ? ConfigPaths.resolve(config.audit().path())
                : "disabled"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String blankAsDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
