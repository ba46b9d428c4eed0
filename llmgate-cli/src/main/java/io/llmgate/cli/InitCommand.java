package io.llmgate.cli;

import io.llmgate.core.config.InitResult;
import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.config.model.ProviderConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write or refresh the gateway config file")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the built-in defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite);
            String action = result.createdConfig()
                ? "Created config"
                : result.overwrittenConfig() ? "Overwrote config with defaults" : "Refreshed config";
            System.out.println(action + ": " + result.configPath());

            GatewayConfig config = context.loadConfig();
            System.out.println("Primary provider: " + config.routing().primary());
            for (ProviderConfig provider : config.providerConfigs()) {
                if (provider.active() && !provider.hasCredential()) {
                    System.out.println("Provider " + provider.name() + " has no API key; set it in the file or the environment");
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
