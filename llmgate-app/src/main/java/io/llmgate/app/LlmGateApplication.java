package io.llmgate.app;

import io.llmgate.cli.CliContext;
import io.llmgate.cli.GenerateCommand;
import io.llmgate.cli.InitCommand;
import io.llmgate.cli.LlmGateCliCommand;
import io.llmgate.cli.RoutesCommand;
import io.llmgate.cli.StatsCommand;
import io.llmgate.cli.StatusCommand;
import io.llmgate.core.config.ConfigPaths;
import io.llmgate.core.config.ConfigService;
import java.nio.file.Path;
import java.util.Map;
import picocli.CommandLine;

public final class LlmGateApplication {
    static final String CONFIG_PATH_ENV = "LLMGATE_CONFIG";

    private LlmGateApplication() {
    }

    public static void main(String[] args) {
        Map<String, String> environment = System.getenv();
        CliContext context = new CliContext(new ConfigService(), configPath(environment), environment);

        CommandLine commandLine = new CommandLine(new LlmGateCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("generate", new GenerateCommand(context));
        commandLine.addSubcommand("routes", new RoutesCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static Path configPath(Map<String, String> environment) {
        String raw = environment.get(CONFIG_PATH_ENV);
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolve(raw.trim());
    }
}
