package io.llmgate.cli;

import io.llmgate.core.config.ConfigService;
import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.gateway.GatewayFactory;
import io.llmgate.core.gateway.LlmGateway;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Map.of());
    }

    public GatewayConfig loadConfig() throws IOException {
        return configService.load(configPath, environment);
    }

    public LlmGateway openGateway() throws IOException {
        return GatewayFactory.create(loadConfig());
    }
}
