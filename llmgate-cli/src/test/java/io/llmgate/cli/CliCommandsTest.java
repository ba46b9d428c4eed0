package io.llmgate.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmgate.core.config.ConfigService;
import io.llmgate.core.gateway.GatewayFactory;
import io.llmgate.core.config.model.AuditConfig;
import io.llmgate.core.observability.ObservabilityService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliCommandsTest {

    @TempDir
    Path tempDir;

    @Test
    void initShouldCreateThenRefreshConfig() {
        Path configPath = tempDir.resolve("llmgate").resolve("config.json");
        CliContext context = new CliContext(new ConfigService(), configPath);

        String created = run(new InitCommand(context));
        String refreshed = run(new InitCommand(context));
        String overwritten = run(new InitCommand(context), "--overwrite");

        assertThat(Files.exists(configPath)).isTrue();
        assertThat(created).contains("Created config");
        assertThat(refreshed).contains("Refreshed config").contains("Primary provider: deepseek");
        assertThat(created).contains("Provider openai has no API key");
        assertThat(overwritten).contains("Overwrote config");
    }

    @Test
    void statusShouldListProvidersWithoutRevealingCredentials() {
        CliContext context = new CliContext(
            new ConfigService(),
            tempDir.resolve("missing.json"),
            Map.of("DEEPSEEK_API_KEY", "sk-secret", "LLM_PROVIDER", "deepseek")
        );

        String out = run(new StatusCommand(context));

        assertThat(out)
            .contains("Config exists: false")
            .contains("Primary provider: deepseek")
            .contains("Provider deepseek: active model=deepseek-chat")
            .contains("credential=set")
            .contains("Provider local: inactive")
            .doesNotContain("sk-secret");
    }

    @Test
    void routesShouldSkipDisabledLocalProvider() {
        CliContext context = new CliContext(
            new ConfigService(),
            tempDir.resolve("missing.json"),
            Map.of("LLM_LOCAL_PURPOSES", "propose_fields_only", "LLM_PROVIDER", "openai")
        );

        String out = run(new RoutesCommand(context));

        assertThat(out)
            .contains("Default route: [openai]")
            .contains("propose_fields_only (static): openai")
            .contains("analyze_ticket (default): openai");
    }

    @Test
    void statsShouldSummarizeAuditTrail() throws Exception {
        Path audit = tempDir.resolve("audit.json");
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "audit": { "enabled": true, "path": "%s" } }
            """.formatted(audit.toString().replace("\\", "\\\\")));
        ObservabilityService observability = GatewayFactory.observability(new AuditConfig(true, audit.toString()));
        observability.record("generation_succeeded", Map.of("provider", "deepseek", "latency_ms", 120, "used_fallback", false));
        observability.record("generation_exhausted", Map.of("provider", "openai", "latency_ms", 900));

        String out = run(new StatsCommand(new CliContext(new ConfigService(), configPath)));

        assertThat(out)
            .contains("Requests: 2")
            .contains("Succeeded: 1")
            .contains("Success rate: 50.0%")
            .contains("Provider deepseek: 1");
    }

    private String run(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            assertThat(code).isEqualTo(0);
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
