package io.llmgate.core.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmgate.core.config.model.AuditConfig;
import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.config.model.ProviderConfig;
import io.llmgate.core.config.model.RoutingConfig;
import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.error.FailureKind;
import io.llmgate.core.error.GatewayExhaustedException;
import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.LlmResponse;
import io.llmgate.core.model.Purpose;
import io.llmgate.core.observability.GenerationEvent;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GatewayFactoryTest {

    private MockWebServer deepseek;
    private MockWebServer openai;

    @BeforeEach
    void setUp() throws IOException {
        deepseek = new MockWebServer();
        deepseek.start();
        openai = new MockWebServer();
        openai.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        deepseek.shutdown();
        openai.shutdown();
    }

    @Test
    void shouldFallBackToSecondBackendOnServerError() {
        deepseek.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        openai.enqueue(completion("{\"priority\":\"high\"}"));
        RecordingSink sink = new RecordingSink();

        try (LlmGateway gateway = GatewayFactory.create(config(routing(Map.of())), sink)) {
            LlmResponse response = gateway.generate(
                LlmRequest.of(Purpose.ANALYZE_TICKET, "system", "ticket").withJsonMode(true)
            );

            assertThat(response.content()).isEqualTo("{\"priority\":\"high\"}");
            assertThat(response.provider()).isEqualTo("openai");
            assertThat(response.model()).isEqualTo("gpt-4o-mini");
            assertThat(response.attempts()).isEqualTo(2);
            assertThat(response.usedFallback()).isTrue();
        }

        assertThat(deepseek.getRequestCount()).isEqualTo(1);
        assertThat(sink.events()).singleElement()
            .extracting(GenerationEvent::outcome)
            .isEqualTo(GenerationEvent.Outcome.SUCCEEDED);
    }

    @Test
    void shouldCancelSlowBackendAtPurposeDeadline() {
        deepseek.enqueue(completion("{\"late\":true}").setHeadersDelay(2, TimeUnit.SECONDS));
        openai.enqueue(completion("{\"fields\":[]}"));
        RoutingConfig routing = routing(Map.of()).withPurposeTimeout("propose_fields_only", 200);

        try (LlmGateway gateway = GatewayFactory.create(config(routing), new RecordingSink())) {
            long started = System.nanoTime();
            LlmResponse response = gateway.generate(
                LlmRequest.of(Purpose.PROPOSE_FIELDS_ONLY, "system", "ticket").withJsonMode(true)
            );

            assertThat(response.provider()).isEqualTo("openai");
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(1_500);
        }
    }

    @Test
    void shouldNotQueueConcurrentCallsToOneBackend() throws Exception {
        int concurrent = 8;
        for (int i = 0; i < concurrent; i++) {
            deepseek.enqueue(completion("{\"n\":" + i + "}").setHeadersDelay(400, TimeUnit.MILLISECONDS));
        }
        RoutingConfig routing = routing(Map.of()).withPurposeTimeout("analyze_ticket", 1_500);

        try (LlmGateway gateway = GatewayFactory.create(config(routing), new RecordingSink())) {
            List<Future<LlmResponse>> pending = new ArrayList<>();
            for (int i = 0; i < concurrent; i++) {
                pending.add(gateway.generateAsync(
                    LlmRequest.of(Purpose.ANALYZE_TICKET, "system", "ticket").withJsonMode(true),
                    List.of("deepseek")
                ));
            }
            for (Future<LlmResponse> future : pending) {
                LlmResponse response = future.get(10, TimeUnit.SECONDS);
                assertThat(response.provider()).isEqualTo("deepseek");
                assertThat(response.attempts()).isEqualTo(1);
            }
        }

        assertThat(deepseek.getRequestCount()).isEqualTo(concurrent);
    }

    @Test
    void shouldSkipInactiveLocalProviderAndReportExhaustion() {
        deepseek.enqueue(completion("not json"));
        openai.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));
        RoutingConfig routing = routing(Map.of("propose_solution", List.of("local", "deepseek", "openai")));

        try (LlmGateway gateway = GatewayFactory.create(config(routing), new RecordingSink())) {
            assertThat(gateway.registry().isEnabled("local")).isFalse();
            assertThatThrownBy(() -> gateway.generate(
                LlmRequest.of(Purpose.PROPOSE_SOLUTION, "system", "ticket").withJsonMode(true)
            ))
                .isInstanceOfSatisfying(GatewayExhaustedException.class, e -> {
                    assertThat(e.attemptedProviders()).containsExactly("deepseek", "openai");
                    assertThat(e.lastFailureKind()).isEqualTo(FailureKind.INVOCATION);
                    assertThat(e.lastFailureMessage()).contains("401");
                });
        }
    }

    @Test
    void shouldRejectUnknownPurposeKeyInRoutes() {
        GatewayConfig config = config(routing(Map.of("summarise", List.of("openai"))));

        assertThatThrownBy(() -> GatewayFactory.create(config, new RecordingSink()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("summarise");
    }

    @Test
    void shouldRejectRoutesNamingUnknownProviders() {
        GatewayConfig config = config(routing(Map.of("analyze_ticket", List.of("anthropic", "openai"))));

        assertThatThrownBy(() -> GatewayFactory.create(config, new RecordingSink()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("anthropic");
    }

    @Test
    void shouldRejectMissingPrimary() {
        GatewayConfig config = config(new RoutingConfig("", List.of(), Map.of(), Map.of()));

        assertThatThrownBy(() -> GatewayFactory.create(config, new RecordingSink()))
            .isInstanceOf(ConfigurationException.class);
    }

    private GatewayConfig config(RoutingConfig routing) {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("deepseek", new ProviderConfig(
            null, deepseek.url("/v1").toString(), "sk-deepseek", "deepseek-chat", true, null));
        providers.put("openai", new ProviderConfig(
            null, openai.url("/v1").toString(), "sk-openai", "gpt-4o-mini", true, null));
        providers.put("local", new ProviderConfig(null, "", "", "qwen2.5", true, 8_000L));
        return new GatewayConfig(providers, routing, new AuditConfig(false, null));
    }

    private RoutingConfig routing(Map<String, List<String>> routes) {
        return new RoutingConfig("deepseek", List.of("deepseek", "openai"), routes, Map.of());
    }

    private MockResponse completion(String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"");
        return new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"}}]}");
    }
}
