package io.llmgate.core.route;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.Purpose;
import io.llmgate.core.provider.LlmProvider;
import io.llmgate.core.provider.ProviderRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class RouteResolverTest {

    private final ProviderRegistry registry = ProviderRegistry.builder()
        .register(new StubProvider("deepseek"))
        .register(new StubProvider("openai"))
        .register(new StubProvider("local"), false, null)
        .build();

    @Test
    void shouldUseStaticRouteForKnownPurpose() {
        RouteResolver resolver = new RouteResolver(registry, new RoutePolicy(
            Map.of(Purpose.ANALYZE_TICKET, List.of("openai", "deepseek")),
            List.of("deepseek")
        ));

        assertThat(resolver.resolve(Purpose.ANALYZE_TICKET)).containsExactly("openai", "deepseek");
    }

    @Test
    void shouldFallBackToDefaultRouteForPurposeWithoutEntry() {
        RouteResolver resolver = new RouteResolver(registry, new RoutePolicy(
            Map.of(Purpose.ANALYZE_TICKET, List.of("openai")),
            List.of("deepseek")
        ));

        assertThat(resolver.resolve(Purpose.PROPOSE_SOLUTION)).containsExactly("deepseek");
        assertThat(resolver.resolve(Purpose.parse("typo_purpose"))).containsExactly("deepseek");
    }

    @Test
    void shouldSkipDisabledProviderListedInStaticPolicy() {
        RouteResolver resolver = new RouteResolver(registry, new RoutePolicy(
            Map.of(Purpose.PROPOSE_FIELDS_ONLY, List.of("local", "deepseek")),
            List.of("deepseek")
        ));

        List<String> route = resolver.resolve(Purpose.PROPOSE_FIELDS_ONLY);

        assertThat(route).containsExactly("deepseek");
        assertThat(resolver.policy().declaredRoute(Purpose.PROPOSE_FIELDS_ONLY)).contains("local");
    }

    @Test
    void shouldPreferOverrideButStillFilterIt() {
        RouteResolver resolver = new RouteResolver(registry, RoutePolicy.defaultOnly("deepseek"));

        assertThat(resolver.resolve(Purpose.GENERATE, List.of("local", "openai", "deepseek")))
            .containsExactly("openai", "deepseek");
    }

    @Test
    void shouldResolveDeterministically() {
        RouteResolver resolver = new RouteResolver(registry, new RoutePolicy(
            Map.of(Purpose.ANALYZE_TICKET_COT, List.of("openai", "local", "deepseek")),
            List.of("deepseek")
        ));

        List<String> first = resolver.resolve(Purpose.ANALYZE_TICKET_COT);
        for (int i = 0; i < 10; i++) {
            assertThat(resolver.resolve(Purpose.ANALYZE_TICKET_COT)).isEqualTo(first);
        }
    }

    @Test
    void shouldCollapseRepeatedProviders() {
        RouteResolver resolver = new RouteResolver(registry, RoutePolicy.defaultOnly("deepseek"));

        assertThat(resolver.resolve(Purpose.GENERATE, List.of("deepseek", "openai", "DeepSeek")))
            .containsExactly("deepseek", "openai");
    }

    @Test
    void shouldFailWhenEveryCandidateIsDisabled() {
        RouteResolver resolver = new RouteResolver(registry, new RoutePolicy(
            Map.of(Purpose.PROPOSE_FIELDS_ONLY, List.of("local")),
            List.of("deepseek")
        ));

        assertThatThrownBy(() -> resolver.resolve(Purpose.PROPOSE_FIELDS_ONLY))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("No enabled provider");
        assertThatThrownBy(() -> resolver.resolve(Purpose.GENERATE, List.of()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectUnknownProvidersInPolicyAndOverride() {
        assertThatThrownBy(() -> new RouteResolver(registry, new RoutePolicy(
            Map.of(Purpose.ANALYZE_TICKET, List.of("anthropic")),
            List.of("deepseek")
        ))).isInstanceOf(ConfigurationException.class).hasMessageContaining("anthropic");

        RouteResolver resolver = new RouteResolver(registry, RoutePolicy.defaultOnly("deepseek"));
        assertThatThrownBy(() -> resolver.resolve(Purpose.GENERATE, List.of("openai", "ghost")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void policyShouldRequireNonEmptyDefaultRoute() {
        assertThatThrownBy(() -> new RoutePolicy(Map.of(), List.of()))
            .isInstanceOf(ConfigurationException.class);
    }

    private record StubProvider(String name) implements LlmProvider {
        @Override
        public String model() {
            return "m";
        }

        @Override
        public CompletableFuture<String> generate(LlmRequest request) {
            return CompletableFuture.completedFuture("ok");
        }
    }
}
