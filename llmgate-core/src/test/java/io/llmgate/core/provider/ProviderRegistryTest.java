package io.llmgate.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.model.LlmRequest;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

    @Test
    void shouldTrackEnabledProvidersSeparatelyFromRegistered() {
        ProviderRegistry registry = ProviderRegistry.builder()
            .register(new StubProvider("deepseek"))
            .register(new StubProvider("local"), false, 3_000L)
            .build();

        assertThat(registry.names()).containsExactly("deepseek", "local");
        assertThat(registry.enabledNames()).containsExactly("deepseek");
        assertThat(registry.isRegistered("local")).isTrue();
        assertThat(registry.isEnabled("local")).isFalse();
        assertThat(registry.defaultTimeoutMs("local")).hasValue(3_000L);
        assertThat(registry.defaultTimeoutMs("deepseek")).isEmpty();
    }

    @Test
    void shouldResolveNamesWithHyphenAndCaseAliases() {
        ProviderRegistry registry = ProviderRegistry.builder()
            .register(new StubProvider("openai_compat"))
            .build();

        assertThat(registry.find("OpenAI-Compat")).isPresent();
        assertThat(registry.require("openai-compat").name()).isEqualTo("openai_compat");
    }

    @Test
    void shouldRejectUnknownAndDuplicateProviders() {
        ProviderRegistry registry = ProviderRegistry.builder().register(new StubProvider("openai")).build();

        assertThatThrownBy(() -> registry.require("missing"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unknown provider");
        assertThatThrownBy(() -> ProviderRegistry.builder()
            .register(new StubProvider("openai"))
            .register(new StubProvider("OpenAI")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Duplicate provider");
    }

    @Test
    void shouldRejectNonPositiveDefaultTimeout() {
        assertThatThrownBy(() -> ProviderRegistry.builder().register(new StubProvider("local"), true, 0L))
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
