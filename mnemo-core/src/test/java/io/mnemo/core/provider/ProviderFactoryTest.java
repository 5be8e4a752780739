package io.mnemo.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.pricing.PricingCatalog;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderFactoryTest {

    @Test
    void shouldResolveConfiguredBuiltIns() {
        ProviderFactory factory = ProviderFactory.withDefaults(
            Map.of(
                "claude", new ProviderSettings("sk-ant", "claude-3-haiku", ""),
                "openai", new ProviderSettings("sk-oai", "", "")
            ),
            PricingCatalog.defaults(),
            null
        );

        assertThat(factory.resolve("claude")).isInstanceOf(AnthropicProvider.class);
        assertThat(factory.resolve("claude").model()).isEqualTo("claude-3-haiku");
        assertThat(factory.resolve("openai").model()).isEqualTo(OpenAiCompatProvider.DEFAULT_MODEL);
        assertThat(factory.names()).containsExactly("claude", "openai");
    }

    @Test
    void shouldResolveAliasesCaseInsensitively() {
        ProviderFactory factory = ProviderFactory.withDefaults(
            Map.of("claude", new ProviderSettings("sk-ant", "", "")), PricingCatalog.defaults(), null);

        assertThat(factory.resolve(" Anthropic ")).isSameAs(factory.resolve("claude"));
        assertThat(factory.isRegistered("ANTHROPIC")).isTrue();
    }

    @Test
    void shouldDisableProvidersWithoutKey() {
        ProviderFactory factory = ProviderFactory.withDefaults(null, PricingCatalog.defaults(), null);

        ProviderClient openai = factory.resolve("openai");

        assertThat(openai).isInstanceOf(DisabledProvider.class);
        assertThatThrownBy(openai::validateConfig)
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_REQUEST);
                assertThat(e.getMessage()).contains("MEMORY_LLM_API_KEY_OPENAI");
            });
        assertThatThrownBy(() -> openai.send(new ProviderRequest(List.of(), 10, 0.0, null), CancellationToken.none()))
            .isInstanceOf(ProviderException.class);
        assertThat(openai.estimateCost(1000, 1000)).isZero();
    }

    @Test
    void shouldRejectUnknownProvider() {
        ProviderFactory factory = new ProviderFactory();

        assertThatThrownBy(() -> factory.resolve("mistral"))
            .isInstanceOfSatisfying(UnknownProviderException.class,
                e -> assertThat(e.providerName()).isEqualTo("mistral"));
        assertThat(factory.isRegistered("mistral")).isFalse();
    }

    @Test
    void shouldCacheInstancesUntilReRegistered() {
        ProviderFactory factory = new ProviderFactory();
        factory.register("scripted", () -> new ScriptedProvider("scripted"));

        ProviderClient first = factory.resolve("scripted");
        assertThat(factory.resolve("SCRIPTED")).isSameAs(first);

        factory.register("scripted", () -> new ScriptedProvider("scripted"));
        assertThat(factory.resolve("scripted")).isNotSameAs(first);
    }
}
