package io.mnemo.core.provider;

import io.mnemo.core.pricing.PricingCatalog;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import okhttp3.OkHttpClient;

/**
 * Resolves provider names to clients. The only place that knows concrete provider types; new
 * providers are added by registering a builder here.
 */
public final class ProviderFactory {
    private final Map<String, Supplier<ProviderClient>> builders = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final Map<String, ProviderClient> instances = new ConcurrentHashMap<>();

    /**
     * Registers the built-in providers. Names without an API key resolve to a
     * {@link DisabledProvider}.
     */
    public static ProviderFactory withDefaults(
        Map<String, ProviderSettings> settings,
        PricingCatalog pricing,
        OkHttpClient client
    ) {
        Objects.requireNonNull(pricing, "pricing must not be null");
        OkHttpClient shared = client == null ? AbstractHttpProvider.defaultClient() : client;
        ProviderFactory factory = new ProviderFactory();
        ProviderSettings claude = lookup(settings, AnthropicProvider.NAME);
        factory.register(AnthropicProvider.NAME, () -> claude.configured()
            ? new AnthropicProvider(claude, pricing, shared)
            : new DisabledProvider(AnthropicProvider.NAME, "MEMORY_LLM_API_KEY_CLAUDE is not set"));
        factory.alias("anthropic", AnthropicProvider.NAME);

        ProviderSettings openai = lookup(settings, OpenAiCompatProvider.NAME);
        factory.register(OpenAiCompatProvider.NAME, () -> openai.configured()
            ? new OpenAiCompatProvider(OpenAiCompatProvider.NAME, openai, pricing, shared)
            : new DisabledProvider(OpenAiCompatProvider.NAME, "MEMORY_LLM_API_KEY_OPENAI is not set"));
        return factory;
    }

    public void register(String name, Supplier<ProviderClient> builder) {
        builders.put(normalize(name), Objects.requireNonNull(builder, "builder must not be null"));
        instances.remove(normalize(name));
    }

    public void alias(String alias, String target) {
        aliases.put(normalize(alias), normalize(target));
    }

    /**
     * @throws UnknownProviderException when nothing is registered under {@code name}
     */
    public ProviderClient resolve(String name) {
        String key = canonical(name);
        Supplier<ProviderClient> builder = builders.get(key);
        if (builder == null) {
            throw new UnknownProviderException(name);
        }
        return instances.computeIfAbsent(key, ignored -> builder.get());
    }

    public boolean isRegistered(String name) {
        return builders.containsKey(canonical(name));
    }

    public List<String> names() {
        return builders.keySet().stream().sorted().toList();
    }

    private String canonical(String name) {
        String key = normalize(name);
        return aliases.getOrDefault(key, key);
    }

    private static ProviderSettings lookup(Map<String, ProviderSettings> settings, String name) {
        if (settings == null) {
            return new ProviderSettings("", "", "");
        }
        ProviderSettings value = settings.get(name);
        return value == null ? new ProviderSettings("", "", "") : value;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
