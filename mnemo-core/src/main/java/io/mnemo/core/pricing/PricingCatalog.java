package io.mnemo.core.pricing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider, per-model token prices in USD.
 */
public final class PricingCatalog {
    private final Map<String, Map<String, ModelPricing>> prices = new ConcurrentHashMap<>();

    public static PricingCatalog defaults() {
        PricingCatalog catalog = new PricingCatalog();
        catalog.register("claude", "claude-3-opus", new ModelPricing(0.015, 0.075));
        catalog.register("claude", "claude-3-sonnet", new ModelPricing(0.003, 0.015));
        catalog.register("claude", "claude-3-haiku", new ModelPricing(0.00025, 0.00125));
        catalog.register("openai", "gpt-4-turbo", new ModelPricing(0.01, 0.03));
        catalog.register("openai", "gpt-4", new ModelPricing(0.03, 0.06));
        catalog.register("openai", "gpt-3.5-turbo", new ModelPricing(0.0005, 0.0015));
        return catalog;
    }

    public void register(String provider, String model, ModelPricing pricing) {
        prices.computeIfAbsent(normalize(provider), ignored -> new ConcurrentHashMap<>())
            .put(normalize(model), pricing);
    }

    public Optional<ModelPricing> find(String provider, String model) {
        Map<String, ModelPricing> models = prices.get(normalize(provider));
        if (models == null) {
            return Optional.empty();
        }
        String key = normalize(model);
        ModelPricing exact = models.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        // dated ids such as claude-3-haiku-20240307 resolve to their family entry
        String bestPrefix = null;
        for (String candidate : models.keySet()) {
            if (key.startsWith(candidate + "-") && (bestPrefix == null || candidate.length() > bestPrefix.length())) {
                bestPrefix = candidate;
            }
        }
        return bestPrefix == null ? Optional.empty() : Optional.of(models.get(bestPrefix));
    }

    /**
     * Cost in USD, or 0 for unknown models.
     */
    public double cost(String provider, String model, int inputTokens, int outputTokens) {
        return find(provider, model)
            .map(pricing -> pricing.cost(inputTokens, outputTokens))
            .orElse(0.0);
    }

    public Optional<PricedModel> cheapest(int inputTokens, int outputTokens) {
        PricedModel best = null;
        for (Map.Entry<String, Map<String, ModelPricing>> provider : prices.entrySet()) {
            for (Map.Entry<String, ModelPricing> model : provider.getValue().entrySet()) {
                double cost = model.getValue().cost(inputTokens, outputTokens);
                if (best == null || cost < best.costUsd()) {
                    best = new PricedModel(provider.getKey(), model.getKey(), cost);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public List<String> providers() {
        return prices.keySet().stream().sorted().toList();
    }

    public Map<String, ModelPricing> models(String provider) {
        Map<String, ModelPricing> models = prices.get(normalize(provider));
        return models == null ? Map.of() : new LinkedHashMap<>(models);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public record PricedModel(String provider, String model, double costUsd) {
    }
}
