package io.mnemo.core.pricing;

import io.mnemo.core.model.TokenUsage;
import java.util.Objects;

public final class CostEstimator {
    private final PricingCatalog catalog;

    public CostEstimator(PricingCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Worst-case cost of a call: the full prompt plus the whole output cap.
     */
    public double estimate(String provider, String model, int promptTokens, int maxOutputTokens) {
        return catalog.cost(provider, model, promptTokens, maxOutputTokens);
    }

    public double actual(String provider, String model, TokenUsage usage) {
        return catalog.cost(provider, model, usage.inputTokens(), usage.outputTokens());
    }
}
