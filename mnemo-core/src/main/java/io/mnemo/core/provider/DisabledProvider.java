package io.mnemo.core.provider;

import io.mnemo.core.pricing.TokenEstimator;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;

/**
 * Placeholder for a provider that is registered but not configured. Every call fails with
 * {@code invalid_request} so the orchestrator can move on to a fallback.
 */
public final class DisabledProvider implements ProviderClient {
    private final String name;
    private final String reason;
    private final TokenEstimator estimator = new TokenEstimator();

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return "";
    }

    @Override
    public ProviderResponse send(ProviderRequest request, CancellationToken token) {
        throw notConfigured();
    }

    @Override
    public ProviderStream stream(ProviderRequest request, CancellationToken token) {
        throw notConfigured();
    }

    @Override
    public int estimateTokens(String text) {
        return estimator.estimate(text);
    }

    @Override
    public ProviderCapabilities capabilities() {
        return ProviderCapabilities.none();
    }

    @Override
    public double estimateCost(int inputTokens, int outputTokens) {
        return 0.0;
    }

    @Override
    public void validateConfig() {
        throw notConfigured();
    }

    private ProviderException notConfigured() {
        return new ProviderException(ErrorKind.INVALID_REQUEST, "Provider " + name + " is not configured (" + reason + ")");
    }
}
