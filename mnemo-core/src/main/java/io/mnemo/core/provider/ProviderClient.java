package io.mnemo.core.provider;

import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;

/**
 * One external LLM API. Callers outside {@link ProviderFactory} only ever see this interface.
 * Failures are thrown as {@link ProviderException}; cancellation through the token surfaces as
 * {@link java.util.concurrent.CancellationException}.
 */
public interface ProviderClient {
    String name();

    String model();

    ProviderResponse send(ProviderRequest request, CancellationToken token);

    default ProviderStream stream(ProviderRequest request, CancellationToken token) {
        throw new ProviderException(ErrorKind.INVALID_REQUEST, "Provider " + name() + " does not support streaming");
    }

    int estimateTokens(String text);

    ProviderCapabilities capabilities();

    double estimateCost(int inputTokens, int outputTokens);

    /**
     * Checks credentials and settings without calling the API.
     *
     * @throws ProviderException with kind {@code invalid_request} when misconfigured
     */
    void validateConfig();
}
