package io.mnemo.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.pricing.CostEstimator;
import io.mnemo.core.pricing.PricingCatalog;
import io.mnemo.core.pricing.TokenEstimator;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Shared OkHttp plumbing: per-call deadline, cancellation hook and HTTP error classification.
 * Subclasses only describe their wire format.
 */
abstract class AbstractHttpProvider implements ProviderClient {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String model;
    private final ProviderSettings settings;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final CostEstimator costs;
    private final TokenEstimator estimator;
    protected final ObjectMapper mapper;

    protected AbstractHttpProvider(
        String name,
        ProviderSettings settings,
        String defaultBaseUrl,
        String defaultModel,
        PricingCatalog pricing,
        OkHttpClient client
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.model = settings.modelOr(defaultModel);
        this.apiBase = HttpUrl.parse(settings.baseUrlOr(defaultBaseUrl));
        this.costs = new CostEstimator(pricing);
        this.client = client == null ? defaultClient() : client;
        this.estimator = new TokenEstimator();
        this.mapper = new ObjectMapper();
    }

    static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return model;
    }

    protected ProviderSettings settings() {
        return settings;
    }

    protected HttpUrl apiBase() {
        return apiBase;
    }

    protected abstract Request buildRequest(ProviderRequest request, boolean stream) throws IOException;

    protected abstract ProviderResponse parseResponse(JsonNode root);

    protected abstract SsePayloadMapper streamMapper();

    @Override
    public ProviderResponse send(ProviderRequest request, CancellationToken token) {
        validateConfig();
        Call call = newCall(request, token, false);
        try (CancellationToken.Registration ignored = token.onCancel(call::cancel);
             Response response = call.execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw HttpErrorClassifier.fromStatus(name, response.code(), raw, response.header("Retry-After"));
            }
            return parseResponse(mapper.readTree(raw.isBlank() ? "{}" : raw));
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorKind.UNKNOWN, "Unreadable response envelope from " + name, e);
        } catch (IOException ioe) {
            if (token.isCancelled()) {
                throw new CancellationException("Call to " + name + " cancelled");
            }
            throw HttpErrorClassifier.fromIOException(name, ioe);
        }
    }

    @Override
    public ProviderStream stream(ProviderRequest request, CancellationToken token) {
        validateConfig();
        Call call = newCall(request, token, true);
        CancellationToken.Registration registration = token.onCancel(call::cancel);
        Response response = openStream(call, token, registration);
        if (!response.isSuccessful()) {
            try {
                ResponseBody body = response.body();
                String raw = body == null ? "" : body.string();
                throw HttpErrorClassifier.fromStatus(name, response.code(), raw, response.header("Retry-After"));
            } catch (IOException ioe) {
                throw HttpErrorClassifier.fromIOException(name, ioe);
            } finally {
                response.close();
                registration.close();
            }
        }
        return new SseReader(name, response, mapper, streamMapper(), token, registration);
    }

    @Override
    public int estimateTokens(String text) {
        return estimator.estimate(text);
    }

    @Override
    public double estimateCost(int inputTokens, int outputTokens) {
        return costs.estimate(name, model, inputTokens, outputTokens);
    }

    @Override
    public void validateConfig() {
        if (!settings.configured()) {
            throw new ProviderException(ErrorKind.INVALID_REQUEST, "Missing API key for provider " + name);
        }
        if (apiBase == null) {
            throw new ProviderException(ErrorKind.INVALID_REQUEST, "Invalid base URL for provider " + name + ": " + settings.baseUrl());
        }
        if (model.isBlank()) {
            throw new ProviderException(ErrorKind.INVALID_REQUEST, "No model configured for provider " + name);
        }
    }

    private Response openStream(Call call, CancellationToken token, CancellationToken.Registration registration) {
        try {
            return call.execute();
        } catch (IOException ioe) {
            registration.close();
            if (token.isCancelled()) {
                throw new CancellationException("Call to " + name + " cancelled");
            }
            throw HttpErrorClassifier.fromIOException(name, ioe);
        }
    }

    private Call newCall(ProviderRequest request, CancellationToken token, boolean stream) {
        if (token.isCancelled()) {
            throw new CancellationException("Call to " + name + " cancelled before start");
        }
        Duration budget = token.remaining(request.timeout());
        if (budget.isZero()) {
            throw new ProviderException(ErrorKind.TIMEOUT, "Deadline expired before calling " + name);
        }
        Request httpRequest;
        try {
            httpRequest = buildRequest(request, stream);
        } catch (IOException e) {
            throw new ProviderException(ErrorKind.INVALID_REQUEST, "Could not encode request for " + name, e);
        }
        Call call = client.newCall(httpRequest);
        call.timeout().timeout(Math.max(1, budget.toMillis()), TimeUnit.MILLISECONDS);
        return call;
    }
}
