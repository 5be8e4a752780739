package io.mnemo.core.retry;

import io.mnemo.core.assembly.AssembledResponse;
import io.mnemo.core.assembly.AssemblyState;
import io.mnemo.core.assembly.ResponseAssembler;
import io.mnemo.core.budget.BudgetBlockedException;
import io.mnemo.core.budget.BudgetReservation;
import io.mnemo.core.circuit.CircuitBreaker;
import io.mnemo.core.extraction.PromptRenderer;
import io.mnemo.core.metrics.MetricsSink;
import io.mnemo.core.model.AttemptRecord;
import io.mnemo.core.model.ExtractionRequest;
import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.pricing.TokenEstimator;
import io.mnemo.core.provider.ProviderClient;
import io.mnemo.core.provider.ProviderException;
import io.mnemo.core.provider.ProviderRequest;
import io.mnemo.core.provider.ProviderResponse;
import io.mnemo.core.ratelimit.RateLimiter;
import io.mnemo.core.repair.RepairResult;
import io.mnemo.core.repair.ResponseRepairPipeline;
import io.mnemo.core.time.CancellationToken;
import io.mnemo.core.time.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one extraction through budget, circuit and rate-limit gates, the provider call and response
 * repair, retrying and falling back according to {@link RetryPolicy}. Attempts within one
 * extraction are strictly sequential; the gates are shared across concurrent extractions.
 */
public final class RetryOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(RetryOrchestrator.class);

    static final String CORRECTIVE_INSTRUCTION = "Your previous reply could not be parsed. Reply again with a single "
        + "JSON object only, with no prose and no code fences, following schema %s exactly.";

    private final ProviderClient primary;
    private final ProviderClient fallback;
    private final ResilienceGates gates;
    private final RetryPolicy policy;
    private final BackoffSchedule backoff;
    private final OrchestratorSettings settings;
    private final PromptRenderer renderer;
    private final ResponseRepairPipeline repair;
    private final MetricsSink metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final TokenEstimator estimator = new TokenEstimator();

    public RetryOrchestrator(
        ProviderClient primary,
        ProviderClient fallback,
        ResilienceGates gates,
        RetryPolicy policy,
        BackoffSchedule backoff,
        OrchestratorSettings settings,
        PromptRenderer renderer,
        ResponseRepairPipeline repair,
        MetricsSink metrics,
        Clock clock,
        Sleeper sleeper
    ) {
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        this.fallback = fallback;
        this.gates = Objects.requireNonNull(gates, "gates must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.repair = Objects.requireNonNull(repair, "repair must not be null");
        this.metrics = metrics == null ? MetricsSink.noop() : metrics;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public ProviderClient primary() {
        return primary;
    }

    public ProviderClient fallback() {
        return fallback;
    }

    public ExtractionReport execute(ExtractionRequest request, CancellationToken token) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(token, "token must not be null");
        String requestId = UUID.randomUUID().toString();
        List<AttemptRecord> attempts = new ArrayList<>();

        ProviderClient current = primary;
        boolean onFallback = false;
        ExtractionRequest currentRequest = request;
        int transportFailures = 0;
        int correctiveRetries = 0;

        while (true) {
            if (token.isCancelled()) {
                return cancelled(requestId, current, attempts);
            }
            if (token.deadlineExpired()) {
                return finish(requestId, ExtractionOutcome.ERROR, ErrorKind.TIMEOUT, null, current,
                    "Deadline expired before the next attempt", attempts);
            }

            ProviderRequest providerRequest = new ProviderRequest(
                renderer.render(currentRequest),
                maxTokens(current, currentRequest),
                settings.temperature(),
                settings.callTimeout()
            );
            int promptTokens = current.estimateTokens(providerRequest.promptText());

            BudgetReservation reservation;
            try {
                reservation = gates.budget().checkAndReserve(current.estimateCost(promptTokens, providerRequest.maxTokens()));
            } catch (BudgetBlockedException e) {
                return finish(requestId, ExtractionOutcome.BUDGET_BLOCKED, null, null, current, e.getMessage(), attempts);
            }

            CircuitBreaker breaker = gates.circuits().breaker(current.name());
            Optional<CircuitBreaker.Permission> permission = breaker.tryAcquirePermission();
            if (permission.isEmpty()) {
                gates.budget().release(reservation);
                if (!onFallback && fallback != null) {
                    LOG.info("Circuit open for provider={}, trying fallback provider={}", current.name(), fallback.name());
                    metrics.recordFallback("circuit_open");
                    current = fallback;
                    onFallback = true;
                    transportFailures = 0;
                    continue;
                }
                return finish(requestId, ExtractionOutcome.CIRCUIT_OPEN, null, null, current,
                    "Circuit open for provider " + current.name(), attempts);
            }

            AttemptOutcome outcome;
            try {
                outcome = attempt(requestId, current, onFallback, currentRequest, providerRequest, promptTokens,
                    reservation, breaker, permission.get(), token, attempts);
            } catch (CancellationException e) {
                return cancelled(requestId, current, attempts);
            }
            if (outcome.succeeded()) {
                ExtractionOutcome success = onFallback ? ExtractionOutcome.FALLBACK_SUCCESS : ExtractionOutcome.SUCCESS;
                return finish(requestId, success, null, outcome.repaired(), current, "", attempts);
            }

            ProviderException failure = outcome.failure();
            ErrorKind kind = failure.kind();
            if (kind.transport()) {
                transportFailures++;
            }
            RetryDecision decision = policy.decide(kind, transportFailures, correctiveRetries,
                fallback != null && !onFallback, onFallback);
            switch (decision) {
                case RETRY -> {
                    Duration delay = token.remaining(backoff.delay(transportFailures, failure.retryAfter().orElse(null)));
                    LOG.warn("Attempt {} on provider={} failed with {}, retrying in {} ms", transportFailures, current.name(),
                        kind.code(), delay.toMillis());
                    if (!sleeper.sleep(delay, token)) {
                        return cancelled(requestId, current, attempts);
                    }
                }
                case CORRECTIVE_RETRY -> {
                    correctiveRetries++;
                    LOG.warn("Provider={} returned an unparseable response, retrying with JSON-only instruction", current.name());
                    currentRequest = currentRequest.withCorrectiveInstruction(
                        String.format(CORRECTIVE_INSTRUCTION, currentRequest.schemaVersion())
                    );
                }
                case FALLBACK -> {
                    LOG.info("Provider={} exhausted for {}, falling back to provider={}", current.name(), kind.code(),
                        fallback.name());
                    metrics.recordFallback(kind.code());
                    current = fallback;
                    onFallback = true;
                    transportFailures = 0;
                }
                case FAIL -> {
                    return finish(requestId, ExtractionOutcome.ERROR, kind, null, current, failure.getMessage(), attempts);
                }
            }
        }
    }

    private AttemptOutcome attempt(
        String requestId,
        ProviderClient provider,
        boolean onFallback,
        ExtractionRequest request,
        ProviderRequest providerRequest,
        int promptTokens,
        BudgetReservation reservation,
        CircuitBreaker breaker,
        CircuitBreaker.Permission permission,
        CancellationToken token,
        List<AttemptRecord> attempts
    ) {
        Instant started = clock.instant();
        RateLimiter limiter = gates.limiters().limiter(provider.name());
        try {
            Duration waited = limiter.acquire(token.remaining(settings.admissionTimeout()), token);
            metrics.recordRateLimitWait(provider.name(), waited);
        } catch (ProviderException e) {
            gates.budget().release(reservation);
            breaker.releasePermission(permission);
            attempts.add(record(requestId, provider, started, Duration.between(started, clock.instant()), e.kind(),
                TokenUsage.empty(), 0.0, onFallback, request.corrective()));
            return AttemptOutcome.failed(e);
        } catch (CancellationException e) {
            gates.budget().release(reservation);
            breaker.releasePermission(permission);
            throw e;
        }

        try {
            return call(requestId, provider, onFallback, request, providerRequest, promptTokens, reservation, breaker,
                permission, token, attempts, started);
        } finally {
            limiter.release();
        }
    }

    private AttemptOutcome call(
        String requestId,
        ProviderClient provider,
        boolean onFallback,
        ExtractionRequest request,
        ProviderRequest providerRequest,
        int promptTokens,
        BudgetReservation reservation,
        CircuitBreaker breaker,
        CircuitBreaker.Permission permission,
        CancellationToken token,
        List<AttemptRecord> attempts,
        Instant started
    ) {
        Instant callStart = clock.instant();
        String text;
        TokenUsage reported;
        try {
            if (settings.streaming() && provider.capabilities().supportsStreaming()) {
                AssembledResponse assembled = ResponseAssembler.assemble(provider.stream(providerRequest, token));
                if (assembled.state() == AssemblyState.ERRORED) {
                    throw assembled.error();
                }
                text = assembled.text();
                reported = assembled.usage();
            } else {
                ProviderResponse response = provider.send(providerRequest, token);
                text = response.content();
                reported = response.usage();
            }
        } catch (CancellationException e) {
            gates.budget().release(reservation);
            breaker.releasePermission(permission);
            throw e;
        } catch (RuntimeException e) {
            ProviderException failure = e instanceof ProviderException pe
                ? pe
                : new ProviderException(ErrorKind.UNKNOWN, "Provider " + provider.name() + " failed: " + e.getMessage(), e);
            Duration latency = Duration.between(callStart, clock.instant());
            metrics.recordLatency(provider.name(), provider.model(), "provider", latency);
            recordCircuit(breaker, permission, failure);
            gates.budget().release(reservation);
            attempts.add(record(requestId, provider, started, latency, failure.kind(), TokenUsage.empty(), 0.0, onFallback,
                request.corrective()));
            return AttemptOutcome.failed(failure);
        }
        Duration latency = Duration.between(callStart, clock.instant());
        metrics.recordLatency(provider.name(), provider.model(), "provider", latency);
        breaker.recordSuccess(permission);

        TokenUsage usage = estimator.reconcile(new TokenUsage(promptTokens, provider.estimateTokens(text)), reported);
        double cost = provider.estimateCost(usage.inputTokens(), usage.outputTokens());
        gates.budget().commit(reservation, cost);
        metrics.recordTokens(provider.name(), provider.model(), usage.inputTokens(), usage.outputTokens());
        metrics.recordCost(provider.name(), provider.model(), cost);

        Instant parseStart = clock.instant();
        RepairResult repaired = repair.repair(text, request.schemaVersion());
        metrics.recordLatency(provider.name(), provider.model(), "parsing", Duration.between(parseStart, clock.instant()));
        if (!repaired.success()) {
            attempts.add(record(requestId, provider, started, latency, ErrorKind.PARSING, usage, cost, onFallback,
                request.corrective()));
            return AttemptOutcome.failed(new ProviderException(
                ErrorKind.PARSING,
                "Response from " + provider.name() + " failed schema validation: " + repaired.errors()
            ));
        }
        attempts.add(record(requestId, provider, started, latency, null, usage, cost, onFallback, request.corrective()));
        return AttemptOutcome.succeeded(repaired);
    }

    private static void recordCircuit(CircuitBreaker breaker, CircuitBreaker.Permission permission, ProviderException failure) {
        if (failure.kind().circuitFailure()) {
            breaker.recordFailure(permission, failure);
        } else {
            breaker.recordSuccess(permission);
        }
    }

    private static int maxTokens(ProviderClient provider, ExtractionRequest request) {
        int cap = provider.capabilities().maxOutputTokens();
        return cap > 0 ? Math.min(cap, request.maxTokens()) : request.maxTokens();
    }

    private static AttemptRecord record(
        String requestId,
        ProviderClient provider,
        Instant started,
        Duration latency,
        ErrorKind kind,
        TokenUsage usage,
        double cost,
        boolean fallback,
        boolean corrective
    ) {
        return new AttemptRecord(
            requestId,
            provider.name(),
            provider.model(),
            started,
            latency.toMillis(),
            kind == null ? "success" : "error_" + kind.code(),
            kind == null ? "" : kind.code(),
            usage.inputTokens(),
            usage.outputTokens(),
            cost,
            fallback,
            corrective
        );
    }

    private ExtractionReport cancelled(String requestId, ProviderClient provider, List<AttemptRecord> attempts) {
        return finish(requestId, ExtractionOutcome.CANCELLED, null, null, provider, "Extraction cancelled", attempts);
    }

    private ExtractionReport finish(
        String requestId,
        ExtractionOutcome outcome,
        ErrorKind kind,
        RepairResult repaired,
        ProviderClient provider,
        String message,
        List<AttemptRecord> attempts
    ) {
        ExtractionReport report = new ExtractionReport(
            requestId,
            outcome,
            kind,
            repaired == null ? null : repaired.result(),
            provider.name(),
            provider.model(),
            repaired == null ? null : repaired.pass(),
            message,
            attempts
        );
        metrics.recordRequest(report.provider(), report.model(), report.outcomeCode());
        if (report.succeeded()) {
            LOG.debug("Extraction {} served by provider={} after {} attempt(s)", requestId, report.provider(), attempts.size());
        } else {
            LOG.warn("Extraction {} ended with {} on provider={}: {}", requestId, report.outcomeCode(), report.provider(), message);
        }
        return report;
    }

    private record AttemptOutcome(RepairResult repaired, ProviderException failure) {
        static AttemptOutcome succeeded(RepairResult repaired) {
            return new AttemptOutcome(repaired, null);
        }

        static AttemptOutcome failed(ProviderException failure) {
            return new AttemptOutcome(null, failure);
        }

        boolean succeeded() {
            return repaired != null;
        }
    }
}
