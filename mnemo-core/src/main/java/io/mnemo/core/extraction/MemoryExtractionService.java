package io.mnemo.core.extraction;

import io.mnemo.core.audit.AttemptAuditor;
import io.mnemo.core.audit.FileAttemptStore;
import io.mnemo.core.budget.BudgetGuard;
import io.mnemo.core.circuit.CircuitBreaker;
import io.mnemo.core.circuit.CircuitBreakerPolicy;
import io.mnemo.core.circuit.CircuitBreakerRegistry;
import io.mnemo.core.circuit.CircuitState;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigValidation;
import io.mnemo.core.config.model.LlmConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.RateLimitConfig;
import io.mnemo.core.merge.ConfidenceMerger;
import io.mnemo.core.merge.PriorMemoryLookup;
import io.mnemo.core.metrics.MetricsSink;
import io.mnemo.core.model.ExtractionRequest;
import io.mnemo.core.provider.ProviderClient;
import io.mnemo.core.provider.ProviderException;
import io.mnemo.core.provider.ProviderFactory;
import io.mnemo.core.ratelimit.RateLimitPolicy;
import io.mnemo.core.ratelimit.RateLimiterRegistry;
import io.mnemo.core.repair.ResponseRepairPipeline;
import io.mnemo.core.retry.BackoffSchedule;
import io.mnemo.core.retry.ExtractionReport;
import io.mnemo.core.retry.OrchestratorSettings;
import io.mnemo.core.retry.ResilienceGates;
import io.mnemo.core.retry.RetryOrchestrator;
import io.mnemo.core.retry.RetryPolicy;
import io.mnemo.core.time.CancellationToken;
import io.mnemo.core.time.JitterSource;
import io.mnemo.core.time.SeededJitterSource;
import io.mnemo.core.time.Sleeper;
import io.mnemo.core.time.ThreadSleeper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the extraction layer: runs the orchestrator, merges confidence against prior
 * extractions and appends attempts to the audit log.
 */
public final class MemoryExtractionService {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryExtractionService.class);

    private final RetryOrchestrator orchestrator;
    private final ResilienceGates gates;
    private final AttemptAuditor auditor;
    private final PriorMemoryLookup priorLookup;
    private final ConfidenceMerger merger = new ConfidenceMerger();

    public MemoryExtractionService(
        RetryOrchestrator orchestrator,
        ResilienceGates gates,
        AttemptAuditor auditor,
        PriorMemoryLookup priorLookup
    ) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.gates = Objects.requireNonNull(gates, "gates must not be null");
        this.auditor = auditor;
        this.priorLookup = priorLookup;
    }

    public static MemoryExtractionService fromConfig(MnemoConfig config, ProviderFactory providers, MetricsSink metrics) {
        return fromConfig(config, providers, metrics, null, Clock.systemUTC(), new ThreadSleeper(), new SeededJitterSource());
    }

    /**
     * Builds the full stack from configuration.
     *
     * @throws IllegalStateException listing every configuration problem when the config is invalid
     */
    public static MemoryExtractionService fromConfig(
        MnemoConfig config,
        ProviderFactory providers,
        MetricsSink metrics,
        PriorMemoryLookup priorLookup,
        Clock clock,
        Sleeper sleeper,
        JitterSource jitter
    ) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(providers, "providers must not be null");
        MetricsSink sink = metrics == null ? MetricsSink.noop() : metrics;

        List<String> errors = new ArrayList<>(ConfigValidation.validate(config).errors());
        LlmConfig llm = config.llm();
        ProviderClient primary = null;
        ProviderClient fallback = null;
        if (errors.isEmpty()) {
            primary = resolve(providers, llm.primaryProvider(), errors);
            fallback = llm.hasFallback() ? resolve(providers, llm.fallbackProvider(), errors) : null;
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid memory LLM configuration: " + String.join("; ", errors));
        }

        CircuitBreakerPolicy circuitPolicy = new CircuitBreakerPolicy(
            config.circuit().threshold(),
            config.circuit().probes(),
            Duration.ofSeconds(config.circuit().cooldownSeconds())
        );
        Map<String, RateLimitPolicy> limits = new LinkedHashMap<>();
        config.rateLimits().forEach((name, limit) -> limits.put(name, limit.toPolicy()));
        ResilienceGates gates = new ResilienceGates(
            new BudgetGuard(llm.dailyBudgetUsd(), clock),
            new CircuitBreakerRegistry(circuitPolicy, clock, circuitGauges(sink)),
            new RateLimiterRegistry(limits, RateLimitConfig.defaults().toPolicy(), clock, sleeper)
        );
        // gauges exist from the start, a healthy provider reports closed before its first call
        gates.circuits().breaker(primary.name());
        if (fallback != null) {
            gates.circuits().breaker(fallback.name());
        }
        sink.trackBudgetUtilization(gates.budget()::utilizationPercent);
        OrchestratorSettings settings = new OrchestratorSettings(
            Duration.ofSeconds(llm.callTimeoutSeconds()),
            Duration.ofSeconds(llm.admissionTimeoutSeconds()),
            llm.streaming(),
            llm.temperature()
        );
        RetryOrchestrator orchestrator = new RetryOrchestrator(
            primary,
            fallback,
            gates,
            new RetryPolicy(llm.maxRetries(), RetryPolicy.defaults().maxCorrectiveRetries(), false),
            new BackoffSchedule(jitter),
            settings,
            new DefaultPromptRenderer(),
            new ResponseRepairPipeline(sink),
            sink,
            clock,
            sleeper
        );

        AttemptAuditor auditor = null;
        if (config.audit().enabled()) {
            auditor = new AttemptAuditor(
                new FileAttemptStore(ConfigPaths.resolve(config.audit().path())),
                config.audit().maxRecords()
            );
        }
        LOG.info("Memory extraction ready: primary={} ({}), fallback={}, daily budget ${}",
            primary.name(), primary.model(), fallback == null ? "none" : fallback.name(), llm.dailyBudgetUsd());
        return new MemoryExtractionService(orchestrator, gates, auditor, priorLookup);
    }

    public ExtractionReport extract(ExtractionRequest request) {
        return extract(request, CancellationToken.none());
    }

    public ExtractionReport extract(ExtractionRequest request, CancellationToken token) {
        ExtractionReport report = orchestrator.execute(request, token);
        if (auditor != null) {
            try {
                auditor.append(report.attempts());
            } catch (IOException e) {
                LOG.warn("Failed to append {} attempt records: {}", report.attempts().size(), e.getMessage());
            }
        }
        if (report.succeeded() && priorLookup != null && report.result() != null) {
            return report.withResult(merger.merge(report.result(), priorLookup));
        }
        return report;
    }

    public ServiceStatus status() {
        ProviderClient primary = orchestrator.primary();
        ProviderClient fallback = orchestrator.fallback();
        return new ServiceStatus(
            primary.name(),
            primary.model(),
            fallback == null ? "" : fallback.name(),
            gates.budget().state(),
            gates.circuits().states(),
            gates.limiters().snapshots()
        );
    }

    public AttemptAuditor auditor() {
        return auditor;
    }

    private static CircuitBreaker.TransitionListener circuitGauges(MetricsSink sink) {
        return new CircuitBreaker.TransitionListener() {
            @Override
            public void onTransition(String provider, CircuitState from, CircuitState to) {
                sink.recordCircuitState(provider, to);
            }

            @Override
            public void onCreated(String provider, CircuitState state) {
                sink.recordCircuitState(provider, state);
            }
        };
    }

    private static ProviderClient resolve(ProviderFactory providers, String name, List<String> errors) {
        if (name.isBlank()) {
            return null;
        }
        try {
            ProviderClient client = providers.resolve(name);
            client.validateConfig();
            return client;
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        } catch (ProviderException e) {
            errors.add("Provider \"" + name + "\": " + e.getMessage());
        }
        return null;
    }
}
