package io.mnemo.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.config.model.LlmConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.extraction.MemoryExtractionService;
import io.mnemo.core.model.ExtractionRequest;
import io.mnemo.core.retry.ExtractionReport;
import io.mnemo.core.time.CancellationToken;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "extract", description = "Extract memories from a request JSON file")
public final class ExtractCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper;

    @Parameters(index = "0", arity = "1", description = "Path to the extraction request JSON")
    Path requestFile;

    @Option(names = {"-s", "--stream"}, description = "Stream the provider response")
    boolean stream;

    @Option(names = {"-t", "--timeout"}, description = "Overall deadline in seconds")
    Integer timeoutSeconds;

    @Option(names = {"-r", "--report"}, description = "Print the full report including attempts")
    boolean fullReport;

    @Option(names = {"-c", "--config"}, description = "Config file (default ~/.mnemo/config.json)")
    Path configFile;

    public ExtractCommand(CliContext context) {
        this.context = context;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.loadConfig(configFile);
            if (stream) {
                config = withStreaming(config);
            }
            ExtractionRequest request = mapper.readValue(Files.readString(requestFile), ExtractionRequest.class);
            MemoryExtractionService service = context.serviceFactory().create(config);
            CancellationToken token = timeoutSeconds == null
                ? CancellationToken.none()
                : CancellationToken.withDeadline(Clock.systemUTC(), Duration.ofSeconds(timeoutSeconds));

            ExtractionReport report = service.extract(request, token);
            if (fullReport) {
                System.out.println(mapper.writeValueAsString(report));
            } else if (report.succeeded()) {
                System.out.println(mapper.writeValueAsString(report.result()));
            }
            if (!report.succeeded()) {
                System.err.println("Extraction failed: " + report.outcomeCode()
                    + (report.message().isBlank() ? "" : " (" + report.message() + ")"));
                return 1;
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Extract command failed: " + e.getMessage());
            return 1;
        }
    }

    private static MnemoConfig withStreaming(MnemoConfig config) {
        LlmConfig llm = config.llm();
        LlmConfig streaming = new LlmConfig(
            llm.primaryProvider(),
            llm.fallbackProvider(),
            llm.dailyBudgetUsd(),
            llm.maxRetries(),
            llm.callTimeoutSeconds(),
            llm.admissionTimeoutSeconds(),
            true,
            llm.temperature()
        );
        return new MnemoConfig(streaming, config.circuit(), config.providers(), config.rateLimits(), config.audit());
    }
}
