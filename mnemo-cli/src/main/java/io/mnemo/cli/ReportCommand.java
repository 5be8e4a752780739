package io.mnemo.cli;

import io.mnemo.core.audit.AttemptAuditor;
import io.mnemo.core.audit.AttemptSummary;
import io.mnemo.core.audit.FileAttemptStore;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.model.AttemptRecord;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "report", description = "Summarize recorded provider attempts")
public final class ReportCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-n", "--recent"}, description = "Also list the most recent attempts", defaultValue = "0")
    int recent;

    @Option(names = {"-c", "--config"}, description = "Config file (default ~/.mnemo/config.json)")
    Path configFile;

    public ReportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.loadConfig(configFile);
            Path auditPath = ConfigPaths.resolve(config.audit().path());
            AttemptAuditor auditor = new AttemptAuditor(new FileAttemptStore(auditPath), config.audit().maxRecords());
            AttemptSummary summary = auditor.summary();

            System.out.println("Attempt log: " + auditPath);
            System.out.println("Attempts: " + summary.attempts());
            System.out.println("Successes: " + summary.successes());
            System.out.println("Failures: " + summary.failures());
            System.out.println("Success rate: " + summary.successRate() + "%");
            System.out.println("Latency p50/p95 (ms): " + summary.p50LatencyMs() + " / " + summary.p95LatencyMs());
            System.out.println("Total cost (USD): " + summary.totalCostUsd());
            System.out.println("Average cost (USD): " + summary.averageCostUsd());
            System.out.println("Fallback attempts: " + summary.fallbackAttempts());
            System.out.println("Corrective attempts: " + summary.correctiveAttempts());
            summary.attemptsByProvider().forEach((provider, count) ->
                System.out.println("Provider " + provider + ": " + count)
            );
            summary.failuresByKind().forEach((kind, count) ->
                System.out.println("Failures " + kind + ": " + count)
            );

            if (recent > 0) {
                List<AttemptRecord> records = auditor.recent(recent);
                System.out.println("Recent attempts:");
                records.forEach(record -> System.out.println(String.format(
                    Locale.ROOT,
                    "  %s %s/%s %s %dms in=%d out=%d $%.4f",
                    record.timestamp(),
                    record.provider(),
                    record.model(),
                    record.outcome(),
                    record.latencyMs(),
                    record.inputTokens(),
                    record.outputTokens(),
                    record.costUsd()
                )));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Report command failed: " + e.getMessage());
            return 1;
        }
    }
}
