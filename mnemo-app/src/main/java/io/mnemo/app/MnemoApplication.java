package io.mnemo.app;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mnemo.cli.CliContext;
import io.mnemo.cli.ExtractCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.ReportCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.extraction.MemoryExtractionService;
import io.mnemo.core.metrics.MicrometerMetricsSink;
import io.mnemo.core.pricing.PricingCatalog;
import io.mnemo.core.provider.ProviderFactory;
import io.mnemo.core.provider.ProviderSettings;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;

public final class MnemoApplication {

    private MnemoApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        MeterRegistry registry = new SimpleMeterRegistry();
        PricingCatalog pricing = PricingCatalog.defaults();

        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            System.getenv(),
            config -> buildService(config, pricing, registry)
        );

        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("extract", new ExtractCommand(context));
        commandLine.addSubcommand("report", new ReportCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static MemoryExtractionService buildService(MnemoConfig config, PricingCatalog pricing, MeterRegistry registry) {
        Map<String, ProviderSettings> settings = new LinkedHashMap<>();
        config.providers().forEach((name, provider) -> settings.put(name, provider.toSettings()));
        ProviderFactory providers = ProviderFactory.withDefaults(settings, pricing, null);
        return MemoryExtractionService.fromConfig(config, providers, new MicrometerMetricsSink(registry));
    }
}
