package io.mnemo.cli;

import io.mnemo.core.config.ConfigValidation;
import io.mnemo.core.config.model.MnemoConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show provider, budget and circuit configuration")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-c", "--config"}, description = "Config file (default ~/.mnemo/config.json)")
    Path configFile;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.loadConfig(configFile);
            System.out.println("Config path: " + context.configPath(configFile));
            System.out.println("Config exists: " + Files.exists(context.configPath(configFile)));
            System.out.println("Primary provider: " + config.llm().primaryProvider());
            System.out.println("Fallback provider: " + (config.llm().hasFallback() ? config.llm().fallbackProvider() : "none"));
            System.out.println("Daily budget (USD): "
                + (config.llm().dailyBudgetUsd() > 0 ? config.llm().dailyBudgetUsd() : "disabled"));
            System.out.println("Max transport attempts: " + config.llm().maxRetries());
            System.out.println("Call timeout (s): " + config.llm().callTimeoutSeconds());
            System.out.println("Circuit threshold: " + config.circuit().threshold()
                + " after " + config.circuit().probes() + " calls, cooldown " + config.circuit().cooldownSeconds() + "s");
            config.providers().keySet().stream().sorted().forEach(name ->
                System.out.println("Provider " + name + " configured: " + config.provider(name).configured())
            );

            ConfigValidation validation = ConfigValidation.validate(config);
            if (validation.valid()) {
                System.out.println("Configuration: valid");
                return 0;
            }
            System.out.println("Configuration: invalid");
            validation.errors().forEach(error -> System.out.println("  - " + error));
            return 1;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
