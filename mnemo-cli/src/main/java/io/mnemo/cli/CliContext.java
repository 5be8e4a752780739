package io.mnemo.cli;

import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    ServiceFactory serviceFactory
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(ConfigService configService, Path configPath, ServiceFactory serviceFactory) {
        this(configService, configPath, System.getenv(), serviceFactory);
    }

    public Path configPath(Path override) {
        return override == null ? configPath : override;
    }

    public MnemoConfig loadConfig(Path override) throws IOException {
        return configService.loadEffective(configPath(override), environment);
    }
}
