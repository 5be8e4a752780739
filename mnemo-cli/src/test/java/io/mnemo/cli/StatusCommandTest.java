package io.mnemo.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class StatusCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportValidConfiguration() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "llm": {"fallbackProvider": "openai", "dailyBudgetUsd": 12.5},
              "providers": {"claude": {"apiKey": "sk-ant"}, "openai": {"apiKey": "sk-oai"}}
            }
            """, StandardCharsets.UTF_8);

        String[] output = new String[1];
        int code = run(context(configPath, Map.of()), output);

        assertThat(code).isZero();
        assertThat(output[0])
            .contains("Config exists: true")
            .contains("Primary provider: claude")
            .contains("Fallback provider: openai")
            .contains("Daily budget (USD): 12.5")
            .contains("Provider claude configured: true")
            .contains("Configuration: valid");
    }

    @Test
    void shouldListProblemsWhenConfigurationIsInvalid() {
        String[] output = new String[1];
        int code = run(context(tempDir.resolve("missing.json"), Map.of()), output);

        assertThat(code).isEqualTo(1);
        assertThat(output[0])
            .contains("Config exists: false")
            .contains("Fallback provider: none")
            .contains("Daily budget (USD): disabled")
            .contains("Configuration: invalid")
            .contains("  - Provider \"claude\" is missing API key");
    }

    @Test
    void shouldHonourEnvironmentOverrides() {
        String[] output = new String[1];
        int code = run(context(tempDir.resolve("missing.json"), Map.of(
            "MEMORY_LLM_PRIMARY", "openai",
            "MEMORY_LLM_API_KEY_OPENAI", "sk-env"
        )), output);

        assertThat(code).isZero();
        assertThat(output[0]).contains("Primary provider: openai").contains("Provider openai configured: true");
    }

    private static CliContext context(Path configPath, Map<String, String> environment) {
        return new CliContext(new ConfigService(), configPath, environment, config -> {
            throw new IllegalStateException("status must not build the service");
        });
    }

    private static int run(CliContext context, String[] output) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            return new CommandLine(new StatusCommand(context)).execute();
        } finally {
            System.setOut(originalOut);
            output[0] = out.toString(StandardCharsets.UTF_8);
        }
    }
}
