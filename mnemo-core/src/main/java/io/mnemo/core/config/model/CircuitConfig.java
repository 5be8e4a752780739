package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CircuitConfig(
    double threshold,
    @JsonAlias({"minimum_calls"}) int probes,
    @JsonAlias({"cooldown_seconds"}) int cooldownSeconds
) {
    public static CircuitConfig defaults() {
        return new CircuitConfig(0.5, 5, 30);
    }
}
