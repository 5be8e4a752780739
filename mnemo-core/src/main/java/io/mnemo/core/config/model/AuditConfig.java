package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    boolean enabled,
    String path,
    @JsonAlias({"max_records"}) int maxRecords
) {
    public static AuditConfig defaults() {
        return new AuditConfig(true, "~/.mnemo/attempts.json", 20_000);
    }
}
