package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionResult(String schemaVersion, List<MemoryItem> memories) {
    public ExtractionResult {
        memories = memories == null ? List.of() : List.copyOf(memories);
    }
}
