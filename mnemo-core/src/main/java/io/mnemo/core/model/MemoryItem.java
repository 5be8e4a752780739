package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated memory. Only built from output that passed the schema contract.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryItem(
    String id,
    String content,
    EmotionalContext emotionalContext,
    Significance significance,
    Map<String, Object> relationshipDynamics,
    String rationale,
    double confidence
) {
    public MemoryItem {
        relationshipDynamics = relationshipDynamics == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(relationshipDynamics));
    }

    public MemoryItem withConfidence(double value) {
        return new MemoryItem(id, content, emotionalContext, significance, relationshipDynamics, rationale, value);
    }
}
