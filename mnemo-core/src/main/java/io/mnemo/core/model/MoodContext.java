package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Mood score and optional mood delta computed by the upstream mood analyzer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MoodContext(
    double score,
    List<String> descriptors,
    double confidence,
    @JsonAlias({"delta_magnitude"}) Double deltaMagnitude,
    @JsonAlias({"delta_direction"}) String deltaDirection
) {
    public MoodContext {
        descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static MoodContext neutral() {
        return new MoodContext(5.0, List.of(), 0.0, null, null);
    }

    public boolean hasDelta() {
        return deltaMagnitude != null && deltaDirection != null && !deltaDirection.isBlank();
    }
}
