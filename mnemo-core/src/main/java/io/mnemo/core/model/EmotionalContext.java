package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmotionalContext(
    String primaryEmotion,
    List<String> secondaryEmotions,
    double intensity,
    double valence,
    List<String> themes
) {
    public EmotionalContext {
        secondaryEmotions = secondaryEmotions == null ? List.of() : List.copyOf(secondaryEmotions);
        themes = themes == null ? List.of() : List.copyOf(themes);
    }
}
