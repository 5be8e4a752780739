package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Immutable input of one extraction. {@link #withCorrectiveInstruction(String)} derives a new
 * request instead of mutating this one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionRequest(
    List<MessageExcerpt> excerpts,
    @JsonAlias({"mood_context"}) MoodContext moodContext,
    @JsonAlias({"schema_version"}) String schemaVersion,
    @JsonAlias({"max_tokens"}) int maxTokens,
    @JsonAlias({"corrective_instruction"}) String correctiveInstruction
) {
    public static final String DEFAULT_SCHEMA_VERSION = "memory_llm_response_v1";
    public static final int DEFAULT_MAX_TOKENS = 4096;

    public ExtractionRequest {
        excerpts = excerpts == null ? List.of() : List.copyOf(excerpts);
        moodContext = moodContext == null ? MoodContext.neutral() : moodContext;
        schemaVersion = schemaVersion == null || schemaVersion.isBlank() ? DEFAULT_SCHEMA_VERSION : schemaVersion.trim();
        maxTokens = maxTokens <= 0 ? DEFAULT_MAX_TOKENS : maxTokens;
        correctiveInstruction = correctiveInstruction == null ? "" : correctiveInstruction;
    }

    public ExtractionRequest(List<MessageExcerpt> excerpts, MoodContext moodContext, String schemaVersion, int maxTokens) {
        this(excerpts, moodContext, schemaVersion, maxTokens, "");
    }

    public ExtractionRequest withCorrectiveInstruction(String instruction) {
        return new ExtractionRequest(excerpts, moodContext, schemaVersion, maxTokens, instruction);
    }

    public boolean corrective() {
        return !correctiveInstruction.isBlank();
    }
}
