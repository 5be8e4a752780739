package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * One selected message from the conversation, already redacted upstream.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageExcerpt(
    String id,
    @JsonAlias({"author_id"}) String authorId,
    Instant timestamp,
    String content
) {
    public MessageExcerpt {
        id = id == null ? "" : id.trim();
        authorId = authorId == null || authorId.isBlank() ? "unknown" : authorId.trim();
        content = content == null ? "" : content;
    }
}
