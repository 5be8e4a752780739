package io.mnemo.core.extraction;

import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.ExtractionRequest;
import java.util.List;

/**
 * Renders an extraction request into chat messages. Implementations must include the request's
 * corrective instruction when one is set.
 */
@FunctionalInterface
public interface PromptRenderer {
    List<ChatMessage> render(ExtractionRequest request);
}
