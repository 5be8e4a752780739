package io.mnemo.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Turns provider-specific SSE {@code data:} payloads into stream events. One instance per stream.
 */
interface SsePayloadMapper {
    List<StreamEvent> map(JsonNode payload);

    /**
     * Events to emit when the provider sends its {@code [DONE]} sentinel.
     */
    List<StreamEvent> done();
}
