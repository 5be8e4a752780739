package io.mnemo.core.merge;

import io.mnemo.core.model.MemoryItem;
import java.util.OptionalDouble;

/**
 * Looks up the confidence previously stored for a memory, used when a conversation is
 * re-processed.
 */
@FunctionalInterface
public interface PriorMemoryLookup {
    OptionalDouble priorConfidence(MemoryItem fresh);
}
