package io.mnemo.core.merge;

import io.mnemo.core.model.ExtractionResult;
import io.mnemo.core.model.MemoryItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Combines a fresh confidence with a prior one using the harmonic mean, so disagreement drags the
 * result towards the lower score. A missing side counts as 0.5.
 */
public final class ConfidenceMerger {
    public static final double ABSENT = 0.5;

    public double merge(Double fresh, Double prior) {
        double a = clamp(fresh == null ? ABSENT : fresh);
        double b = clamp(prior == null ? ABSENT : prior);
        if (a + b == 0.0) {
            return 0.0;
        }
        return 2.0 * (a * b) / (a + b);
    }

    public double merge(double fresh, OptionalDouble prior) {
        return merge(fresh, prior.isPresent() ? prior.getAsDouble() : null);
    }

    public MemoryItem merge(MemoryItem fresh, OptionalDouble prior) {
        return fresh.withConfidence(merge(fresh.confidence(), prior));
    }

    public ExtractionResult merge(ExtractionResult result, PriorMemoryLookup lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        List<MemoryItem> merged = new ArrayList<>(result.memories().size());
        for (MemoryItem item : result.memories()) {
            merged.add(merge(item, lookup.priorConfidence(item)));
        }
        return new ExtractionResult(result.schemaVersion(), merged);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return ABSENT;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
