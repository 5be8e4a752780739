package io.mnemo.core.repair;

import io.mnemo.core.model.ExtractionResult;
import java.util.List;

/**
 * @param pass the pass whose output validated, or {@code null} when none did
 * @param errors validation errors of the last candidate tried
 */
public record RepairResult(ExtractionResult result, RepairPass pass, List<String> errors) {
    public RepairResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean success() {
        return result != null;
    }

    public boolean repaired() {
        return success() && pass != RepairPass.DIRECT;
    }
}
