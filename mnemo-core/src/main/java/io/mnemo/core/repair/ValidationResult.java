package io.mnemo.core.repair;

import io.mnemo.core.model.ExtractionResult;
import java.util.List;

public record ValidationResult(ExtractionResult result, List<String> errors) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult valid(ExtractionResult result) {
        return new ValidationResult(result, List.of());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(null, errors);
    }

    public boolean valid() {
        return result != null && errors.isEmpty();
    }
}
