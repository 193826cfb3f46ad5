package io.chatflow.core.graph;

import java.util.ArrayList;
import java.util.List;

/// Pass/fail outcome of graph validation with ordered, human-readable errors.
///
/// @param valid true iff `errors` is empty
/// @param errors ordered error messages, never null
public record ValidationReport(boolean valid, List<String> errors) {

    public ValidationReport {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true iff errors is empty");
        }
    }

    public static ValidationReport of(List<String> errors) {
        return new ValidationReport(errors.isEmpty(), errors);
    }

    public static ValidationReport ok() {
        return new ValidationReport(true, List.of());
    }

    /// Returns a report holding this report's errors followed by `other`'s.
    public ValidationReport and(ValidationReport other) {
        List<String> combined = new ArrayList<>(errors);
        combined.addAll(other.errors);
        return of(combined);
    }
}
