package com.example.vulncases.validation;

import com.example.vulncases.models.TestCase;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating one raw payload: either a normalized {@link TestCase} or the ordered
 * list of field errors, never both.
 */
public record ValidationResult(TestCase testCase, List<FieldError> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (testCase == null && errors.isEmpty()) {
            throw new IllegalArgumentException("invalid result must carry at least one error");
        }
    }

    public static ValidationResult valid(TestCase testCase) {
        return new ValidationResult(testCase, List.of());
    }

    public static ValidationResult invalid(List<FieldError> errors) {
        return new ValidationResult(null, errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Groups messages by field, keeping the order in which fields were reported.
     */
    public Map<String, List<String>> errorsByField() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (FieldError error : errors) {
            grouped.computeIfAbsent(error.field(), k -> new ArrayList<>()).add(error.message());
        }
        return grouped;
    }
}
