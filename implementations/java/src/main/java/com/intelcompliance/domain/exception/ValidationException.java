package com.intelcompliance.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Malformed input, rejected before any state change.
 */
@Getter
public class ValidationException extends ComplianceException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(summarize(violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String field, String message) {
        this(List.of(new Violation(field, message)));
    }

    private static String summarize(List<Violation> violations) {
        if (violations.isEmpty()) {
            return "Validation failed";
        }
        StringBuilder sb = new StringBuilder("Validation failed: ");
        for (int i = 0; i < violations.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(violations.get(i).field()).append(' ').append(violations.get(i).message());
        }
        return sb.toString();
    }

    public record Violation(String field, String message) {}
}
