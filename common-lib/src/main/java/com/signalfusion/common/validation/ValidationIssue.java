package com.signalfusion.common.validation;

/**
 * One finding of the synthesis validator.
 *
 * @param check    which check raised it
 * @param field    the recommendation field concerned (e.g. {@code stop_loss}), or null for cross-field findings
 * @param message  human-readable description, including the offending values
 * @param resolved true when auto-correction removed the violation; always false for warnings
 */
public record ValidationIssue(
    ValidationCheck check,
    String field,
    String message,
    boolean resolved
) {
    ValidationIssue markResolved() {
        return new ValidationIssue(check, field, message, true);
    }

    @Override
    public String toString() {
        return check + (field != null ? "[" + field + "]" : "") + ": " + message
            + (resolved ? " (auto-corrected)" : "");
    }
}
