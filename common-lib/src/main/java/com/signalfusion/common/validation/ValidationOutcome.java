package com.signalfusion.common.validation;

import com.signalfusion.common.model.ConsensusRecommendation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating one {@link ConsensusRecommendation}.
 *
 * <p>{@code errors} keeps every hard violation found on the original values, including those
 * that auto-correction resolved (flagged {@link ValidationIssue#resolved()}), so a corrected
 * field is never silently accepted. {@code valid} is true only when no hard error remains once
 * {@code correctedValues} are applied.
 *
 * <p>Always attached to the recommendation it validated; never persisted on its own.
 */
public record ValidationOutcome(
    boolean valid,
    List<ValidationIssue> errors,
    List<ValidationIssue> warnings,
    Map<String, Double> correctedValues
) {
    public ValidationOutcome {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        correctedValues = Collections.unmodifiableMap(new LinkedHashMap<>(correctedValues));
    }

    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::toString).toList();
    }

    public List<String> warningMessages() {
        return warnings.stream().map(ValidationIssue::toString).toList();
    }

    /** Errors auto-correction could not resolve. Empty exactly when {@link #valid()} is true. */
    public List<ValidationIssue> unresolvedErrors() {
        return errors.stream().filter(e -> !e.resolved()).toList();
    }

    /** The recommendation with every corrected field applied. */
    public ConsensusRecommendation apply(ConsensusRecommendation recommendation) {
        return recommendation.withCorrections(correctedValues);
    }
}
