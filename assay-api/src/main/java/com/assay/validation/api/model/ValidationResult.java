/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate outcome of a validator or of a whole pipeline run.
 *
 * <p>Use {@link #of(List, List, ValidationMetrics)} to build results: it derives
 * {@code valid} from the errors, which is true iff no error has severity
 * {@link Severity#ERROR} or above.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ValidationResult result = pipeline.validate(compound).join();
 * if (!result.valid()) {
 *     result.mostSevereError().ifPresent(e -> log.warning(e.message()));
 * }
 * }</pre>
 */
public record ValidationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("errors") List<ValidationError> errors,
        @JsonProperty("warnings") List<ValidationError> warnings,
        @JsonProperty("metrics") ValidationMetrics metrics,
        @JsonProperty("from_cache") boolean fromCache,
        @JsonProperty("timestamp") Instant timestamp
) implements Serializable {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        metrics = metrics != null ? metrics : ValidationMetrics.empty();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ValidationResult of(List<ValidationError> errors,
                                      List<ValidationError> warnings,
                                      ValidationMetrics metrics) {
        boolean valid = errors == null || errors.stream().noneMatch(ValidationError::isFailure);
        return new ValidationResult(valid, errors, warnings, metrics, false, Instant.now());
    }

    public static ValidationResult success(ValidationMetrics metrics) {
        return of(List.of(), List.of(), metrics);
    }

    public static ValidationResult success(List<ValidationError> warnings, ValidationMetrics metrics) {
        return of(List.of(), warnings, metrics);
    }

    public static ValidationResult failure(List<ValidationError> errors, ValidationMetrics metrics) {
        return of(errors, List.of(), metrics);
    }

    public ValidationResult withFromCache(boolean fromCache) {
        return new ValidationResult(valid, errors, warnings, metrics, fromCache, timestamp);
    }

    public ValidationResult withMetrics(ValidationMetrics metrics) {
        return new ValidationResult(valid, errors, warnings, metrics, fromCache, timestamp);
    }

    /**
     * Returns true if validation passed but produced warnings.
     */
    public boolean hasOnlyWarnings() {
        return errors.isEmpty() && !warnings.isEmpty();
    }

    /**
     * Returns the first error with the highest severity, if any.
     */
    public Optional<ValidationError> mostSevereError() {
        return errors.stream().max(Comparator.comparing(ValidationError::severity));
    }

    /**
     * Returns true if any error has severity {@link Severity#ERROR} or above.
     */
    public boolean hasFailures() {
        return errors.stream().anyMatch(ValidationError::isFailure);
    }
}
