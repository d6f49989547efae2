/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single {@link com.assay.validation.api.Rule} execution.
 *
 * <p>A failed result normally carries an {@code error}; a passed result never does.
 * Results are immutable, the {@code with*} methods return modified copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleResult(
        @JsonProperty("passed") boolean passed,
        @JsonProperty("error") ValidationError error,
        @JsonProperty("duration_ms") long durationMillis,
        @JsonProperty("cached") boolean cached,
        @JsonProperty("metadata") Map<String, Object> metadata
) implements Serializable {

    public RuleResult {
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static RuleResult success() {
        return new RuleResult(true, null, 0, false, null);
    }

    public static RuleResult success(Map<String, Object> metadata) {
        return new RuleResult(true, null, 0, false, metadata);
    }

    public static RuleResult failure(ValidationError error) {
        return new RuleResult(false, error, 0, false, null);
    }

    public static RuleResult failure(ValidationError error, Map<String, Object> metadata) {
        return new RuleResult(false, error, 0, false, metadata);
    }

    public RuleResult withDuration(long durationMillis) {
        return new RuleResult(passed, error, durationMillis, cached, metadata);
    }

    public RuleResult withCached(boolean cached) {
        return new RuleResult(passed, error, durationMillis, cached, metadata);
    }

    /**
     * Returns a copy whose metadata is this result's metadata overlaid with {@code extra}.
     */
    public RuleResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new RuleResult(passed, error, durationMillis, cached, merged);
    }

    /**
     * Returns true if the rule failed with an error at {@link Severity#ERROR} or above.
     */
    public boolean isFailure() {
        return !passed && error != null && error.isFailure();
    }
}
