/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Performance figures attached to every {@link ValidationResult}.
 */
public record ValidationMetrics(
        @JsonProperty("duration_ms") long durationMillis,
        @JsonProperty("rules_executed") int rulesExecuted,
        @JsonProperty("validators_used") int validatorsUsed,
        @JsonProperty("cache_stats") CacheStats cacheStats
) implements Serializable {

    public ValidationMetrics {
        cacheStats = cacheStats != null ? cacheStats : CacheStats.EMPTY;
    }

    public static ValidationMetrics empty() {
        return new ValidationMetrics(0, 0, 0, CacheStats.EMPTY);
    }

    /**
     * Metrics of a single validator run that executed no rules.
     */
    public static ValidationMetrics singleValidator(long durationMillis) {
        return new ValidationMetrics(durationMillis, 0, 1, CacheStats.EMPTY);
    }
}
