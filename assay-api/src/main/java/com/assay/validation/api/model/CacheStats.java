/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Cache hit/miss counters observed during one validation run.
 */
public record CacheStats(
        @JsonProperty("hits") long hits,
        @JsonProperty("misses") long misses,
        @JsonProperty("hit_rate") double hitRate
) implements Serializable {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0.0);

    public static CacheStats of(long hits, long misses) {
        long total = hits + misses;
        return new CacheStats(hits, misses, total > 0 ? (double) hits / total : 0.0);
    }
}
