/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.pipeline;

/**
 * Point-in-time snapshot of a pipeline.
 *
 * @param validators        registered validators
 * @param rules             registered rules
 * @param cacheSize         live cache entries
 * @param cacheHitRate      cache hits over lookups since creation, 0 when nothing was looked up
 * @param avgDurationMillis mean duration over the sampled window, 0 when nothing was sampled
 */
public record PipelineStats(
        int validators,
        int rules,
        long cacheSize,
        double cacheHitRate,
        double avgDurationMillis
) {
}
