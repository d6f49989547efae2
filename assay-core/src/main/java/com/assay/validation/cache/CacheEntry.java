/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

/**
 * Snapshot of a cached value.
 *
 * @param key            cache key
 * @param value          cached value
 * @param createdAtNanos ticker reading at insertion
 * @param expiresAtNanos ticker reading after which the entry is stale
 * @param hitCount       hits served by the entry so far, including this one
 */
public record CacheEntry<V>(
        CacheKey key,
        V value,
        long createdAtNanos,
        long expiresAtNanos,
        long hitCount
) {
}
