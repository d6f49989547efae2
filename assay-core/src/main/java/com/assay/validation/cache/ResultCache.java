/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import java.util.Optional;

/**
 * Size-bounded, TTL-based cache of validation outcomes.
 *
 * <p>Implementations must be thread-safe. Two callers missing the same key at the same
 * time may both compute and both {@link #put}; the later write wins.
 *
 * @param <V> cached value type
 */
public interface ResultCache<V> {

    /**
     * Returns the live entry for {@code key}. An expired entry is evicted and
     * reported as a miss.
     */
    Optional<CacheEntry<V>> get(CacheKey key);

    /**
     * Stores {@code value} with the cache's TTL, evicting as needed to respect the size bound.
     */
    void put(CacheKey key, V value);

    void invalidate(CacheKey key);

    void clear();

    long size();

    CacheMetrics getMetrics();

    /**
     * Cache performance metrics.
     */
    record CacheMetrics(
            long hits,
            long misses,
            long evictions,
            long size,
            double hitRate
    ) {
        public static CacheMetrics of(long hits, long misses, long evictions, long size) {
            long total = hits + misses;
            return new CacheMetrics(hits, misses, evictions, size, total > 0 ? (double) hits / total : 0.0);
        }
    }
}
