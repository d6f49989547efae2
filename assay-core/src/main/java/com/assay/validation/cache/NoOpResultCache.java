/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import java.util.Optional;

/**
 * Cache that never stores anything. Used when caching is disabled.
 */
public final class NoOpResultCache<V> implements ResultCache<V> {

    @Override
    public Optional<CacheEntry<V>> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, V value) {
    }

    @Override
    public void invalidate(CacheKey key) {
    }

    @Override
    public void clear() {
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public CacheMetrics getMetrics() {
        return CacheMetrics.of(0, 0, 0, 0);
    }
}
