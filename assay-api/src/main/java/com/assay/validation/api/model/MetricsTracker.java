/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import java.util.concurrent.atomic.LongAdder;

/**
 * Mutable per-call accumulator shared by every context derived from one
 * {@code validate()} invocation.
 *
 * <p>Thread-safe.
 */
public final class MetricsTracker {

    private final LongAdder rulesExecuted = new LongAdder();
    private final LongAdder validatorsUsed = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder itemsExecuted = new LongAdder();
    private final LongAdder itemsFromCache = new LongAdder();

    public void recordRuleExecuted(boolean fromCache) {
        rulesExecuted.increment();
        recordItem(fromCache);
    }

    public void recordValidatorUsed(boolean fromCache) {
        validatorsUsed.increment();
        recordItem(fromCache);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    private void recordItem(boolean fromCache) {
        itemsExecuted.increment();
        if (fromCache) {
            itemsFromCache.increment();
        }
    }

    public int rulesExecuted() {
        return rulesExecuted.intValue();
    }

    public int validatorsUsed() {
        return validatorsUsed.intValue();
    }

    public CacheStats cacheStats() {
        return CacheStats.of(cacheHits.sum(), cacheMisses.sum());
    }

    /**
     * Returns true if at least one item ran and every item was served from cache.
     */
    public boolean allFromCache() {
        long executed = itemsExecuted.sum();
        return executed > 0 && executed == itemsFromCache.sum();
    }

    public ValidationMetrics toMetrics(long durationMillis) {
        return new ValidationMetrics(durationMillis, rulesExecuted(), validatorsUsed(), cacheStats());
    }
}
