/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.google.common.base.Ticker;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Result cache backed by Caffeine.
 *
 * <p>Eviction is W-TinyLFU rather than strict LRU, so under size pressure the evicted
 * entry is not necessarily the least recently used one. Expiry is after write with the
 * same {@link Ticker} as the rest of the pipeline. Size-based eviction happens
 * asynchronously; {@link #size()} runs pending maintenance first. Hit counts are kept
 * beside each value so that reading an entry never refreshes its write time.
 */
public class CaffeineResultCache<V> implements ResultCache<V> {

    private static final Logger logger = Logger.getLogger(CaffeineResultCache.class.getName());

    private final Cache<CacheKey, Slot<V>> cache;
    private final long ttlNanos;
    private final Ticker ticker;

    public CaffeineResultCache(long maxSize, long ttl, TimeUnit unit, Ticker ticker) {
        this.ttlNanos = unit.toNanos(ttl);
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl, unit)
                .ticker(ticker::read)
                .executor(Runnable::run)
                .recordStats()
                .removalListener((key, value, cause) ->
                        logger.fine(String.format("Cache eviction: key=%s, cause=%s", key, cause)))
                .build();

        logger.info(String.format("CaffeineResultCache initialized: maxSize=%d, ttl=%dms",
                maxSize, unit.toMillis(ttl)));
    }

    @Override
    public Optional<CacheEntry<V>> get(CacheKey key) {
        Slot<V> slot = cache.getIfPresent(key);
        if (slot == null) {
            return Optional.empty();
        }
        long hits = slot.hits.incrementAndGet();
        return Optional.of(new CacheEntry<>(key, slot.value, slot.createdAtNanos, slot.createdAtNanos + ttlNanos, hits));
    }

    @Override
    public void put(CacheKey key, V value) {
        cache.put(key, new Slot<>(value, ticker.read()));
    }

    @Override
    public void invalidate(CacheKey key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheMetrics getMetrics() {
        CacheStats stats = cache.stats();
        return CacheMetrics.of(stats.hitCount(), stats.missCount(), stats.evictionCount(), size());
    }

    private static final class Slot<V> {
        private final V value;
        private final long createdAtNanos;
        private final AtomicLong hits = new AtomicLong();

        Slot(V value, long createdAtNanos) {
            this.value = value;
            this.createdAtNanos = createdAtNanos;
        }
    }
}
