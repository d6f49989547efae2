/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import com.google.common.base.Ticker;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory cache with strict LRU eviction and per-entry TTL.
 *
 * <p>Features:
 * <ul>
 *   <li>{@code get} returns an entry only while {@code now < expiresAt}; expired
 *       entries are evicted lazily on access</li>
 *   <li>{@code put} evicts the least recently used entry once {@code maxSize} is reached</li>
 *   <li>{@code maxSize == 0} stores nothing</li>
 *   <li>time comes from an injected Guava {@link Ticker}</li>
 * </ul>
 *
 * <p>Thread-safe; operations on the table are serialized.
 */
public class InMemoryResultCache<V> implements ResultCache<V> {

    private static final Logger logger = Logger.getLogger(InMemoryResultCache.class.getName());

    private final LinkedHashMap<CacheKey, InternalEntry<V>> entries;
    private final long maxSize;
    private final long ttlNanos;
    private final Ticker ticker;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    private static final class InternalEntry<V> {
        final V value;
        final long createdAtNanos;
        final long expiresAtNanos;
        long hitCount;

        InternalEntry(V value, long createdAtNanos, long expiresAtNanos) {
            this.value = value;
            this.createdAtNanos = createdAtNanos;
            this.expiresAtNanos = expiresAtNanos;
        }

        boolean isExpired(long now) {
            return now - expiresAtNanos >= 0;
        }

        CacheEntry<V> toCacheEntry(CacheKey key) {
            return new CacheEntry<>(key, value, createdAtNanos, expiresAtNanos, hitCount);
        }
    }

    public InMemoryResultCache(long maxSize, long ttl, TimeUnit unit, Ticker ticker) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        if (ttl <= 0) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.maxSize = maxSize;
        this.ttlNanos = unit.toNanos(ttl);
        this.ticker = ticker;
        // access-order iteration puts the least recently used entry first
        this.entries = new LinkedHashMap<>(16, 0.75f, true);

        logger.info(String.format("InMemoryResultCache initialized: maxSize=%d, ttl=%dms",
                maxSize, unit.toMillis(ttl)));
    }

    @Override
    public synchronized Optional<CacheEntry<V>> get(CacheKey key) {
        InternalEntry<V> entry = entries.get(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }

        if (entry.isExpired(ticker.read())) {
            entries.remove(key);
            evictions.increment();
            misses.increment();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Expired entry evicted: " + key);
            }
            return Optional.empty();
        }

        hits.increment();
        entry.hitCount++;
        return Optional.of(entry.toCacheEntry(key));
    }

    @Override
    public synchronized void put(CacheKey key, V value) {
        if (maxSize == 0) {
            return;
        }
        long now = ticker.read();
        entries.remove(key);
        while (entries.size() >= maxSize) {
            evictEldest();
        }
        entries.put(key, new InternalEntry<>(value, now, now + ttlNanos));

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Cached entry: key=%s, ttl=%dms", key, TimeUnit.NANOSECONDS.toMillis(ttlNanos)));
        }
    }

    @Override
    public synchronized void invalidate(CacheKey key) {
        if (entries.remove(key) != null) {
            evictions.increment();
        }
    }

    @Override
    public synchronized void clear() {
        int size = entries.size();
        entries.clear();
        evictions.add(size);
        logger.info("Cache cleared: " + size + " entries removed");
    }

    @Override
    public synchronized long size() {
        return entries.size();
    }

    @Override
    public CacheMetrics getMetrics() {
        return CacheMetrics.of(hits.sum(), misses.sum(), evictions.sum(), size());
    }

    private void evictEldest() {
        Iterator<Map.Entry<CacheKey, InternalEntry<V>>> iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            CacheKey eldest = iterator.next().getKey();
            iterator.remove();
            evictions.increment();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Evicted LRU entry: " + eldest);
            }
        }
    }
}
