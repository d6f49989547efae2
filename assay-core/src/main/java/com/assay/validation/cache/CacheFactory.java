/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import com.assay.validation.config.ValidationPipelineConfig;
import com.google.common.base.Ticker;

import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Creates result caches from pipeline configuration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationPipelineConfig config = ValidationPipelineConfig.builder()
 *     .cacheType(CacheType.CAFFEINE)
 *     .maxCacheSize(50_000)
 *     .build();
 * ResultCache<CachedResult> cache = CacheFactory.create(config, Ticker.systemTicker());
 * }</pre>
 *
 * <p>Disabled caching always yields a {@link NoOpResultCache}, whatever the cache type.
 */
public final class CacheFactory {

    private static final Logger logger = Logger.getLogger(CacheFactory.class.getName());

    private CacheFactory() {
        throw new AssertionError("CacheFactory should not be instantiated");
    }

    public static <V> ResultCache<V> create(ValidationPipelineConfig config, Ticker ticker) {
        CacheType type = config.isCachingEnabled() ? config.getCacheType() : CacheType.NO_OP;
        return create(type, config.getMaxCacheSize(), config.getCacheTtlMillis(), ticker);
    }

    public static <V> ResultCache<V> create(CacheType type, long maxSize, long ttlMillis, Ticker ticker) {
        logger.info(String.format("Creating cache: type=%s, maxSize=%d, ttl=%dms", type, maxSize, ttlMillis));
        return switch (type) {
            case IN_MEMORY -> new InMemoryResultCache<>(maxSize, ttlMillis, TimeUnit.MILLISECONDS, ticker);
            case CAFFEINE -> new CaffeineResultCache<>(maxSize, ttlMillis, TimeUnit.MILLISECONDS, ticker);
            case NO_OP -> new NoOpResultCache<>();
        };
    }
}
