/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.config;

import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.cache.CacheType;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration of a validation pipeline.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #fromEnvironment()} reads every property from an environment variable named
 * {@code ASSAY_<PROPERTY>}, or from the system property {@code assay.<property>}
 * (lower case, underscores replaced by dots) when the variable is not set:
 * <pre>
 * ASSAY_TIMEOUT_MS=10000
 * ASSAY_ENABLE_CACHING=true
 * ASSAY_CACHE_TTL_MS=600000
 * ASSAY_MAX_CACHE_SIZE=5000
 * ASSAY_CACHE_TYPE=CAFFEINE
 * ASSAY_CONTINUE_ON_ERROR=false
 * ASSAY_PARALLEL_ENABLED=true
 * ASSAY_MAX_CONCURRENCY=20
 * ASSAY_MONITORING_ENABLED=true
 * ASSAY_MONITORING_SAMPLE_RATE=0.1
 * ASSAY_MONITORING_THRESHOLD_MS=1000
 * ASSAY_MONITORING_WINDOW_SIZE=1000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ValidationPipelineConfig config = ValidationPipelineConfig.builder()
 *     .timeoutMillis(2_000)
 *     .maxConcurrency(8)
 *     .continueOnError(false)
 *     .build();
 * }</pre>
 */
public final class ValidationPipelineConfig {

    private static final Logger logger = Logger.getLogger(ValidationPipelineConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_TIMEOUT_MS = "ASSAY_TIMEOUT_MS";
    static final String ENV_ENABLE_CACHING = "ASSAY_ENABLE_CACHING";
    static final String ENV_CACHE_TTL_MS = "ASSAY_CACHE_TTL_MS";
    static final String ENV_MAX_CACHE_SIZE = "ASSAY_MAX_CACHE_SIZE";
    static final String ENV_CACHE_TYPE = "ASSAY_CACHE_TYPE";
    static final String ENV_CONTINUE_ON_ERROR = "ASSAY_CONTINUE_ON_ERROR";
    static final String ENV_PARALLEL_ENABLED = "ASSAY_PARALLEL_ENABLED";
    static final String ENV_MAX_CONCURRENCY = "ASSAY_MAX_CONCURRENCY";
    static final String ENV_MONITORING_ENABLED = "ASSAY_MONITORING_ENABLED";
    static final String ENV_MONITORING_SAMPLE_RATE = "ASSAY_MONITORING_SAMPLE_RATE";
    static final String ENV_MONITORING_THRESHOLD_MS = "ASSAY_MONITORING_THRESHOLD_MS";
    static final String ENV_MONITORING_WINDOW_SIZE = "ASSAY_MONITORING_WINDOW_SIZE";

    /**
     * Concurrency settings. With {@code enabled == false} work runs strictly one item at a time.
     */
    public record Parallel(boolean enabled, int maxConcurrency) {
    }

    /**
     * Performance monitoring settings.
     *
     * @param sampleRate              fraction of calls whose duration is recorded, 0 to 1
     * @param durationThresholdMillis average duration above which a threshold event fires
     * @param windowSize              number of most recent samples kept
     */
    public record Monitoring(boolean enabled, double sampleRate, long durationThresholdMillis, int windowSize) {
    }

    private final long timeoutMillis;
    private final boolean cachingEnabled;
    private final long cacheTtlMillis;
    private final long maxCacheSize;
    private final CacheType cacheType;
    private final boolean continueOnError;
    private final Parallel parallel;
    private final Monitoring monitoring;

    private ValidationPipelineConfig(Builder builder) {
        this.timeoutMillis = builder.timeoutMillis;
        this.cachingEnabled = builder.cachingEnabled;
        this.cacheTtlMillis = builder.cacheTtlMillis;
        this.maxCacheSize = builder.maxCacheSize;
        this.cacheType = builder.cacheType;
        this.continueOnError = builder.continueOnError;
        this.parallel = new Parallel(builder.parallelEnabled, builder.maxConcurrency);
        this.monitoring = new Monitoring(builder.monitoringEnabled, builder.sampleRate,
                builder.durationThresholdMillis, builder.windowSize);

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static ValidationPipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Favours throughput: longer-lived and larger cache, high concurrency, stops at
     * the first failure.
     */
    public static ValidationPipelineConfig forFastValidation() {
        return builder()
                .timeoutMillis(10_000)
                .enableCaching(true)
                .cacheTtlMillis(600_000)
                .maxCacheSize(5_000)
                .continueOnError(false)
                .parallel(true, 20)
                .monitoring(true, 0.1)
                .build();
    }

    /**
     * Favours completeness: long timeout, no caching, sequential execution, every
     * call sampled.
     */
    public static ValidationPipelineConfig forThoroughValidation() {
        return builder()
                .timeoutMillis(120_000)
                .enableCaching(false)
                .cacheTtlMillis(0)
                .maxCacheSize(0)
                .continueOnError(true)
                .parallel(false, 1)
                .monitoring(true, 1.0)
                .build();
    }

    /**
     * Defaults overridden from {@code ASSAY_*} environment variables or {@code assay.*}
     * system properties.
     *
     * @throws ConfigurationException if a variable holds an unparseable or invalid value
     */
    public static ValidationPipelineConfig fromEnvironment() {
        return fromLookup(ValidationPipelineConfig::getEnvOrProperty);
    }

    static ValidationPipelineConfig fromLookup(Function<String, String> lookup) {
        Builder builder = builder();
        EnvironmentReader env = new EnvironmentReader(lookup);

        env.getLong(ENV_TIMEOUT_MS).ifPresent(builder::timeoutMillis);
        env.getBoolean(ENV_ENABLE_CACHING).ifPresent(builder::enableCaching);
        env.getLong(ENV_CACHE_TTL_MS).ifPresent(builder::cacheTtlMillis);
        env.getLong(ENV_MAX_CACHE_SIZE).ifPresent(builder::maxCacheSize);
        env.get(ENV_CACHE_TYPE).ifPresent(val -> builder.cacheType(parseCacheType(val)));
        env.getBoolean(ENV_CONTINUE_ON_ERROR).ifPresent(builder::continueOnError);
        env.getBoolean(ENV_PARALLEL_ENABLED).ifPresent(val -> builder.parallelEnabled = val);
        env.getInt(ENV_MAX_CONCURRENCY).ifPresent(val -> builder.maxConcurrency = val);
        env.getBoolean(ENV_MONITORING_ENABLED).ifPresent(val -> builder.monitoringEnabled = val);
        env.getDouble(ENV_MONITORING_SAMPLE_RATE).ifPresent(val -> builder.sampleRate = val);
        env.getLong(ENV_MONITORING_THRESHOLD_MS).ifPresent(builder::durationThresholdMillis);
        env.getInt(ENV_MONITORING_WINDOW_SIZE).ifPresent(builder::windowSize);

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .timeoutMillis(timeoutMillis)
                .enableCaching(cachingEnabled)
                .cacheTtlMillis(cacheTtlMillis)
                .maxCacheSize(maxCacheSize)
                .cacheType(cacheType)
                .continueOnError(continueOnError)
                .parallel(parallel.enabled(), parallel.maxConcurrency())
                .monitoring(monitoring.enabled(), monitoring.sampleRate())
                .durationThresholdMillis(monitoring.durationThresholdMillis())
                .windowSize(monitoring.windowSize());
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (timeoutMillis <= 0) {
            throw invalid("timeoutMillis must be positive: " + timeoutMillis);
        }
        if (cacheType == null) {
            throw invalid("cacheType must not be null");
        }
        if (cachingEnabled) {
            if (cacheTtlMillis <= 0) {
                throw invalid("cacheTtlMillis must be positive when caching is enabled: " + cacheTtlMillis);
            }
            if (maxCacheSize < 0) {
                throw invalid("maxCacheSize must not be negative: " + maxCacheSize);
            }
        }
        if (parallel.maxConcurrency() < 1) {
            throw invalid("maxConcurrency must be at least 1: " + parallel.maxConcurrency());
        }
        if (monitoring.sampleRate() < 0 || monitoring.sampleRate() > 1) {
            throw invalid("sampleRate must be between 0 and 1: " + monitoring.sampleRate());
        }
        if (monitoring.durationThresholdMillis() <= 0) {
            throw invalid("durationThresholdMillis must be positive: " + monitoring.durationThresholdMillis());
        }
        if (monitoring.windowSize() < 1) {
            throw invalid("windowSize must be at least 1: " + monitoring.windowSize());
        }

        logger.fine("Pipeline configuration validated: " + this);
    }

    private static ConfigurationException invalid(String message) {
        return new ConfigurationException(ErrorCodes.INVALID_CONFIGURATION, message);
    }

    private static CacheType parseCacheType(String value) {
        try {
            return CacheType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ErrorCodes.INVALID_CONFIGURATION,
                    "Invalid " + ENV_CACHE_TYPE + ": " + value, e);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public long getCacheTtlMillis() {
        return cacheTtlMillis;
    }

    public long getMaxCacheSize() {
        return maxCacheSize;
    }

    public CacheType getCacheType() {
        return cacheType;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public Parallel getParallel() {
        return parallel;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    /**
     * Permits available to one {@code validate} or {@code validateBatch} call.
     */
    public int effectiveConcurrency() {
        return parallel.enabled() ? parallel.maxConcurrency() : 1;
    }

    @Override
    public String toString() {
        return "ValidationPipelineConfig{" +
                "timeoutMillis=" + timeoutMillis +
                ", cachingEnabled=" + cachingEnabled +
                ", cacheTtlMillis=" + cacheTtlMillis +
                ", maxCacheSize=" + maxCacheSize +
                ", cacheType=" + cacheType +
                ", continueOnError=" + continueOnError +
                ", parallel=" + parallel +
                ", monitoring=" + monitoring +
                '}';
    }

    // ========================================================================
    // ENVIRONMENT HELPERS
    // ========================================================================

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key.toLowerCase(Locale.ROOT).replace('_', '.'));
        }
        return value;
    }

    private record EnvironmentReader(Function<String, String> lookup) {

        Optional<String> get(String key) {
            String value = lookup.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded configuration override: " + key + "=" + value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        Optional<Long> getLong(String key) {
            return get(key).map(val -> parse(key, val, Long::parseLong));
        }

        Optional<Integer> getInt(String key) {
            return get(key).map(val -> parse(key, val, Integer::parseInt));
        }

        Optional<Double> getDouble(String key) {
            return get(key).map(val -> parse(key, val, Double::parseDouble));
        }

        Optional<Boolean> getBoolean(String key) {
            return get(key).map(val -> {
                if (!"true".equalsIgnoreCase(val) && !"false".equalsIgnoreCase(val)) {
                    throw new ConfigurationException(ErrorCodes.INVALID_CONFIGURATION,
                            "Invalid boolean value for " + key + ": " + val);
                }
                return Boolean.parseBoolean(val);
            });
        }

        private static <T> T parse(String key, String value, Function<String, T> parser) {
            try {
                return parser.apply(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException(ErrorCodes.INVALID_CONFIGURATION,
                        "Invalid numeric value for " + key + ": " + value, e);
            }
        }
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private long timeoutMillis = 5_000;
        private boolean cachingEnabled = true;
        private long cacheTtlMillis = 300_000;
        private long maxCacheSize = 1_000;
        private CacheType cacheType = CacheType.IN_MEMORY;
        private boolean continueOnError = true;
        private boolean parallelEnabled = true;
        private int maxConcurrency = 4;
        private boolean monitoringEnabled = true;
        private double sampleRate = 0.1;
        private long durationThresholdMillis = 1_000;
        private int windowSize = 1_000;

        private Builder() {
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder enableCaching(boolean enabled) {
            this.cachingEnabled = enabled;
            return this;
        }

        public Builder cacheTtlMillis(long ttlMillis) {
            this.cacheTtlMillis = ttlMillis;
            return this;
        }

        public Builder maxCacheSize(long maxCacheSize) {
            this.maxCacheSize = maxCacheSize;
            return this;
        }

        public Builder cacheType(CacheType cacheType) {
            this.cacheType = cacheType;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder parallel(boolean enabled, int maxConcurrency) {
            this.parallelEnabled = enabled;
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder monitoring(boolean enabled, double sampleRate) {
            this.monitoringEnabled = enabled;
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder durationThresholdMillis(long thresholdMillis) {
            this.durationThresholdMillis = thresholdMillis;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public ValidationPipelineConfig build() {
            return new ValidationPipelineConfig(this);
        }
    }
}
