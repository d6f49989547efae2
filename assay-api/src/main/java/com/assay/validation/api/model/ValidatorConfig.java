/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Collections;

/**
 * Per-validator settings.
 *
 * <p>A {@code timeoutMillis} of zero or less means "use the pipeline timeout".
 */
public record ValidatorConfig(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("priority") int priority,
        @JsonProperty("timeout_ms") long timeoutMillis,
        @JsonProperty("cacheable") boolean cacheable,
        @JsonProperty("options") Map<String, Object> options
) implements Serializable {

    public static final long DEFAULT_TIMEOUT_MILLIS = 5000;

    public ValidatorConfig {
        options = options != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(options))
                : Map.of();
    }

    public static ValidatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasTimeout() {
        return timeoutMillis > 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .priority(priority)
                .timeoutMillis(timeoutMillis)
                .cacheable(cacheable)
                .options(options);
    }

    public static final class Builder {
        private boolean enabled = true;
        private int priority = 0;
        private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
        private boolean cacheable = true;
        private final Map<String, Object> options = new LinkedHashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder cacheable(boolean cacheable) {
            this.cacheable = cacheable;
            return this;
        }

        public Builder option(String key, Object value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options.putAll(options);
            return this;
        }

        public ValidatorConfig build() {
            return new ValidatorConfig(enabled, priority, timeoutMillis, cacheable, options);
        }
    }
}
