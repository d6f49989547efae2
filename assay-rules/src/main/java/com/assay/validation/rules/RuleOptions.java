/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Optional rule settings shared by every rule type.
 *
 * <p>{@code timeoutMillis} is only used by {@link AsyncRule}.
 */
public record RuleOptions(
        Set<String> dependencies,
        int priority,
        boolean cacheable,
        long timeoutMillis
) {

    public static final long DEFAULT_ASYNC_TIMEOUT_MILLIS = 5000;

    private static final RuleOptions DEFAULTS = builder().build();

    public RuleOptions {
        dependencies = dependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))
                : Set.of();
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
    }

    public static RuleOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> dependencies = new LinkedHashSet<>();
        private int priority = 0;
        private boolean cacheable = true;
        private long timeoutMillis = DEFAULT_ASYNC_TIMEOUT_MILLIS;

        public Builder dependsOn(String... names) {
            this.dependencies.addAll(Arrays.asList(names));
            return this;
        }

        public Builder dependsOn(Collection<String> names) {
            this.dependencies.addAll(names);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder cacheable(boolean cacheable) {
            this.cacheable = cacheable;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public RuleOptions build() {
            return new RuleOptions(dependencies, priority, cacheable, timeoutMillis);
        }
    }
}
