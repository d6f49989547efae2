/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

/**
 * Ordinal classification of a {@link ValidationError}.
 *
 * <p>Declaration order is significant: {@code INFO < WARNING < ERROR < CRITICAL}.
 * A result is invalid as soon as it carries an error at {@link #ERROR} or above.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Returns true if this severity is at least as severe as {@code other}.
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns true for {@link #ERROR} and {@link #CRITICAL}.
     */
    public boolean isFailure() {
        return isAtLeast(ERROR);
    }
}
