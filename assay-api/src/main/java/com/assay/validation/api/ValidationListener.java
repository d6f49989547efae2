/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api;

import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationResult;

import java.util.List;

/**
 * Callback interface for pipeline lifecycle events.
 * Allows metrics and telemetry collaborators to observe validation without
 * touching the pipeline internals.
 *
 * <p>All methods have empty default implementations, so a listener only overrides
 * what it needs. An exception thrown from one listener is logged and does not stop
 * delivery to the other listeners.
 *
 * <h2>Usage</h2>
 * <pre>
 * pipeline.addListener(new ValidationListener() {
 *     {@literal @}Override
 *     public void onValidationCompleted(ValidationResult result) {
 *         System.out.printf("valid=%s in %d ms%n",
 *             result.valid(), result.metrics().durationMillis());
 *     }
 * });
 * </pre>
 */
public interface ValidationListener {

    /**
     * Called before any validator or rule runs.
     *
     * @param target the value being validated
     * @param validators names of the validators selected for this call
     */
    default void onValidationStarted(Object target, List<String> validators) {
    }

    default void onValidationCompleted(ValidationResult result) {
    }

    /**
     * Called when the pipeline itself fails unexpectedly. Domain failures are
     * reported through {@link #onValidationCompleted} instead.
     */
    default void onValidationError(Throwable error) {
    }

    default void onValidatorExecuted(String validator, ValidationResult result) {
    }

    default void onRuleExecuted(String rule, RuleResult result) {
    }

    default void onCacheHit(String key) {
    }

    default void onCacheMiss(String key) {
    }

    /**
     * Called when a monitored metric crosses its configured threshold.
     */
    default void onPerformanceThreshold(String metric, double value, double threshold) {
    }

    default void onValidatorRegistered(String validator) {
    }

    default void onValidatorUnregistered(String validator) {
    }

    default void onRuleRegistered(String rule) {
    }

    default void onRuleUnregistered(String rule) {
    }
}
