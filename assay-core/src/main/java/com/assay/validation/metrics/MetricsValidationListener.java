/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.metrics;

import com.assay.validation.api.ValidationListener;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationResult;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Translates pipeline events into metrics.
 *
 * <p>Recorded metrics:
 * <ul>
 *   <li>{@code assay_validations_total{outcome}}: completed calls, {@code valid} or {@code invalid}</li>
 *   <li>{@code assay_validation_errors_total}: errors across all completed calls</li>
 *   <li>{@code assay_validation_duration}: timer of call durations</li>
 *   <li>{@code assay_pipeline_errors_total}: unexpected pipeline failures</li>
 *   <li>{@code assay_validator_executions_total{validator,outcome}}</li>
 *   <li>{@code assay_rule_executions_total{rule,outcome}} and timer {@code assay_rule_duration{rule}}</li>
 *   <li>{@code assay_cache_hits_total}, {@code assay_cache_misses_total}</li>
 *   <li>{@code assay_performance_threshold_exceeded_total{metric}}</li>
 *   <li>gauges {@code assay_registered_validators}, {@code assay_registered_rules}</li>
 * </ul>
 */
public final class MetricsValidationListener implements ValidationListener {

    static final String VALIDATIONS = "assay_validations_total";
    static final String VALIDATION_ERRORS = "assay_validation_errors_total";
    static final String VALIDATION_DURATION = "assay_validation_duration";
    static final String PIPELINE_ERRORS = "assay_pipeline_errors_total";
    static final String VALIDATOR_EXECUTIONS = "assay_validator_executions_total";
    static final String RULE_EXECUTIONS = "assay_rule_executions_total";
    static final String RULE_DURATION = "assay_rule_duration";
    static final String CACHE_HITS = "assay_cache_hits_total";
    static final String CACHE_MISSES = "assay_cache_misses_total";
    static final String THRESHOLD_EXCEEDED = "assay_performance_threshold_exceeded_total";
    static final String REGISTERED_VALIDATORS = "assay_registered_validators";
    static final String REGISTERED_RULES = "assay_registered_rules";

    private final MetricsRegistry metrics;
    private final AtomicInteger validators = new AtomicInteger();
    private final AtomicInteger rules = new AtomicInteger();

    public MetricsValidationListener(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onValidationCompleted(ValidationResult result) {
        metrics.counter(VALIDATIONS, "outcome", outcome(result.valid())).increment();
        metrics.counter(VALIDATION_ERRORS).increment(result.errors().size());
        metrics.timer(VALIDATION_DURATION).record(Duration.ofMillis(result.metrics().durationMillis()));
    }

    @Override
    public void onValidationError(Throwable error) {
        metrics.counter(PIPELINE_ERRORS).increment();
    }

    @Override
    public void onValidatorExecuted(String validator, ValidationResult result) {
        metrics.counter(VALIDATOR_EXECUTIONS, "validator", validator, "outcome", outcome(result.valid()))
                .increment();
    }

    @Override
    public void onRuleExecuted(String rule, RuleResult result) {
        metrics.counter(RULE_EXECUTIONS, "rule", rule, "outcome", outcome(result.passed())).increment();
        if (!result.cached()) {
            metrics.timer(RULE_DURATION, "rule", rule).record(Duration.ofMillis(result.durationMillis()));
        }
    }

    @Override
    public void onCacheHit(String key) {
        metrics.counter(CACHE_HITS).increment();
    }

    @Override
    public void onCacheMiss(String key) {
        metrics.counter(CACHE_MISSES).increment();
    }

    @Override
    public void onPerformanceThreshold(String metric, double value, double threshold) {
        metrics.counter(THRESHOLD_EXCEEDED, "metric", metric).increment();
    }

    @Override
    public void onValidatorRegistered(String validator) {
        metrics.gauge(REGISTERED_VALIDATORS).set(validators.incrementAndGet());
    }

    @Override
    public void onValidatorUnregistered(String validator) {
        metrics.gauge(REGISTERED_VALIDATORS).set(validators.decrementAndGet());
    }

    @Override
    public void onRuleRegistered(String rule) {
        metrics.gauge(REGISTERED_RULES).set(rules.incrementAndGet());
    }

    @Override
    public void onRuleUnregistered(String rule) {
        metrics.gauge(REGISTERED_RULES).set(rules.decrementAndGet());
    }

    private static String outcome(boolean passed) {
        return passed ? "valid" : "invalid";
    }
}
