/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.metrics;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Metrics are identified by name plus tags. Tags are given as alternating key/value
 * pairs; the same name and tags always return the same instrument.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = new InMemoryMetricsRegistry();
 * Counter failures = metrics.counter("assay_rule_failures_total", "rule", "formulaFormat");
 * failures.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer.
     */
    Timer timer(String name, String... tags);
}
