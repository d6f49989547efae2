/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.pipeline;

import com.assay.validation.api.ValidationListener;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.config.ValidationPipelineConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

/**
 * Keeps a sliding window of sampled call durations and reports when the window's
 * average exceeds the configured threshold.
 */
final class PerformanceMonitor {

    static final String DURATION_METRIC = "duration";

    private static final Logger logger = Logger.getLogger(PerformanceMonitor.class.getName());

    private final ValidationPipelineConfig.Monitoring settings;
    private final ValidationListener listener;
    private final DoubleSupplier random;
    private final Deque<Long> window = new ArrayDeque<>();
    private long windowTotal;

    PerformanceMonitor(ValidationPipelineConfig.Monitoring settings, ValidationListener listener) {
        this(settings, listener, () -> ThreadLocalRandom.current().nextDouble());
    }

    PerformanceMonitor(ValidationPipelineConfig.Monitoring settings,
                       ValidationListener listener,
                       DoubleSupplier random) {
        this.settings = settings;
        this.listener = listener;
        this.random = random;
    }

    void record(ValidationResult result) {
        if (!settings.enabled() || random.getAsDouble() >= settings.sampleRate()) {
            return;
        }

        double average;
        synchronized (this) {
            long duration = result.metrics().durationMillis();
            window.addLast(duration);
            windowTotal += duration;
            if (window.size() > settings.windowSize()) {
                windowTotal -= window.removeFirst();
            }
            average = (double) windowTotal / window.size();
        }

        double threshold = settings.durationThresholdMillis();
        if (average > threshold) {
            logger.warning(String.format("Average validation duration %.1fms exceeds threshold %.0fms",
                    average, threshold));
            listener.onPerformanceThreshold(DURATION_METRIC, average, threshold);
        }
    }

    synchronized double averageDurationMillis() {
        return window.isEmpty() ? 0.0 : (double) windowTotal / window.size();
    }

    synchronized int samples() {
        return window.size();
    }
}
