/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.metrics;

import java.time.Duration;

/**
 * Latency recorder with percentile tracking.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    long count();

    /**
     * Gets percentile value.
     *
     * @param percentile value between 0.0 and 1.0
     * @return duration at percentile, {@link Duration#ZERO} when nothing was recorded
     */
    Duration percentile(double percentile);
}
