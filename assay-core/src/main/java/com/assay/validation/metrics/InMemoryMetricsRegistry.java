/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.metrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory metrics registry, mainly for tests and embedded use.
 *
 * <p>Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * pipeline.addListener(new MetricsValidationListener(metrics));
 * pipeline.validate(value).join();
 * assertThat(metrics.getCounterValue("assay_validations_total")).isEqualTo(1L);
 * }</pre>
 *
 * <p>Tagged metrics are stored under {@code name{key=value,...}}; use {@link #metricId}
 * to build that identifier.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(metricId(name, tags), id -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(metricId(name, tags), id -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(metricId(name, tags), id -> new InMemoryTimer());
    }

    public static String metricId(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs: " + tags.length + " given");
        }
        if (tags.length == 0) {
            return name;
        }
        StringBuilder id = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                id.append(',');
            }
            id.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return id.append('}').toString();
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(metricId(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(metricId(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(metricId(name, tags));
        return timer != null ? timer.recordings() : Collections.emptyList();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static final class InMemoryCounter implements Counter {
        private final LongAdder count = new LongAdder();

        @Override
        public void increment() {
            count.increment();
        }

        @Override
        public void increment(long amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Counter increment must not be negative: " + amount);
            }
            count.add(amount);
        }

        @Override
        public long count() {
            return count.sum();
        }
    }

    private static final class InMemoryGauge implements Gauge {
        private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));

        @Override
        public void set(double value) {
            bits.set(Double.doubleToLongBits(value));
        }

        @Override
        public double value() {
            return Double.longBitsToDouble(bits.get());
        }
    }

    private static final class InMemoryTimer implements Timer {
        private final List<Duration> recordings = new CopyOnWriteArrayList<>();

        @Override
        public void record(Duration duration) {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Cannot record negative duration: " + duration);
            }
            recordings.add(duration);
        }

        @Override
        public long count() {
            return recordings.size();
        }

        /**
         * Nearest-rank percentile over every recording.
         */
        @Override
        public Duration percentile(double percentile) {
            if (recordings.isEmpty()) {
                return Duration.ZERO;
            }
            List<Duration> sorted = new ArrayList<>(recordings);
            Collections.sort(sorted);
            double p = Math.max(0.0, Math.min(1.0, percentile));
            int rank = (int) Math.ceil(p * sorted.size());
            return sorted.get(Math.max(0, rank - 1));
        }

        List<Duration> recordings() {
            return List.copyOf(recordings);
        }
    }
}
