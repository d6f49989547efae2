/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-call state threaded through every validator and rule.
 *
 * <p>A context is created for one {@code validate()} call and discarded afterwards.
 * {@code root} and {@code parent} are references only. The {@code shared} map and the
 * {@link MetricsTracker} are shared by every context derived from the same root context;
 * writes to {@code shared} are last-write-wins.
 */
public final class ValidationContext {

    private final List<String> path;
    private final Object root;
    private final ValidationContext parent;
    private final Map<String, Object> config;
    private final Map<String, Object> shared;
    private final MetricsTracker metrics;

    private ValidationContext(List<String> path,
                              Object root,
                              ValidationContext parent,
                              Map<String, Object> config,
                              Map<String, Object> shared,
                              MetricsTracker metrics) {
        this.path = List.copyOf(path);
        this.root = root;
        this.parent = parent;
        this.config = config;
        this.shared = shared;
        this.metrics = metrics;
    }

    /**
     * Creates a fresh root context for {@code root}.
     */
    public static ValidationContext root(Object root) {
        return new ValidationContext(List.of(), root, null, Map.of(),
                new ConcurrentHashMap<>(), new MetricsTracker());
    }

    /**
     * Derives a nested context one path segment deeper.
     */
    public ValidationContext child(String segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        List<String> childPath = new ArrayList<>(path);
        childPath.add(segment);
        return new ValidationContext(childPath, root, this, config, shared, metrics);
    }

    /**
     * Derives a view carrying a validator's options snapshot.
     */
    public ValidationContext withConfig(Map<String, Object> options) {
        Map<String, Object> snapshot = options != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(options))
                : Map.of();
        return new ValidationContext(path, root, parent, snapshot, shared, metrics);
    }

    public List<String> path() {
        return path;
    }

    public Object root() {
        return root;
    }

    public Optional<ValidationContext> parent() {
        return Optional.ofNullable(parent);
    }

    public Map<String, Object> config() {
        return config;
    }

    /**
     * Mutable map for cross-rule communication within one call. Null values are not supported.
     */
    public Map<String, Object> shared() {
        return shared;
    }

    public MetricsTracker metrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "ValidationContext{path=" + String.join(".", path) + ", config=" + config.keySet() + "}";
    }
}
