/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.Rule;
import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Common state and result helpers for rules.
 *
 * <p>Subclasses receive the value as {@code T}. The cast is unchecked; a value of the
 * wrong type surfaces as a {@link ClassCastException} inside the subclass body, which
 * {@link SyncRule} and {@link AsyncRule} convert into a failed result. Override
 * {@link #appliesTo(Object)} to keep such values away from the rule in the first place.
 *
 * @param <T> type of value the rule inspects
 */
public abstract class BaseRule<T> implements Rule {

    private final String name;
    private final String description;
    private final Set<String> dependencies;
    private final int priority;
    private final boolean cacheable;

    protected BaseRule(String name, String description, RuleOptions options) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = description != null ? description : "";
        RuleOptions effective = options != null ? options : RuleOptions.defaults();
        this.dependencies = effective.dependencies();
        this.priority = effective.priority();
        this.cacheable = effective.cacheable();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Set<String> dependencies() {
        return dependencies;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean cacheable() {
        return cacheable;
    }

    /**
     * Rules apply to every value unless overridden.
     */
    @Override
    public boolean appliesTo(Object value) {
        return true;
    }

    @SuppressWarnings("unchecked")
    protected T cast(Object value) {
        return (T) value;
    }

    protected RuleResult success(Map<String, Object> metadata) {
        return RuleResult.success(metadata);
    }

    protected RuleResult failure(String code,
                                 String message,
                                 ValidationContext context,
                                 List<String> suggestions,
                                 Map<String, Object> errorContext,
                                 Object value) {
        ValidationError error = ValidationError.builder(code, message)
                .path(context.path())
                .severity(Severity.ERROR)
                .suggestions(suggestions)
                .context(errorContext)
                .value(value)
                .build();
        return RuleResult.failure(error);
    }

    /**
     * Builds the failed result for a throwable that escaped a rule body.
     */
    protected RuleResult executionFailure(String code,
                                          String message,
                                          ValidationContext context,
                                          List<String> suggestions,
                                          Throwable error) {
        Throwable cause = unwrap(error);
        Map<String, Object> errorContext = new LinkedHashMap<>();
        errorContext.put("rule", name);
        errorContext.put("error", RuleExecutionException.describe(cause));
        return failure(code, message, context, suggestions, errorContext, null);
    }

    /**
     * Strips the wrappers {@link java.util.concurrent.CompletableFuture} adds around a failure.
     */
    protected static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    protected static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', priority=" + priority + "}";
    }
}
