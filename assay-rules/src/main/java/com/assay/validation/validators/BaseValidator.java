/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.validators;

import com.assay.validation.api.Validator;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationMetrics;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.api.model.ValidatorConfig;
import com.assay.validation.api.model.ValidatorSchema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Common state and result helpers for validators handling values of type {@code T}.
 *
 * <p>{@link #canValidate(Object)} defaults to an {@code instanceof} check against the
 * declared type. Subclasses implement {@link #doValidate}.
 *
 * @param <T> type of value the validator handles
 */
public abstract class BaseValidator<T> implements Validator {

    private final String name;
    private final Class<T> type;
    private final ValidatorConfig config;
    private final Set<String> dependencies;

    protected BaseValidator(String name, Class<T> type, ValidatorConfig config, Set<String> dependencies) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.config = config != null ? config : ValidatorConfig.defaults();
        this.dependencies = dependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))
                : Set.of();
    }

    protected BaseValidator(String name, Class<T> type, ValidatorConfig config) {
        this(name, type, config, Set.of());
    }

    protected BaseValidator(String name, Class<T> type) {
        this(name, type, ValidatorConfig.defaults(), Set.of());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ValidatorConfig config() {
        return config;
    }

    @Override
    public Set<String> dependencies() {
        return dependencies;
    }

    protected Class<T> type() {
        return type;
    }

    @Override
    public boolean canValidate(Object value) {
        return type.isInstance(value);
    }

    @Override
    public final CompletableFuture<ValidationResult> validate(Object value, ValidationContext context) {
        return doValidate(type.cast(value), context);
    }

    protected abstract CompletableFuture<ValidationResult> doValidate(T value, ValidationContext context);

    @Override
    public ValidatorSchema getSchema() {
        return createSchema();
    }

    protected ValidatorSchema createSchema() {
        return new ValidatorSchema(
                name,
                ValidatorSchema.DEFAULT_VERSION,
                "Schema for " + name + " validator",
                List.of(type.getSimpleName()),
                List.copyOf(dependencies),
                List.of(),
                null);
    }

    protected ValidationError error(String code, String message, ValidationContext context, String... suggestions) {
        return ValidationError.builder(code, message)
                .path(context.path())
                .severity(Severity.ERROR)
                .suggestions(List.of(suggestions))
                .build();
    }

    protected ValidationResult successResult(List<ValidationError> warnings) {
        return ValidationResult.success(warnings, ValidationMetrics.singleValidator(0));
    }

    protected ValidationResult failureResult(List<ValidationError> errors, List<ValidationError> warnings) {
        return ValidationResult.of(errors, warnings, ValidationMetrics.singleValidator(0));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', priority=" + config.priority() + "}";
    }
}
