/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.validators;

import com.assay.validation.api.Validator;
import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.model.CacheStats;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationMetrics;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.api.model.ValidatorConfig;
import com.assay.validation.api.model.ValidatorSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every applicable child validator in registration order and unions their results.
 *
 * <p>A child that throws, or whose future fails, contributes a
 * {@link ErrorCodes#COMPOSITE_VALIDATOR_ERROR} error instead of aborting the composite.
 */
public class CompositeValidator extends BaseValidator<Object> {

    private static final Logger logger = Logger.getLogger(CompositeValidator.class.getName());

    private final List<Validator> validators = new CopyOnWriteArrayList<>();

    public CompositeValidator(String name, List<Validator> validators, ValidatorConfig config) {
        super(name, Object.class, config);
        validators.forEach(this::addValidator);
    }

    public CompositeValidator(String name, List<Validator> validators) {
        this(name, validators, ValidatorConfig.defaults());
    }

    public synchronized void addValidator(Validator validator) {
        if (getValidator(validator.name()).isPresent()) {
            throw new ConfigurationException(ErrorCodes.DUPLICATE_VALIDATOR, String.format(
                    "Validator '%s' already exists in composite '%s'", validator.name(), name()));
        }
        validators.add(validator);
    }

    public synchronized boolean removeValidator(String name) {
        return validators.removeIf(v -> v.name().equals(name));
    }

    public Optional<Validator> getValidator(String name) {
        return validators.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    public List<Validator> validators() {
        return List.copyOf(validators);
    }

    @Override
    public boolean canValidate(Object value) {
        return validators.stream().anyMatch(v -> childCanValidate(v, value));
    }

    @Override
    protected CompletableFuture<ValidationResult> doValidate(Object value, ValidationContext context) {
        long start = System.nanoTime();
        List<Validator> applicable = validators.stream()
                .filter(v -> childCanValidate(v, value))
                .toList();

        List<ValidationResult> results = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Validator validator : applicable) {
            chain = chain.thenCompose(ignored -> runChild(validator, value, context)
                    .handle((result, error) -> {
                        if (error == null && result != null) {
                            results.add(result);
                            errors.addAll(result.errors());
                            warnings.addAll(result.warnings());
                        } else {
                            errors.add(childFailure(validator, error, context));
                        }
                        return null;
                    }));
        }

        return chain.thenApply(ignored -> {
            long hits = 0;
            long misses = 0;
            int rules = 0;
            for (ValidationResult result : results) {
                rules += result.metrics().rulesExecuted();
                hits += result.metrics().cacheStats().hits();
                misses += result.metrics().cacheStats().misses();
            }
            long duration = (System.nanoTime() - start) / 1_000_000;
            ValidationMetrics metrics = new ValidationMetrics(
                    duration, rules, applicable.size(), CacheStats.of(hits, misses));
            return ValidationResult.of(errors, warnings, metrics);
        });
    }

    private static CompletableFuture<ValidationResult> runChild(Validator validator,
                                                                Object value,
                                                                ValidationContext context) {
        try {
            CompletableFuture<ValidationResult> future = validator.validate(value, context);
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("validator returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ValidationError childFailure(Validator validator, Throwable error, ValidationContext context) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        String message = cause != null ? RuleExecutionException.describe(cause) : "validator returned no result";
        logger.log(Level.FINE, String.format("Child validator '%s' of '%s' failed", validator.name(), name()), cause);
        return ValidationError.builder(ErrorCodes.COMPOSITE_VALIDATOR_ERROR,
                        String.format("Validator '%s' failed: %s", validator.name(), message))
                .path(context.path())
                .severity(Severity.ERROR)
                .suggestion("Check validator configuration")
                .suggestion("Verify input data")
                .context("validator", validator.name())
                .context("error", message)
                .build();
    }

    private static boolean childCanValidate(Validator validator, Object value) {
        try {
            return validator.canValidate(value);
        } catch (RuntimeException e) {
            logger.log(Level.FINE, String.format("canValidate of '%s' threw, skipping", validator.name()), e);
            return false;
        }
    }

    @Override
    protected ValidatorSchema createSchema() {
        Set<String> types = new LinkedHashSet<>();
        Set<String> required = new LinkedHashSet<>();
        Set<String> optional = new LinkedHashSet<>();
        List<ValidatorSchema> children = new ArrayList<>();
        for (Validator validator : validators) {
            ValidatorSchema schema = validator.getSchema();
            children.add(schema);
            types.addAll(schema.types());
            required.addAll(schema.requiredValidators());
            optional.addAll(schema.optionalValidators());
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("compositeOf", validators.stream().map(Validator::name).toList());
        properties.put("childSchemas", children);
        return new ValidatorSchema(
                name(),
                ValidatorSchema.DEFAULT_VERSION,
                "Composite schema for " + name(),
                List.copyOf(types),
                List.copyOf(required),
                List.copyOf(optional),
                properties);
    }
}
