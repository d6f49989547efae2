/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api;

import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.api.model.ValidatorConfig;
import com.assay.validation.api.model.ValidatorSchema;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Coarse-grained check over an entire value producing a full {@link ValidationResult}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * pipeline.addValidator(new BaseValidator<String>("formula", ValidatorConfig.defaults()) {
 *     protected CompletableFuture<ValidationResult> doValidate(String value, ValidationContext ctx) {
 *         ...
 *     }
 * });
 * }</pre>
 */
public interface Validator {

    String name();

    ValidatorConfig config();

    /**
     * Names of validators that must be registered before this one and that run
     * in an earlier dependency level.
     */
    Set<String> dependencies();

    CompletableFuture<ValidationResult> validate(Object value, ValidationContext context);

    boolean canValidate(Object value);

    ValidatorSchema getSchema();
}
