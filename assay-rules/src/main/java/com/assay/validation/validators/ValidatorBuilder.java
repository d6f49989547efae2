/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.validators;

import com.assay.validation.api.Validator;
import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.ValidatorConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent assembly of validators.
 *
 * <p>{@link #build()} returns the single added validator unchanged, or a
 * {@link CompositeValidator} when several were added.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Validator compound = ValidatorBuilder.named("compound")
 *     .add(formulaValidator)
 *     .add(massValidator)
 *     .withPriority(10)
 *     .withTimeout(2000)
 *     .build();
 * }</pre>
 */
public final class ValidatorBuilder {

    private String name;
    private final List<Validator> validators = new ArrayList<>();
    private ValidatorConfig.Builder config = ValidatorConfig.builder();

    private ValidatorBuilder(String name) {
        this.name = name;
    }

    public static ValidatorBuilder named(String name) {
        return new ValidatorBuilder(name);
    }

    public ValidatorBuilder add(Validator validator) {
        validators.add(validator);
        return this;
    }

    public ValidatorBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public ValidatorBuilder withConfig(ValidatorConfig config) {
        this.config = config.toBuilder();
        return this;
    }

    public ValidatorBuilder withPriority(int priority) {
        config.priority(priority);
        return this;
    }

    public ValidatorBuilder withCaching(boolean enabled) {
        config.cacheable(enabled);
        return this;
    }

    public ValidatorBuilder withTimeout(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new ConfigurationException(ErrorCodes.INVALID_CONFIGURATION,
                    "Validator timeout must be positive: " + timeoutMillis);
        }
        config.timeoutMillis(timeoutMillis);
        return this;
    }

    public Validator build() {
        if (validators.isEmpty()) {
            throw new ConfigurationException(ErrorCodes.INVALID_CONFIGURATION,
                    String.format("Cannot build validator '%s' without any validators", name));
        }
        if (validators.size() == 1) {
            return validators.get(0);
        }
        return new CompositeValidator(name, validators, config.build());
    }
}
