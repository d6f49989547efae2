/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationResult;

import java.util.Optional;

/**
 * Value stored in the pipeline cache: either a validator's or a rule's outcome.
 */
public record CachedResult(ValidationResult validation, RuleResult rule) {

    public static CachedResult of(ValidationResult validation) {
        return new CachedResult(validation, null);
    }

    public static CachedResult of(RuleResult rule) {
        return new CachedResult(null, rule);
    }

    public Optional<ValidationResult> validationResult() {
        return Optional.ofNullable(validation);
    }

    public Optional<RuleResult> ruleResult() {
        return Optional.ofNullable(rule);
    }
}
