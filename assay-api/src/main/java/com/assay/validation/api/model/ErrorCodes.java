/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

/**
 * Stable, machine-readable error codes emitted by the pipeline and the built-in rules.
 */
public final class ErrorCodes {

    // Rule primitives
    public static final String VALUE_OUT_OF_RANGE = "VALUE_OUT_OF_RANGE";
    public static final String PATTERN_MISMATCH = "PATTERN_MISMATCH";
    public static final String RULE_EXECUTION_ERROR = "RULE_EXECUTION_ERROR";
    public static final String ASYNC_RULE_ERROR = "ASYNC_RULE_ERROR";
    public static final String COMPOSITE_RULE_FAILURE = "COMPOSITE_RULE_FAILURE";
    public static final String COMPOSITE_RULE_ERROR = "COMPOSITE_RULE_ERROR";
    public static final String CONDITIONAL_RULE_ERROR = "CONDITIONAL_RULE_ERROR";

    // Validators
    public static final String VALIDATOR_EXECUTION_ERROR = "VALIDATOR_EXECUTION_ERROR";
    public static final String COMPOSITE_VALIDATOR_ERROR = "COMPOSITE_VALIDATOR_ERROR";

    // Pipeline
    public static final String VALIDATION_TIMEOUT = "VALIDATION_TIMEOUT";
    public static final String NO_VALIDATORS_APPLICABLE = "NO_VALIDATORS_APPLICABLE";
    public static final String VALIDATION_PIPELINE_ERROR = "VALIDATION_PIPELINE_ERROR";

    // Registration and configuration
    public static final String DUPLICATE_VALIDATOR = "DUPLICATE_VALIDATOR";
    public static final String DUPLICATE_RULE = "DUPLICATE_RULE";
    public static final String CIRCULAR_DEPENDENCY = "CIRCULAR_DEPENDENCY";
    public static final String MISSING_DEPENDENCY = "MISSING_DEPENDENCY";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";

    private ErrorCodes() {
        throw new AssertionError("No instances");
    }
}
