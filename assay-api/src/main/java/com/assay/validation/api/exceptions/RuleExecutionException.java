/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.exceptions;

/**
 * Wraps a throwable raised inside a rule or validator body.
 */
public class RuleExecutionException extends ValidationPipelineException {

    private final String source;

    public RuleExecutionException(String errorCode, String source, Throwable cause) {
        super(errorCode, String.format("%s failed: %s", source, describe(cause)), cause);
        this.source = source;
    }

    /**
     * Name of the rule or validator whose body failed.
     */
    public String getSource() {
        return source;
    }

    /**
     * Returns the throwable's message, or its class name when it has none.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
