/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.exceptions;

/**
 * Base exception of the validation pipeline.
 *
 * This is a RuntimeException so registration code does not need checked
 * exception handling; the error code identifies the failure kind.
 */
public class ValidationPipelineException extends RuntimeException {

    private final String errorCode;

    public ValidationPipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ValidationPipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
