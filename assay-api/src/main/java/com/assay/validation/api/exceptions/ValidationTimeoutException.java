/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.exceptions;

import com.assay.validation.api.model.ErrorCodes;

/**
 * Signals that an operation exceeded its allotted time.
 */
public class ValidationTimeoutException extends ValidationPipelineException {

    private final String operation;
    private final long timeoutMillis;

    public ValidationTimeoutException(String operation, long timeoutMillis) {
        super(ErrorCodes.VALIDATION_TIMEOUT,
                String.format("%s timed out after %dms", operation, timeoutMillis));
        this.operation = operation;
        this.timeoutMillis = timeoutMillis;
    }

    public String getOperation() {
        return operation;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
