/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.exceptions;

/**
 * Thrown at registration or configuration time: duplicate names, cyclic or missing
 * dependencies, invalid settings. Never thrown while validating data.
 */
public class ConfigurationException extends ValidationPipelineException {

    public ConfigurationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public ConfigurationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
