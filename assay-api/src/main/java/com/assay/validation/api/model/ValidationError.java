/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured description of a single validation problem.
 *
 * <p>{@code code} is stable and machine-readable (see {@link ErrorCodes}); {@code message}
 * is meant for humans. {@code context} and {@code value} are optional and may be null.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ValidationError error = ValidationError.builder(ErrorCodes.VALUE_OUT_OF_RANGE, "Value 150 is not in range")
 *     .path(context.path())
 *     .severity(Severity.ERROR)
 *     .suggestion("Provide value between 0 and 100")
 *     .value(150)
 *     .build();
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("path") List<String> path,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("suggestions") List<String> suggestions,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("value") Object value
) implements Serializable {

    public ValidationError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        message = message != null ? message : "";
        path = path != null ? List.copyOf(path) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        // Context values are allowed to be null, so Map.copyOf is not an option here
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : null;
    }

    /**
     * Convenience factory for an error without suggestions, context or value.
     */
    public static ValidationError of(String code, String message, List<String> path, Severity severity) {
        return new ValidationError(code, message, path, severity, List.of(), null, null);
    }

    public static Builder builder(String code, String message) {
        return new Builder(code, message);
    }

    /**
     * Returns true when the severity makes the owning result invalid.
     */
    public boolean isFailure() {
        return severity.isFailure();
    }

    /**
     * Returns the path as a dotted string, e.g. {@code compound.formula}.
     */
    public String pathString() {
        return String.join(".", path);
    }

    public static final class Builder {
        private final String code;
        private final String message;
        private List<String> path = List.of();
        private Severity severity = Severity.ERROR;
        private final List<String> suggestions = new ArrayList<>();
        private Map<String, Object> context;
        private Object value;

        private Builder(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public Builder path(List<String> path) {
            this.path = path;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestions.add(suggestion);
            return this;
        }

        public Builder suggestions(List<String> suggestions) {
            this.suggestions.addAll(suggestions);
            return this;
        }

        public Builder context(String key, Object value) {
            if (this.context == null) {
                this.context = new LinkedHashMap<>();
            }
            this.context.put(key, value);
            return this;
        }

        public Builder context(Map<String, Object> context) {
            if (context != null) {
                context.forEach(this::context);
            }
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public ValidationError build() {
            return new ValidationError(code, message, path, severity, suggestions, context, value);
        }
    }
}
