/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive metadata a validator publishes about itself.
 *
 * <p>{@code version} doubles as the schema version tag of cache keys: bumping it
 * invalidates every cached result of the validator.
 */
public record ValidatorSchema(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description,
        @JsonProperty("types") List<String> types,
        @JsonProperty("required_validators") List<String> requiredValidators,
        @JsonProperty("optional_validators") List<String> optionalValidators,
        @JsonProperty("properties") Map<String, Object> properties
) implements Serializable {

    public static final String DEFAULT_VERSION = "1.0.0";

    public ValidatorSchema {
        Objects.requireNonNull(name, "name must not be null");
        version = version != null ? version : DEFAULT_VERSION;
        description = description != null ? description : "";
        types = types != null ? List.copyOf(types) : List.of();
        requiredValidators = requiredValidators != null ? List.copyOf(requiredValidators) : List.of();
        optionalValidators = optionalValidators != null ? List.copyOf(optionalValidators) : List.of();
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public static ValidatorSchema of(String name, String description) {
        return new ValidatorSchema(name, DEFAULT_VERSION, description, null, null, null, null);
    }
}
