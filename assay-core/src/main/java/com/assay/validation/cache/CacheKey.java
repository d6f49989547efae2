/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import java.util.Objects;

/**
 * Identity of a cached result: owner name, structural hash of the value, hash of
 * the owner's configuration and its schema version.
 *
 * @param owner         validator name, or {@code rule:<name>} for rules
 * @param valueHash     structural hash of the validated value
 * @param configHash    hash of the owner's configuration
 * @param schemaVersion schema version tag
 */
public record CacheKey(String owner, String valueHash, String configHash, String schemaVersion) {

    public CacheKey {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(valueHash, "valueHash must not be null");
        Objects.requireNonNull(configHash, "configHash must not be null");
        Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
    }

    /**
     * Compact string form used in events and logs.
     */
    public String asString() {
        return owner + ':' + valueHash + ':' + configHash + ':' + schemaVersion;
    }

    @Override
    public String toString() {
        return asString();
    }
}
