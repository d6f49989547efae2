/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import com.assay.validation.api.Rule;
import com.assay.validation.api.Validator;
import com.assay.validation.api.model.ValidatorSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link CacheKey}s for validators and rules.
 */
public final class CacheKeyFactory {

    static final String RULE_PREFIX = "rule:";

    private final StructuralHasher hasher;

    public CacheKeyFactory(StructuralHasher hasher) {
        this.hasher = hasher;
    }

    public CacheKeyFactory() {
        this(new StructuralHasher());
    }

    public CacheKey createCacheKey(String owner, Object value, Object config, String schemaVersion) {
        return new CacheKey(owner, hasher.hash(value), hasher.hash(config), schemaVersion);
    }

    public CacheKey forValidator(Validator validator, Object value) {
        ValidatorSchema schema = validator.getSchema();
        String version = schema != null ? schema.version() : ValidatorSchema.DEFAULT_VERSION;
        return createCacheKey(validator.name(), value, validator.config(), version);
    }

    public CacheKey forRule(Rule rule, Object value) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("description", rule.description());
        config.put("dependencies", List.copyOf(rule.dependencies()));
        config.put("priority", rule.priority());
        return createCacheKey(RULE_PREFIX + rule.name(), value, config, ValidatorSchema.DEFAULT_VERSION);
    }
}
