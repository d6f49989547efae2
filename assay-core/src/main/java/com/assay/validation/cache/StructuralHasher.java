/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stable structural hash of arbitrary values.
 *
 * <p>The value is serialized with Jackson with map entries and bean properties sorted
 * by name, so two maps holding the same entries hash identically whatever their
 * insertion order. The bytes are hashed with murmur3-128.
 *
 * <p>Values Jackson cannot serialize fall back to their class name and
 * {@code toString()}, which is only as stable as that method. This includes beans
 * without visible properties: serializing them as {@code {}} would give every such
 * value the same hash.
 */
public final class StructuralHasher {

    private static final Logger logger = Logger.getLogger(StructuralHasher.class.getName());

    private static final HashFunction HASH = Hashing.murmur3_128();

    private final ObjectMapper mapper;

    public StructuralHasher() {
        this.mapper = JsonMapper.builder()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .build();
    }

    public String hash(Object value) {
        return HASH.hashBytes(canonicalBytes(value)).toString();
    }

    private byte[] canonicalBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Falling back to toString() hashing for " + value.getClass().getName(), e);
            }
            return (value.getClass().getName() + '@' + value).getBytes(StandardCharsets.UTF_8);
        }
    }
}
