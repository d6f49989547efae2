/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.cache;

/**
 * Supported result cache implementations.
 */
public enum CacheType {
    /** Strict LRU with per-entry TTL (default) */
    IN_MEMORY,

    /** Caffeine cache with W-TinyLFU eviction */
    CAFFEINE,

    /** Stores nothing */
    NO_OP
}
