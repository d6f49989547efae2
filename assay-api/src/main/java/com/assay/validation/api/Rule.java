/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.api;

import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationContext;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fine-grained check with explicit dependency and priority metadata.
 *
 * <p>Dependencies name other rules that must have <em>completed</em> (passed or failed)
 * before this rule starts. They do not gate on success; wrap the rule in a conditional
 * rule for that.
 *
 * <p>Implementations should report problems as failed {@link RuleResult}s. The pipeline
 * converts anything thrown from {@link #execute} or {@link #appliesTo} into a failed
 * result as well, but never lets it escape to the caller.
 */
public interface Rule {

    /**
     * Unique name within a pipeline.
     */
    String name();

    String description();

    /**
     * Names of rules that must complete before this one starts.
     */
    Set<String> dependencies();

    /**
     * Higher runs earlier within its dependency level.
     */
    int priority();

    boolean cacheable();

    CompletableFuture<RuleResult> execute(Object value, ValidationContext context);

    boolean appliesTo(Object value);
}
