/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rule backed by a synchronous check. Exceptions thrown by the check become a failed
 * result with {@link ErrorCodes#RULE_EXECUTION_ERROR}.
 *
 * @param <T> type of value the rule inspects
 */
public abstract class SyncRule<T> extends BaseRule<T> {

    private static final Logger logger = Logger.getLogger(SyncRule.class.getName());

    protected SyncRule(String name, String description, RuleOptions options) {
        super(name, description, options);
    }

    protected SyncRule(String name, String description) {
        this(name, description, RuleOptions.defaults());
    }

    @Override
    public final CompletableFuture<RuleResult> execute(Object value, ValidationContext context) {
        long start = System.nanoTime();
        RuleResult result;
        try {
            result = validateSync(cast(value), context);
            if (result == null) {
                throw new IllegalStateException("rule returned no result");
            }
        } catch (RuntimeException e) {
            logger.log(Level.FINE, String.format("Rule '%s' threw during execution", name()), e);
            result = executionFailure(
                    ErrorCodes.RULE_EXECUTION_ERROR,
                    String.format("Rule '%s' failed: %s", name(), RuleExecutionException.describe(e)),
                    context,
                    List.of("Check rule configuration", "Verify input data"),
                    e);
        }
        return CompletableFuture.completedFuture(result.withDuration(elapsedMillis(start)));
    }

    protected abstract RuleResult validateSync(T value, ValidationContext context);
}
