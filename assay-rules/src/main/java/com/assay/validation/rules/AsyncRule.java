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
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rule backed by an asynchronous check with its own timeout.
 *
 * <p>Both a timeout and an exception (thrown synchronously or through the future) become
 * a failed result with {@link ErrorCodes#ASYNC_RULE_ERROR}. A timed-out check is not
 * cancelled: the rule only stops waiting for it, and whatever the check does afterwards
 * is not rolled back.
 *
 * <p>Inside a pipeline the check also runs under the pipeline timeout, and whichever
 * deadline passes first decides the outcome. A rule timeout shorter than the pipeline's
 * yields {@code ASYNC_RULE_ERROR}; otherwise the pipeline reports
 * {@link ErrorCodes#VALIDATION_TIMEOUT}. The pipeline timer starts before the rule is
 * invoked, so with the default options, where both are 5000 ms, the pipeline wins.
 *
 * @param <T> type of value the rule inspects
 */
public abstract class AsyncRule<T> extends BaseRule<T> {

    private static final Logger logger = Logger.getLogger(AsyncRule.class.getName());

    private static final List<String> SUGGESTIONS =
            List.of("Check network connectivity", "Verify external service availability");

    private final long timeoutMillis;

    protected AsyncRule(String name, String description, RuleOptions options) {
        super(name, description, options);
        this.timeoutMillis = (options != null ? options : RuleOptions.defaults()).timeoutMillis();
    }

    protected AsyncRule(String name, String description) {
        this(name, description, RuleOptions.defaults());
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public final CompletableFuture<RuleResult> execute(Object value, ValidationContext context) {
        long start = System.nanoTime();
        CompletableFuture<RuleResult> body;
        try {
            body = validateAsync(cast(value), context);
            if (body == null) {
                body = CompletableFuture.failedFuture(new IllegalStateException("rule returned no future"));
            }
        } catch (RuntimeException e) {
            body = CompletableFuture.failedFuture(e);
        }

        // orTimeout completes its receiver, so it runs on a copy of the check's future
        return body.copy()
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error == null && result != null) {
                        return result.withDuration(elapsedMillis(start));
                    }
                    Throwable cause = error != null
                            ? unwrap(error)
                            : new IllegalStateException("rule completed without a result");
                    return timeoutOrFailure(cause, context).withDuration(elapsedMillis(start));
                });
    }

    private RuleResult timeoutOrFailure(Throwable cause, ValidationContext context) {
        String message;
        if (cause instanceof TimeoutException) {
            message = String.format("Async rule '%s' timed out after %dms", name(), timeoutMillis);
            logger.fine(message);
        } else {
            message = String.format("Async rule '%s' failed: %s", name(), RuleExecutionException.describe(cause));
            logger.log(Level.FINE, message, cause);
        }
        RuleResult failure = executionFailure(ErrorCodes.ASYNC_RULE_ERROR, message, context, SUGGESTIONS, cause);
        return failure.withMetadata(Map.of("timeoutMs", timeoutMillis));
    }

    protected abstract CompletableFuture<RuleResult> validateAsync(T value, ValidationContext context);
}
