/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.Rule;
import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;

/**
 * Runs an inner rule only when a condition holds.
 *
 * <p>When the condition is false the rule passes with {@code skipped=true} and
 * {@code conditionMet=false} in its metadata and the inner rule is never invoked.
 * This is how a rule is gated on another rule having passed: the condition reads
 * whatever the earlier rule left in {@link ValidationContext#shared()}.
 *
 * @param <T> type of value the condition inspects
 */
public class ConditionalRule<T> extends BaseRule<T> {

    private final BiPredicate<T, ValidationContext> condition;
    private final Rule rule;

    public ConditionalRule(String name,
                           String description,
                           BiPredicate<T, ValidationContext> condition,
                           Rule rule,
                           RuleOptions options) {
        super(name, description, options);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
    }

    public ConditionalRule(String name, String description, BiPredicate<T, ValidationContext> condition, Rule rule) {
        this(name, description, condition, rule, RuleOptions.defaults());
    }

    public Rule inner() {
        return rule;
    }

    @Override
    public boolean appliesTo(Object value) {
        return CompositeRule.applies(rule, value);
    }

    @Override
    public CompletableFuture<RuleResult> execute(Object value, ValidationContext context) {
        long start = System.nanoTime();
        try {
            if (!condition.test(cast(value), context)) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("conditionMet", false);
                metadata.put("skipped", true);
                return CompletableFuture.completedFuture(success(metadata).withDuration(elapsedMillis(start)));
            }
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("conditionMet", true);
            extra.put("parentRule", name());
            return rule.execute(value, context)
                    .thenApply(result -> result.withMetadata(extra))
                    .exceptionally(error -> conditionalFailure(error, context));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(conditionalFailure(e, context));
        }
    }

    private RuleResult conditionalFailure(Throwable error, ValidationContext context) {
        Throwable cause = unwrap(error);
        return executionFailure(
                ErrorCodes.CONDITIONAL_RULE_ERROR,
                "Conditional rule execution failed: " + RuleExecutionException.describe(cause),
                context,
                List.of("Check condition logic", "Verify rule implementation"),
                cause);
    }
}
