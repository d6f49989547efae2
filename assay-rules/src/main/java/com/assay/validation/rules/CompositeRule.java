/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.Rule;
import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Combines child rules with a logical operator.
 *
 * <p>Applicable children run one after another in declaration order.
 * <ul>
 *   <li>{@link Operator#AND} passes iff every executed child passes and surfaces the
 *       first failure's error.</li>
 *   <li>{@link Operator#OR} passes iff any executed child passes; otherwise fails with
 *       {@link ErrorCodes#COMPOSITE_RULE_FAILURE} carrying the number of failures.</li>
 * </ul>
 * A child whose {@code appliesTo} throws is treated as not applicable.
 */
public class CompositeRule extends BaseRule<Object> {

    private static final Logger logger = Logger.getLogger(CompositeRule.class.getName());

    public enum Operator {
        AND,
        OR
    }

    private final List<Rule> rules;
    private final Operator operator;

    public CompositeRule(String name, String description, List<Rule> rules, Operator operator, RuleOptions options) {
        super(name, description, options);
        this.rules = List.copyOf(rules);
        this.operator = operator != null ? operator : Operator.AND;
    }

    public CompositeRule(String name, String description, List<Rule> rules, Operator operator) {
        this(name, description, rules, operator, RuleOptions.defaults());
    }

    public List<Rule> rules() {
        return rules;
    }

    public Operator operator() {
        return operator;
    }

    @Override
    public boolean appliesTo(Object value) {
        return rules.stream().anyMatch(rule -> applies(rule, value));
    }

    @Override
    public CompletableFuture<RuleResult> execute(Object value, ValidationContext context) {
        long start = System.nanoTime();
        CompletableFuture<List<RuleResult>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (Rule rule : rules) {
            chain = chain.thenCompose(results -> {
                if (!applies(rule, value)) {
                    return CompletableFuture.completedFuture(results);
                }
                return rule.execute(value, context).thenApply(result -> {
                    if (result == null) {
                        throw new IllegalStateException("rule '" + rule.name() + "' returned no result");
                    }
                    results.add(result);
                    return results;
                });
            });
        }

        return chain
                .thenApply(results -> combine(results, context, elapsedMillis(start)))
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    logger.log(Level.FINE, String.format("Composite rule '%s' failed", name()), cause);
                    return executionFailure(
                            ErrorCodes.COMPOSITE_RULE_ERROR,
                            "Composite rule execution failed: " + RuleExecutionException.describe(cause),
                            context,
                            List.of("Check individual rules", "Verify rule composition"),
                            cause).withDuration(elapsedMillis(start));
                });
    }

    private RuleResult combine(List<RuleResult> results, ValidationContext context, long durationMillis) {
        List<ValidationError> errors = new ArrayList<>();
        long totalDuration = 0;
        for (RuleResult result : results) {
            totalDuration += result.durationMillis();
            if (!result.passed() && result.error() != null) {
                errors.add(result.error());
            }
        }

        boolean passed = operator == Operator.AND
                ? results.stream().allMatch(RuleResult::passed)
                : results.stream().anyMatch(RuleResult::passed);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("operator", operator.name());
        metadata.put("rulesExecuted", results.size());
        metadata.put("totalDuration", totalDuration);

        if (passed) {
            return RuleResult.success(metadata).withDuration(durationMillis);
        }

        metadata.put("allErrors", List.copyOf(errors));
        ValidationError error = operator == Operator.AND && !errors.isEmpty()
                ? errors.get(0)
                : ValidationError.builder(ErrorCodes.COMPOSITE_RULE_FAILURE,
                                String.format("All rules in %s composite failed", operator))
                        .path(context.path())
                        .severity(Severity.ERROR)
                        .suggestion("Check individual rule failures")
                        .context("operator", operator.name())
                        .context("errors", errors.size())
                        .build();
        return RuleResult.failure(error, metadata).withDuration(durationMillis);
    }

    static boolean applies(Rule rule, Object value) {
        try {
            return rule.appliesTo(value);
        } catch (RuntimeException e) {
            logger.log(Level.FINE, String.format("appliesTo of rule '%s' threw, treating as not applicable",
                    rule.name()), e);
            return false;
        }
    }
}
