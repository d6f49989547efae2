/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.Rule;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationContext;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Factory methods for the built-in rule types.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Rule mass = Rules.range("mass", 0, 100);
 * Rule formula = Rules.pattern("formula", "^[A-Z][a-z]?\\d*$", "formula");
 * Rule both = Rules.and("massAndFormula", "mass and formula", List.of(mass, formula));
 * }</pre>
 */
public final class Rules {

    private Rules() {
        throw new AssertionError("No instances");
    }

    public static RangeRule range(String name, double min, double max) {
        return new RangeRule(name, min, max);
    }

    public static RangeRule range(String name, double min, double max, boolean inclusive, RuleOptions options) {
        return new RangeRule(name, min, max, inclusive, options);
    }

    public static PatternRule pattern(String name, String regex, String label) {
        return new PatternRule(name, Pattern.compile(regex), label);
    }

    public static PatternRule pattern(String name, Pattern pattern, String label, RuleOptions options) {
        return new PatternRule(name, pattern, label, options);
    }

    public static CompositeRule and(String name, String description, List<Rule> rules) {
        return new CompositeRule(name, description, rules, CompositeRule.Operator.AND);
    }

    public static CompositeRule and(String name, String description, List<Rule> rules, RuleOptions options) {
        return new CompositeRule(name, description, rules, CompositeRule.Operator.AND, options);
    }

    public static CompositeRule or(String name, String description, List<Rule> rules) {
        return new CompositeRule(name, description, rules, CompositeRule.Operator.OR);
    }

    public static CompositeRule or(String name, String description, List<Rule> rules, RuleOptions options) {
        return new CompositeRule(name, description, rules, CompositeRule.Operator.OR, options);
    }

    public static <T> ConditionalRule<T> conditional(String name,
                                                     String description,
                                                     BiPredicate<T, ValidationContext> condition,
                                                     Rule rule) {
        return new ConditionalRule<>(name, description, condition, rule);
    }

    public static <T> ConditionalRule<T> conditional(String name,
                                                     String description,
                                                     BiPredicate<T, ValidationContext> condition,
                                                     Rule rule,
                                                     RuleOptions options) {
        return new ConditionalRule<>(name, description, condition, rule, options);
    }

    /**
     * Wraps a synchronous check that applies to every value.
     */
    public static <T> SyncRule<T> sync(String name,
                                       String description,
                                       BiFunction<T, ValidationContext, RuleResult> check) {
        return sync(name, description, value -> true, check, RuleOptions.defaults());
    }

    public static <T> SyncRule<T> sync(String name,
                                       String description,
                                       Predicate<Object> appliesTo,
                                       BiFunction<T, ValidationContext, RuleResult> check,
                                       RuleOptions options) {
        Objects.requireNonNull(check, "check must not be null");
        return new SyncRule<>(name, description, options) {
            @Override
            public boolean appliesTo(Object value) {
                return appliesTo.test(value);
            }

            @Override
            protected RuleResult validateSync(T value, ValidationContext context) {
                return check.apply(value, context);
            }
        };
    }

    /**
     * Wraps an asynchronous check that applies to every value, with the default timeout.
     */
    public static <T> AsyncRule<T> async(String name,
                                         String description,
                                         BiFunction<T, ValidationContext, CompletableFuture<RuleResult>> check) {
        return async(name, description, value -> true, check, RuleOptions.defaults());
    }

    public static <T> AsyncRule<T> async(String name,
                                         String description,
                                         Predicate<Object> appliesTo,
                                         BiFunction<T, ValidationContext, CompletableFuture<RuleResult>> check,
                                         RuleOptions options) {
        Objects.requireNonNull(check, "check must not be null");
        return new AsyncRule<>(name, description, options) {
            @Override
            public boolean appliesTo(Object value) {
                return appliesTo.test(value);
            }

            @Override
            protected CompletableFuture<RuleResult> validateAsync(T value, ValidationContext context) {
                return check.apply(value, context);
            }
        };
    }
}
