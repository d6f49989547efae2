/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.engine;

import com.assay.validation.api.Rule;
import com.assay.validation.api.ValidationListener;
import com.assay.validation.api.Validator;
import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.exceptions.ValidationTimeoutException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.api.model.ValidatorConfig;
import com.assay.validation.cache.CacheKey;
import com.assay.validation.cache.CacheKeyFactory;
import com.assay.validation.cache.CachedResult;
import com.assay.validation.cache.ResultCache;
import com.assay.validation.config.ValidationPipelineConfig;
import com.assay.validation.graph.DependencyGraph;
import com.google.common.base.Ticker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the validators and rules of a single validation call.
 *
 * <p><b>Execution model:</b>
 * <ol>
 *   <li>Validators are filtered by {@code canValidate}, rules by {@code appliesTo}.
 *       A throwing predicate becomes a failed outcome instead of aborting the call.</li>
 *   <li>Validators run first, level by level as resolved by the validator dependency
 *       graph; rules follow, level by level, once every validator has finished.</li>
 *   <li>Every item acquires a permit from the shared {@link AsyncPermits} before it
 *       starts, which bounds concurrency across a level (and across a batch).</li>
 *   <li>Cacheable items consult the result cache first; only bodies that completed
 *       normally are stored.</li>
 *   <li>Exceptions, null results and timeouts are converted into failed results. This
 *       includes exceptions raised while building an item's cache key.</li>
 * </ol>
 *
 * <p>With {@code continueOnError == false} no further item starts once an outcome at
 * {@link Severity#ERROR} or above has been recorded; items already in flight finish and
 * the partial aggregate is returned.
 *
 * <p>Thread-safe. One engine serves all calls of a pipeline.
 */
public final class ExecutionEngine {

    private static final Logger logger = Logger.getLogger(ExecutionEngine.class.getName());

    private final ValidationPipelineConfig config;
    private final ResultCache<CachedResult> cache;
    private final CacheKeyFactory cacheKeys;
    private final DependencyGraph validatorGraph;
    private final DependencyGraph ruleGraph;
    private final ScheduledExecutorService scheduler;
    private final Ticker ticker;
    private final ValidationListener listener;

    public ExecutionEngine(ValidationPipelineConfig config,
                           ResultCache<CachedResult> cache,
                           CacheKeyFactory cacheKeys,
                           DependencyGraph validatorGraph,
                           DependencyGraph ruleGraph,
                           ScheduledExecutorService scheduler,
                           Ticker ticker,
                           ValidationListener listener) {
        this.config = config;
        this.cache = cache;
        this.cacheKeys = cacheKeys;
        this.validatorGraph = validatorGraph;
        this.ruleGraph = ruleGraph;
        this.scheduler = scheduler;
        this.ticker = ticker;
        this.listener = listener;
    }

    /**
     * Validates {@code value}.
     *
     * @param candidates validators to consider, in registration order
     * @param explicit   true if the caller named the validators, in which case disabled
     *                   validators are not filtered out
     * @param rules      registered rules, in registration order
     * @param permits    concurrency budget shared by every item of this call
     */
    public CompletableFuture<ValidationResult> run(Object value,
                                                   Collection<Validator> candidates,
                                                   boolean explicit,
                                                   Collection<Rule> rules,
                                                   AsyncPermits permits) {
        Execution execution = new Execution(value, permits);

        List<Validator> validators = execution.selectValidators(candidates, explicit);
        List<Rule> applicableRules = execution.selectRules(rules);

        listener.onValidationStarted(value, validators.stream().map(Validator::name).toList());

        if (validators.isEmpty() && applicableRules.isEmpty()
                && execution.predicateErrors.isEmpty() && isBlank(value)) {
            logger.fine("No validators or rules apply to blank input");
            return CompletableFuture.completedFuture(noValidatorsApplicable(value, execution));
        }

        return execution.runValidators(validators)
                .thenCompose(ignored -> execution.runRules(applicableRules))
                .thenApply(ignored -> execution.combine(validators, applicableRules));
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isEmpty());
    }

    private ValidationResult noValidatorsApplicable(Object value, Execution execution) {
        String description = value == null ? "null" : "empty string";
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("value", value);
        ValidationError error = ValidationError.builder(ErrorCodes.NO_VALIDATORS_APPLICABLE,
                        "Invalid input: " + description)
                .severity(Severity.ERROR)
                .suggestion("Provide a valid input value")
                .context(context)
                .build();
        return ValidationResult.failure(List.of(error),
                execution.context.metrics().toMetrics(execution.elapsedMillis()));
    }

    /**
     * Per-call state.
     */
    private final class Execution {
        private final Object value;
        private final AsyncPermits permits;
        private final ValidationContext context;
        private final long startNanos;
        private final AtomicBoolean halted = new AtomicBoolean();
        private final List<ValidationError> predicateErrors = new ArrayList<>();
        private final Map<String, ValidationResult> validatorResults = new ConcurrentHashMap<>();
        private final Map<String, RuleResult> ruleResults = new ConcurrentHashMap<>();

        Execution(Object value, AsyncPermits permits) {
            this.value = value;
            this.permits = permits;
            this.context = ValidationContext.root(value);
            this.startNanos = ticker.read();
        }

        long elapsedMillis() {
            return TimeUnit.NANOSECONDS.toMillis(ticker.read() - startNanos);
        }

        // ====================================================================
        // SELECTION
        // ====================================================================

        List<Validator> selectValidators(Collection<Validator> candidates, boolean explicit) {
            List<Validator> selected = new ArrayList<>();
            for (Validator validator : candidates) {
                try {
                    if (!explicit && !validator.config().enabled()) {
                        continue;
                    }
                    if (validator.canValidate(value)) {
                        selected.add(validator);
                    }
                } catch (RuntimeException e) {
                    logger.log(Level.FINE, "Selection failed for validator " + validator.name(), e);
                    recordPredicateFailure(validatorFailure(validator.name(), e));
                }
            }
            return selected;
        }

        List<Rule> selectRules(Collection<Rule> rules) {
            List<Rule> selected = new ArrayList<>();
            for (Rule rule : rules) {
                try {
                    if (rule.appliesTo(value)) {
                        selected.add(rule);
                    }
                } catch (RuntimeException e) {
                    logger.log(Level.FINE, "appliesTo failed for rule " + rule.name(), e);
                    recordPredicateFailure(ruleFailure(rule.name(), e));
                }
            }
            return selected;
        }

        private void recordPredicateFailure(ValidationError error) {
            predicateErrors.add(error);
            if (!config.isContinueOnError()) {
                halted.set(true);
            }
        }

        // ====================================================================
        // SCHEDULING
        // ====================================================================

        CompletableFuture<Void> runValidators(List<Validator> validators) {
            Map<String, Validator> byName = new LinkedHashMap<>();
            validators.forEach(v -> byName.put(v.name(), v));
            return runLevels(levels(validatorGraph, byName.keySet()),
                    name -> executeValidator(byName.get(name)));
        }

        CompletableFuture<Void> runRules(List<Rule> rules) {
            Map<String, Rule> byName = new LinkedHashMap<>();
            rules.forEach(r -> byName.put(r.name(), r));
            return runLevels(levels(ruleGraph, byName.keySet()),
                    name -> executeRule(byName.get(name)));
        }

        private CompletableFuture<Void> runLevels(List<List<String>> levels,
                                                  Function<String, CompletableFuture<Boolean>> item) {
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (List<String> level : levels) {
                chain = chain.thenCompose(ignored -> runLevel(level, item));
            }
            return chain;
        }

        private CompletableFuture<Void> runLevel(List<String> level,
                                                 Function<String, CompletableFuture<Boolean>> item) {
            List<CompletableFuture<?>> running = new ArrayList<>(level.size());
            for (String name : level) {
                running.add(permits.acquire()
                        .thenCompose(ignored -> {
                            if (halted.get()) {
                                return CompletableFuture.completedFuture(false);
                            }
                            return item.apply(name);
                        })
                        .whenComplete((failed, error) -> {
                            if (error == null && failed && !config.isContinueOnError()) {
                                halted.set(true);
                            }
                            permits.release();
                        }));
            }
            return CompletableFuture.allOf(running.toArray(new CompletableFuture[0]));
        }

        // ====================================================================
        // VALIDATORS
        // ====================================================================

        /**
         * Runs one validator. The returned future completes with {@code true} when the
         * outcome is a failure.
         */
        private CompletableFuture<Boolean> executeValidator(Validator validator) {
            ValidatorConfig validatorConfig;
            CacheKey key;
            try {
                validatorConfig = validator.config();
                boolean cacheable = config.isCachingEnabled() && validatorConfig.cacheable();
                key = cacheable ? cacheKeys.forValidator(validator, value) : null;
            } catch (RuntimeException e) {
                logger.log(Level.FINE, "Cache key creation failed for validator " + validator.name(), e);
                return CompletableFuture.completedFuture(recordValidator(validator.name(),
                        failedValidation(validatorFailure(validator.name(), e)), false));
            }

            if (key != null) {
                Optional<ValidationResult> cached = cache.get(key)
                        .flatMap(entry -> entry.value().validationResult());
                if (cached.isPresent()) {
                    context.metrics().recordCacheHit();
                    listener.onCacheHit(key.asString());
                    return CompletableFuture.completedFuture(
                            recordValidator(validator.name(), cached.get().withFromCache(true), true));
                }
                context.metrics().recordCacheMiss();
                listener.onCacheMiss(key.asString());
            }

            long timeout = validatorConfig.hasTimeout() ? validatorConfig.timeoutMillis() : config.getTimeoutMillis();
            ValidationContext validatorContext = context.withConfig(validatorConfig.options());

            return Timeouts.within(() -> validator.validate(value, validatorContext), timeout, scheduler,
                            "Validator '" + validator.name() + "'")
                    .handle((result, error) -> {
                        ValidationResult outcome;
                        if (error != null) {
                            outcome = failedValidation(validatorFailure(validator.name(), unwrap(error)));
                        } else if (result == null) {
                            outcome = failedValidation(validatorFailure(validator.name(),
                                    new IllegalStateException("validator returned null")));
                        } else {
                            outcome = result.withFromCache(false);
                            if (key != null) {
                                cache.put(key, CachedResult.of(outcome));
                            }
                        }
                        return recordValidator(validator.name(), outcome, false);
                    });
        }

        private boolean recordValidator(String name, ValidationResult result, boolean fromCache) {
            validatorResults.put(name, result);
            context.metrics().recordValidatorUsed(fromCache);
            logger.fine(String.format("Validator %s: valid=%s, fromCache=%s", name, result.valid(), fromCache));
            listener.onValidatorExecuted(name, result);
            return result.hasFailures();
        }

        private ValidationResult failedValidation(ValidationError error) {
            return ValidationResult.failure(List.of(error), context.metrics().toMetrics(0));
        }

        private ValidationError validatorFailure(String validator, Throwable error) {
            if (error instanceof ValidationTimeoutException timeout) {
                return timeoutError("validator", validator, timeout);
            }
            String description = RuleExecutionException.describe(error);
            return ValidationError.builder(ErrorCodes.VALIDATOR_EXECUTION_ERROR,
                            String.format("Validator '%s' failed: %s", validator, description))
                    .path(context.path())
                    .severity(Severity.ERROR)
                    .suggestion("Check validator configuration")
                    .suggestion("Verify input data format")
                    .context("validator", validator)
                    .context("error", description)
                    .build();
        }

        // ====================================================================
        // RULES
        // ====================================================================

        private CompletableFuture<Boolean> executeRule(Rule rule) {
            CacheKey key;
            try {
                boolean cacheable = config.isCachingEnabled() && rule.cacheable();
                key = cacheable ? cacheKeys.forRule(rule, value) : null;
            } catch (RuntimeException e) {
                logger.log(Level.FINE, "Cache key creation failed for rule " + rule.name(), e);
                return CompletableFuture.completedFuture(
                        recordRule(rule.name(), RuleResult.failure(ruleFailure(rule.name(), e)), false));
            }

            if (key != null) {
                Optional<RuleResult> cached = cache.get(key).flatMap(entry -> entry.value().ruleResult());
                if (cached.isPresent()) {
                    context.metrics().recordCacheHit();
                    listener.onCacheHit(key.asString());
                    return CompletableFuture.completedFuture(
                            recordRule(rule.name(), cached.get().withCached(true), true));
                }
                context.metrics().recordCacheMiss();
                listener.onCacheMiss(key.asString());
            }

            long ruleStart = ticker.read();
            return Timeouts.within(() -> rule.execute(value, context), config.getTimeoutMillis(), scheduler,
                            "Rule '" + rule.name() + "'")
                    .handle((result, error) -> {
                        long duration = TimeUnit.NANOSECONDS.toMillis(ticker.read() - ruleStart);
                        RuleResult outcome;
                        if (error != null) {
                            outcome = RuleResult.failure(ruleFailure(rule.name(), unwrap(error)));
                        } else if (result == null) {
                            outcome = RuleResult.failure(ruleFailure(rule.name(),
                                    new IllegalStateException("rule returned null")));
                        } else {
                            outcome = result.withCached(false);
                            if (key != null) {
                                cache.put(key, CachedResult.of(outcome.withDuration(duration)));
                            }
                        }
                        return recordRule(rule.name(), outcome.withDuration(duration), false);
                    });
        }

        private boolean recordRule(String name, RuleResult result, boolean fromCache) {
            ruleResults.put(name, result);
            context.metrics().recordRuleExecuted(fromCache);
            logger.fine(String.format("Rule %s: passed=%s, fromCache=%s", name, result.passed(), fromCache));
            listener.onRuleExecuted(name, result);
            return result.isFailure();
        }

        private ValidationError ruleFailure(String rule, Throwable error) {
            if (error instanceof ValidationTimeoutException timeout) {
                return timeoutError("rule", rule, timeout);
            }
            String description = RuleExecutionException.describe(error);
            return ValidationError.builder(ErrorCodes.RULE_EXECUTION_ERROR,
                            String.format("Rule '%s' failed: %s", rule, description))
                    .path(context.path())
                    .severity(Severity.ERROR)
                    .suggestion("Check rule configuration")
                    .suggestion("Verify input data")
                    .context("rule", rule)
                    .context("error", description)
                    .build();
        }

        private ValidationError timeoutError(String kind, String name, ValidationTimeoutException timeout) {
            return ValidationError.builder(ErrorCodes.VALIDATION_TIMEOUT, timeout.getMessage())
                    .path(context.path())
                    .severity(Severity.ERROR)
                    .suggestion("Increase the " + kind + " timeout")
                    .suggestion("Check for slow external dependencies")
                    .context(kind, name)
                    .context("timeoutMs", timeout.getTimeoutMillis())
                    .build();
        }

        // ====================================================================
        // AGGREGATION
        // ====================================================================

        ValidationResult combine(List<Validator> validators, List<Rule> rules) {
            List<ValidationError> errors = new ArrayList<>(predicateErrors);
            List<ValidationError> warnings = new ArrayList<>();

            for (Validator validator : validators) {
                ValidationResult result = validatorResults.get(validator.name());
                if (result != null) {
                    errors.addAll(result.errors());
                    warnings.addAll(result.warnings());
                }
            }
            for (Rule rule : rules) {
                RuleResult result = ruleResults.get(rule.name());
                if (result == null || result.passed() || result.error() == null) {
                    continue;
                }
                if (result.error().severity().isAtLeast(Severity.ERROR)) {
                    errors.add(result.error());
                } else {
                    warnings.add(result.error());
                }
            }

            ValidationResult combined = ValidationResult.of(errors, warnings,
                    context.metrics().toMetrics(elapsedMillis()));
            return combined.withFromCache(context.metrics().allFromCache());
        }
    }

    /**
     * Orders {@code names} by dependency level. Names the graph does not know run in
     * the first level.
     */
    private static List<List<String>> levels(DependencyGraph graph, Set<String> names) {
        List<List<String>> levels = new ArrayList<>(graph.levels(names));
        Set<String> unknown = new LinkedHashSet<>(names);
        levels.forEach(unknown::removeAll);
        if (!unknown.isEmpty()) {
            List<String> first = new ArrayList<>(levels.isEmpty() ? List.of() : levels.get(0));
            first.addAll(unknown);
            if (levels.isEmpty()) {
                levels.add(first);
            } else {
                levels.set(0, first);
            }
        }
        return levels;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
