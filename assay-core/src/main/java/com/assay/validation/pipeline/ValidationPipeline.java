/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.pipeline;

import com.assay.validation.api.Rule;
import com.assay.validation.api.ValidationListener;
import com.assay.validation.api.Validator;
import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.exceptions.RuleExecutionException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationMetrics;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.cache.CacheFactory;
import com.assay.validation.cache.CacheKeyFactory;
import com.assay.validation.cache.CachedResult;
import com.assay.validation.cache.ResultCache;
import com.assay.validation.config.ValidationPipelineConfig;
import com.assay.validation.engine.AsyncPermits;
import com.assay.validation.engine.ExecutionEngine;
import com.assay.validation.graph.DependencyGraph;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for validating values against registered validators and rules.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Register validators and rules. Registration is where configuration problems
 *       surface: duplicate names, missing validator dependencies and dependency cycles
 *       throw {@link ConfigurationException}.</li>
 *   <li>Call {@link #validate} or {@link #validateBatch}. Validation never throws for
 *       bad data; every failure, including unexpected internal ones, is reported in the
 *       returned {@link ValidationResult}.</li>
 *   <li>{@link #close()} the pipeline to stop its timer thread.</li>
 * </ol>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * try (ValidationPipeline pipeline = new ValidationPipeline(ValidationPipelineConfig.defaults())) {
 *     pipeline.addRule(Rules.pattern("formulaFormat", "^[A-Z][a-z]?(\\d*[A-Z][a-z]?\\d*)*$", "chemical formula"));
 *     pipeline.addRule(Rules.range("temperature", -273.15, 10_000));
 *     ValidationResult result = pipeline.validate("H2O").join();
 * }
 * }</pre>
 *
 * <p>Thread-safe. Registration may happen concurrently with validation; a call in
 * progress works on the registrations it saw when it started.
 */
public class ValidationPipeline implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ValidationPipeline.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.assay.validation";

    private final ValidationPipelineConfig config;
    private final Tracer tracer;
    private final Map<String, Validator> validators = new LinkedHashMap<>();
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final DependencyGraph validatorGraph = DependencyGraph.forValidators();
    private final DependencyGraph ruleGraph = DependencyGraph.forRules();
    private final ResultCache<CachedResult> cache;
    private final ListenerRegistry listeners = new ListenerRegistry();
    private final PerformanceMonitor performanceMonitor;
    private final ScheduledExecutorService scheduler;
    private final ExecutionEngine engine;

    public ValidationPipeline() {
        this(ValidationPipelineConfig.defaults());
    }

    public ValidationPipeline(ValidationPipelineConfig config) {
        this(config, OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    public ValidationPipeline(ValidationPipelineConfig config, Tracer tracer) {
        this(config, tracer, Ticker.systemTicker());
    }

    /**
     * @param ticker time source for cache expiry and durations
     */
    public ValidationPipeline(ValidationPipelineConfig config, Tracer tracer, Ticker ticker) {
        this.config = config;
        this.tracer = tracer;
        this.cache = CacheFactory.create(config, ticker);
        this.performanceMonitor = new PerformanceMonitor(config.getMonitoring(), listeners);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("assay-validation-timer-%d")
                        .setDaemon(true)
                        .build());
        this.engine = new ExecutionEngine(config, cache, new CacheKeyFactory(), validatorGraph, ruleGraph,
                scheduler, ticker, listeners);

        logger.info("Validation pipeline created: " + config);
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    /**
     * Registers a validator.
     *
     * @throws ConfigurationException with {@code DUPLICATE_VALIDATOR} if the name is taken,
     *                                or {@code MISSING_DEPENDENCY} if a dependency is not registered
     */
    public void addValidator(Validator validator) {
        synchronized (this) {
            String name = validator.name();
            if (validators.containsKey(name)) {
                throw new ConfigurationException(ErrorCodes.DUPLICATE_VALIDATOR,
                        "Validator '" + name + "' is already registered");
            }
            for (String dependency : validator.dependencies()) {
                if (!validators.containsKey(dependency)) {
                    throw new ConfigurationException(ErrorCodes.MISSING_DEPENDENCY,
                            String.format("Validator '%s' depends on unregistered validator '%s'", name, dependency));
                }
            }
            validatorGraph.add(name, validator.dependencies(), validator.config().priority());
            validators.put(name, validator);
            logger.info(String.format("Registered validator %s (dependencies=%s)", name, validator.dependencies()));
        }
        listeners.onValidatorRegistered(validator.name());
    }

    public boolean removeValidator(String name) {
        synchronized (this) {
            if (validators.remove(name) == null) {
                return false;
            }
            validatorGraph.remove(name);
            logger.info("Unregistered validator " + name);
        }
        listeners.onValidatorUnregistered(name);
        return true;
    }

    public synchronized Optional<Validator> getValidator(String name) {
        return Optional.ofNullable(validators.get(name));
    }

    public synchronized List<Validator> getValidators() {
        return List.copyOf(validators.values());
    }

    /**
     * Registers a rule. Dependencies may name rules that are registered later.
     *
     * @throws ConfigurationException with {@code DUPLICATE_RULE} if the name is taken, or
     *                                {@code CIRCULAR_DEPENDENCY} if the rule closes a cycle;
     *                                the registry is unchanged in both cases
     */
    public void addRule(Rule rule) {
        synchronized (this) {
            ruleGraph.add(rule.name(), rule.dependencies(), rule.priority());
            rules.put(rule.name(), rule);
            logger.info(String.format("Registered rule %s (dependencies=%s)", rule.name(), rule.dependencies()));
        }
        listeners.onRuleRegistered(rule.name());
    }

    public boolean removeRule(String name) {
        synchronized (this) {
            if (rules.remove(name) == null) {
                return false;
            }
            ruleGraph.remove(name);
            logger.info("Unregistered rule " + name);
        }
        listeners.onRuleUnregistered(name);
        return true;
    }

    public synchronized Optional<Rule> getRule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public synchronized List<Rule> getRules() {
        return List.copyOf(rules.values());
    }

    public void addListener(ValidationListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ValidationListener listener) {
        return listeners.remove(listener);
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Validates {@code value} with every enabled validator that can handle it, followed
     * by every applicable rule.
     */
    public CompletableFuture<ValidationResult> validate(Object value) {
        return validate(value, null);
    }

    /**
     * Validates {@code value} with the named validators, followed by every applicable rule.
     *
     * @param validatorNames validators to run; unknown names are skipped. {@code null}
     *                       selects every enabled validator.
     */
    public CompletableFuture<ValidationResult> validate(Object value, List<String> validatorNames) {
        return validate(value, validatorNames, new AsyncPermits(config.effectiveConcurrency()));
    }

    public CompletableFuture<List<ValidationResult>> validateBatch(List<?> values) {
        return validateBatch(values, null);
    }

    /**
     * Validates every value. Results keep input order. With parallel execution enabled
     * all values share one concurrency budget; otherwise values are validated one after
     * another.
     */
    public CompletableFuture<List<ValidationResult>> validateBatch(List<?> values, List<String> validatorNames) {
        List<CompletableFuture<ValidationResult>> futures = new ArrayList<>(values.size());

        if (config.getParallel().enabled()) {
            AsyncPermits permits = new AsyncPermits(config.effectiveConcurrency());
            for (Object value : values) {
                futures.add(validate(value, validatorNames, permits));
            }
        } else {
            CompletableFuture<ValidationResult> previous = CompletableFuture.completedFuture(null);
            for (Object value : values) {
                previous = previous.thenCompose(ignored -> validate(value, validatorNames));
                futures.add(previous);
            }
        }

        logger.fine(String.format("Validating batch of %d values", values.size()));
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    private CompletableFuture<ValidationResult> validate(Object value,
                                                         List<String> validatorNames,
                                                         AsyncPermits permits) {
        Span span = tracer.spanBuilder("validate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<Validator> candidates;
            List<Rule> ruleSnapshot;
            synchronized (this) {
                candidates = selectCandidates(validatorNames);
                ruleSnapshot = List.copyOf(rules.values());
            }
            span.setAttribute("validators", candidates.size());
            span.setAttribute("rules", ruleSnapshot.size());

            return engine.run(value, candidates, validatorNames != null, ruleSnapshot, permits)
                    .handle((result, error) -> complete(span, result, error));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(complete(span, null, e));
        }
    }

    private List<Validator> selectCandidates(List<String> validatorNames) {
        if (validatorNames == null) {
            return List.copyOf(validators.values());
        }
        List<Validator> selected = new ArrayList<>(validatorNames.size());
        for (String name : validatorNames) {
            Validator validator = validators.get(name);
            if (validator != null) {
                selected.add(validator);
            } else {
                logger.fine("Skipping unknown validator " + name);
            }
        }
        return selected;
    }

    private ValidationResult complete(Span span, ValidationResult result, Throwable error) {
        try {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                logger.log(Level.SEVERE, "Validation pipeline failed", cause);
                span.recordException(cause);
                listeners.onValidationError(cause);
                result = pipelineFailure(cause);
            } else {
                listeners.onValidationCompleted(result);
                performanceMonitor.record(result);
            }
            span.setAttribute("valid", result.valid());
            span.setAttribute("errors", result.errors().size());
            span.setAttribute("fromCache", result.fromCache());
            return result;
        } finally {
            span.end();
        }
    }

    private static ValidationResult pipelineFailure(Throwable cause) {
        String description = RuleExecutionException.describe(cause);
        ValidationError error = ValidationError.builder(ErrorCodes.VALIDATION_PIPELINE_ERROR,
                        "Validation pipeline failed: " + description)
                .severity(Severity.CRITICAL)
                .suggestion("Check validator and rule implementations")
                .context("error", description)
                .build();
        return ValidationResult.failure(List.of(error), ValidationMetrics.empty());
    }

    // ========================================================================
    // MANAGEMENT
    // ========================================================================

    public PipelineStats getStats() {
        int validatorCount;
        int ruleCount;
        synchronized (this) {
            validatorCount = validators.size();
            ruleCount = rules.size();
        }
        return new PipelineStats(validatorCount, ruleCount, cache.size(),
                cache.getMetrics().hitRate(), performanceMonitor.averageDurationMillis());
    }

    public void clearCache() {
        cache.clear();
        logger.info("Validation cache cleared");
    }

    public ValidationPipelineConfig getConfig() {
        return config;
    }

    /**
     * Stops the timeout timer. Calls still in flight keep running but can no longer
     * time out; validating after close reports {@code VALIDATION_PIPELINE_ERROR}.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
        logger.info("Validation pipeline closed");
    }
}
