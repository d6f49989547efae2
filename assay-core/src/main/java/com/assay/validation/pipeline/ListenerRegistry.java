/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.pipeline;

import com.assay.validation.api.ValidationListener;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans pipeline events out to registered listeners.
 *
 * <p>A listener that throws is logged and skipped; the remaining listeners still
 * receive the event and the validation call is unaffected.
 */
final class ListenerRegistry implements ValidationListener {

    private static final Logger logger = Logger.getLogger(ListenerRegistry.class.getName());

    private final List<ValidationListener> listeners = new CopyOnWriteArrayList<>();

    void add(ValidationListener listener) {
        listeners.add(listener);
    }

    boolean remove(ValidationListener listener) {
        return listeners.remove(listener);
    }

    int size() {
        return listeners.size();
    }

    private void publish(String event, Consumer<ValidationListener> action) {
        for (ValidationListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, String.format("Listener %s failed handling %s",
                        listener.getClass().getName(), event), e);
            }
        }
    }

    @Override
    public void onValidationStarted(Object target, List<String> validators) {
        publish("validation:started", l -> l.onValidationStarted(target, validators));
    }

    @Override
    public void onValidationCompleted(ValidationResult result) {
        publish("validation:completed", l -> l.onValidationCompleted(result));
    }

    @Override
    public void onValidationError(Throwable error) {
        publish("validation:error", l -> l.onValidationError(error));
    }

    @Override
    public void onValidatorExecuted(String validator, ValidationResult result) {
        publish("validator:executed", l -> l.onValidatorExecuted(validator, result));
    }

    @Override
    public void onRuleExecuted(String rule, RuleResult result) {
        publish("rule:executed", l -> l.onRuleExecuted(rule, result));
    }

    @Override
    public void onCacheHit(String key) {
        publish("cache:hit", l -> l.onCacheHit(key));
    }

    @Override
    public void onCacheMiss(String key) {
        publish("cache:miss", l -> l.onCacheMiss(key));
    }

    @Override
    public void onPerformanceThreshold(String metric, double value, double threshold) {
        publish("performance:threshold", l -> l.onPerformanceThreshold(metric, value, threshold));
    }

    @Override
    public void onValidatorRegistered(String validator) {
        publish("validator:registered", l -> l.onValidatorRegistered(validator));
    }

    @Override
    public void onValidatorUnregistered(String validator) {
        publish("validator:unregistered", l -> l.onValidatorUnregistered(validator));
    }

    @Override
    public void onRuleRegistered(String rule) {
        publish("rule:registered", l -> l.onRuleRegistered(rule));
    }

    @Override
    public void onRuleUnregistered(String rule) {
        publish("rule:unregistered", l -> l.onRuleUnregistered(rule));
    }
}
