/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.engine;

import com.assay.validation.api.exceptions.ValidationTimeoutException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Races an asynchronous operation against a timer.
 *
 * <p>The timer starts before the operation is invoked, so a body that blocks its caller
 * still counts against the deadline. When the timer wins, the returned future fails
 * with {@link ValidationTimeoutException}; the operation itself is not cancelled and
 * its late completion is ignored.
 */
public final class Timeouts {

    private Timeouts() {
        throw new AssertionError("Timeouts should not be instantiated");
    }

    public static <T> CompletableFuture<T> within(Supplier<CompletableFuture<T>> operation,
                                                  long timeoutMillis,
                                                  ScheduledExecutorService scheduler,
                                                  String description) {
        CompletableFuture<T> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> result.completeExceptionally(new ValidationTimeoutException(description, timeoutMillis)),
                timeoutMillis, TimeUnit.MILLISECONDS);

        CompletableFuture<T> body;
        try {
            body = operation.get();
        } catch (RuntimeException e) {
            body = CompletableFuture.failedFuture(e);
        }
        if (body == null) {
            body = CompletableFuture.failedFuture(
                    new IllegalStateException(description + " returned no result"));
        }

        body.whenComplete((value, error) -> {
            timer.cancel(false);
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        return result;
    }
}
