/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counting semaphore for asynchronous work.
 *
 * <p>{@link #acquire()} never blocks: it returns a future that completes once a permit
 * is granted. Waiters are served in FIFO order, so with a single permit work runs
 * strictly in the order it was submitted.
 *
 * <p>Granting a permit completes the waiter's future, which may run its continuation
 * and release again on the same thread. Hand-offs triggered while a thread is already
 * handing off are queued and drained iteratively, so stack depth stays constant however
 * many waiters are chained.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AsyncPermits permits = new AsyncPermits(4);
 * permits.acquire()
 *     .thenCompose(ignored -> runItem())
 *     .whenComplete((r, e) -> permits.release());
 * }</pre>
 */
public final class AsyncPermits {

    private static final ThreadLocal<Deque<CompletableFuture<Void>>> HANDOFFS = new ThreadLocal<>();

    private final int maxPermits;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    public AsyncPermits(int maxPermits) {
        if (maxPermits < 1) {
            throw new IllegalArgumentException("maxPermits must be at least 1: " + maxPermits);
        }
        this.maxPermits = maxPermits;
        this.available = maxPermits;
    }

    /**
     * Requests a permit. The returned future completes when the permit is granted.
     */
    public CompletableFuture<Void> acquire() {
        synchronized (this) {
            if (available > 0 && waiters.isEmpty()) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Returns a permit, granting it to the oldest waiter if there is one.
     *
     * @throws IllegalStateException if more permits are released than were acquired
     */
    public void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                if (available >= maxPermits) {
                    throw new IllegalStateException("Released more permits than acquired");
                }
                available++;
                return;
            }
        }
        handOff(next);
    }

    private static void handOff(CompletableFuture<Void> waiter) {
        Deque<CompletableFuture<Void>> pending = HANDOFFS.get();
        if (pending != null) {
            pending.addLast(waiter);
            return;
        }

        pending = new ArrayDeque<>();
        pending.addLast(waiter);
        HANDOFFS.set(pending);
        try {
            CompletableFuture<Void> current;
            while ((current = pending.pollFirst()) != null) {
                current.complete(null);
            }
        } finally {
            HANDOFFS.remove();
        }
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int queueLength() {
        return waiters.size();
    }

    public int maxPermits() {
        return maxPermits;
    }
}
