package com.kmg.grading.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Once cancelled it stays cancelled; the worker checks it at its
 * suspension points and never gets interrupted mid-call.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return {@code true} only for the call that flipped the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
