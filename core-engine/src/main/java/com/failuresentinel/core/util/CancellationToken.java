package com.failuresentinel.core.util;

/**
 * Cooperative cancellation flag shared between a caller and a long-running
 * analysis.
 *
 * <p>
 * Analyses poll {@link #isCancellationRequested()} between partitions and
 * periodically inside loops, and return a {@code CANCELLED} failure result
 * instead of partial output. Safe to cancel from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * @return a new token that has not been cancelled
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * @return a shared token that can never be cancelled
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Request cancellation. Idempotent.
     *
     * @throws IllegalStateException on the shared {@link #none()} token
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("The shared non-cancellable token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }
}
