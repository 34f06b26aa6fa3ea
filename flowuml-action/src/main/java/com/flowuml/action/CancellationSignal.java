package com.flowuml.action;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed from the caller of a dispatch to the handler. Once cancelled it
 * stays cancelled.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final AtomicBoolean cancelled;
    private final boolean cancellable;

    private CancellationSignal(boolean cancellable) {
        this.cancelled = new AtomicBoolean(false);
        this.cancellable = cancellable;
    }

    /** New signal that can be cancelled with {@link #cancel()}. */
    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /** Shared signal that is never cancelled. */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationSignal.none() cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** @throws CancellationException when cancelled */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Action dispatch cancelled");
        }
    }
}
