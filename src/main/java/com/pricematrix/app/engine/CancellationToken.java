package com.pricematrix.app.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned flag checked by the recalculation loop between two cell evaluations.
 * Cancelling never interrupts a cell midway.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A fresh token nobody else holds, i.e. one that is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
