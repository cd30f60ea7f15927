package com.pricematrix.app.engine;

/**
 * Outcome of one recalculation pass.
 */
public class RecalcReport {
    private final int dirtyCount;
    private final int evaluatedCount;
    private final boolean cancelled;

    public RecalcReport(int dirtyCount, int evaluatedCount, boolean cancelled) {
        this.dirtyCount = dirtyCount;
        this.evaluatedCount = evaluatedCount;
        this.cancelled = cancelled;
    }

    /** Size of the dirty closure. */
    public int getDirtyCount() {
        return dirtyCount;
    }

    /** Formula cells actually evaluated by this pass. */
    public int getEvaluatedCount() {
        return evaluatedCount;
    }

    /** True if the token stopped the pass; the cells not reached stay dirty. */
    public boolean isCancelled() {
        return cancelled;
    }
}
