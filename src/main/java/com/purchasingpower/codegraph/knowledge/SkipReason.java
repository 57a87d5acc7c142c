package com.purchasingpower.codegraph.knowledge;

/**
 * Why a dependency edge was not written in phase 2.
 */
public enum SkipReason {
    /** Placeholder matched nothing. */
    UNRESOLVED(false),
    /** Placeholder matched several entities. */
    AMBIGUOUS(false),
    /** Target outside the analyzed tree. Routine for every library import. */
    EXTERNAL(true),
    /** The resolver never ran on this target. */
    PENDING_PLACEHOLDER(false),
    /** An endpoint has no node, typically because its phase-1 batch failed. */
    MISSING_ENDPOINT(false),
    /** The store rejected the batch holding this edge. */
    STORE_ERROR(false);

    private final boolean routine;

    SkipReason(boolean routine) {
        this.routine = routine;
    }

    /**
     * Routine skips are logged at debug level; every other skip is a warning.
     */
    public boolean isRoutine() {
        return routine;
    }
}
