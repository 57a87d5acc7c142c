package com.purchasingpower.codegraph.knowledge;

/**
 * Counts reported by the store for one batch.
 *
 * @param written rows merged (created or updated)
 * @param created rows that did not exist before
 */
public record GraphWriteSummary(int written, int created) {

    public static final GraphWriteSummary EMPTY = new GraphWriteSummary(0, 0);

    public GraphWriteSummary plus(GraphWriteSummary other) {
        return new GraphWriteSummary(written + other.written, created + other.created);
    }
}
