package com.purchasingpower.codegraph.knowledge;

import java.util.List;

/**
 * Interface for graph database writes.
 *
 * <p>Every write is a create-or-update keyed by the node {@code key}, so repeating a batch leaves
 * the graph unchanged. Connectivity problems surface as
 * {@link com.purchasingpower.codegraph.exception.GraphStoreUnavailableException}; any other failed
 * write as {@link com.purchasingpower.codegraph.exception.GraphStoreException}.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Fail fast when the store cannot be reached.
     */
    void verifyConnectivity();

    /**
     * Create the key uniqueness constraint and lookup indexes if missing. Failures are logged only.
     */
    void ensureSchema();

    /**
     * Delete every node written by a previous run.
     *
     * @return number of deleted nodes
     */
    int clear();

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Merge a batch of nodes sharing one label. Any other kind label left on an existing node from
     * an earlier run is removed.
     */
    GraphWriteSummary mergeNodes(String label, List<GraphNodeRecord> nodes);

    /**
     * Merge a batch of edges sharing one relationship type. Both endpoints must already exist;
     * edges whose endpoints are missing are not written and not counted.
     */
    GraphWriteSummary mergeEdges(String type, List<GraphEdgeRecord> edges);
}
