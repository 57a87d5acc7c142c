package com.purchasingpower.codegraph.knowledge;

import java.util.List;
import java.util.Map;

/**
 * Result of loading one registry into the graph store.
 *
 * @since 1.0.0
 */
public interface LoadResult {
    int getNodesWritten();
    int getNodesCreated();
    int getNodesFailed();
    int getOwnershipEdgesWritten();
    int getDependencyEdgesWritten();
    int getDependencyEdgesCreated();
    Map<SkipReason, Integer> getSkippedByReason();
    List<SkippedEdge> getSkippedEdges();
    List<String> getErrors();
    long getDurationMs();

    default int getSkippedEdgeCount() {
        return getSkippedByReason().values().stream().mapToInt(Integer::intValue).sum();
    }
}
