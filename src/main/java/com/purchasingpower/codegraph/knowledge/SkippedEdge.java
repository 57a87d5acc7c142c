package com.purchasingpower.codegraph.knowledge;

/**
 * A relationship left out of the graph, with the rendered target it pointed at.
 */
public record SkippedEdge(String fromKey, String type, String target, SkipReason reason) {
}
