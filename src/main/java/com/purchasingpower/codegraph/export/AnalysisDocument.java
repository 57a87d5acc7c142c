package com.purchasingpower.codegraph.export;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a resolved registry: every entity with its outgoing relationships.
 */
public record AnalysisDocument(String root, Instant generatedAt, List<Node> nodes) {

    public record Node(
            String id,
            String type,
            String name,
            String filePath,
            Map<String, Object> properties,
            List<Edge> relationships) {
    }

    public record Edge(String type, String targetId, String targetState, Map<String, Object> properties) {
    }
}
