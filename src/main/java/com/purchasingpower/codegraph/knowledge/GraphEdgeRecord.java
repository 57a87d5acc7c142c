package com.purchasingpower.codegraph.knowledge;

import java.util.Map;

/**
 * One edge to merge between two node keys.
 */
public record GraphEdgeRecord(String fromKey, String toKey, String type, Map<String, Object> properties) {
}
