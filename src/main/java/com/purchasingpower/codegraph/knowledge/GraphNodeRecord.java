package com.purchasingpower.codegraph.knowledge;

import java.util.Map;

/**
 * One node to merge: identity key, kind label and the complete property map (key included).
 */
public record GraphNodeRecord(String key, String label, Map<String, Object> properties) {
}
