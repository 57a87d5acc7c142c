package com.purchasingpower.codegraph.model;

/**
 * External resources touched by the pipeline, for unified call logging.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    FILESYSTEM("📁", "FileSystem");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
