package com.purchasingpower.codegraph.core;

import java.util.Objects;

/**
 * Stable identity of an entity: key family, simple name and root-relative declaring path.
 *
 * <p>All declarations share the {@link Family#DECLARATION} family, so refining a class into a
 * component keeps the key. Paths always use {@code /} separators.
 *
 * @since 1.0.0
 */
public record EntityId(Family family, String name, String path) {

    public enum Family {
        FILE("File"),
        DECLARATION("Type");

        private final String prefix;

        Family(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    public EntityId {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
    }

    public static EntityId file(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        String baseName = slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
        return new EntityId(Family.FILE, baseName, relativePath);
    }

    public static EntityId declaration(String name, String relativePath) {
        return new EntityId(Family.DECLARATION, name, relativePath);
    }

    /**
     * Key used for exact-match lookup, both in memory and in the graph store.
     * Format: {@code File:<path>} or {@code Type:<name>:<path>}.
     */
    public String key() {
        return family == Family.FILE
            ? family.getPrefix() + ":" + path
            : family.getPrefix() + ":" + name + ":" + path;
    }

    public boolean isFile() {
        return family == Family.FILE;
    }

    @Override
    public String toString() {
        return key();
    }
}
