package com.purchasingpower.codegraph.core;

/**
 * Kinds of entities in the extracted graph.
 *
 * <p>The label doubles as the Neo4j node label. Specificity decides which kind survives when the
 * same identity is discovered more than once: a higher rank replaces a lower one, an equal rank is
 * replaced by the later discovery.
 *
 * @since 1.0.0
 */
public enum EntityKind {
    FILE("File", 0),
    UNKNOWN("Unknown", 0),
    TYPE("Class", 1),
    INTERFACE("Interface", 2),
    COMPONENT("Component", 3),
    SERVICE("Service", 3),
    MODULE("Module", 3),
    PIPE("Pipe", 3),
    DIRECTIVE("Directive", 3);

    private final String label;
    private final int specificity;

    EntityKind(String label, int specificity) {
        this.label = label;
        this.specificity = specificity;
    }

    public String getLabel() {
        return label;
    }

    public int getSpecificity() {
        return specificity;
    }

    /**
     * Picks the kind that survives a merge of {@code incoming} into an entity currently of this kind.
     */
    public EntityKind refine(EntityKind incoming) {
        if (incoming == null) {
            return this;
        }
        return incoming.specificity >= this.specificity ? incoming : this;
    }
}
