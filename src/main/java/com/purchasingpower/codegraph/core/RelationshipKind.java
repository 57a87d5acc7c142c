package com.purchasingpower.codegraph.core;

/**
 * Directed, typed edges between entities.
 *
 * <p>{@link #DEFINED_IN} is the only ownership edge; the loader creates it during the hierarchy
 * phase. Every other kind is a dependency edge recorded by the analyzer.
 *
 * @since 1.0.0
 */
public enum RelationshipKind {
    IMPORTS,
    DECLARES,
    PROVIDES,
    IMPORTS_MODULE,
    EXPORTS_MODULE,
    BOOTSTRAPS,
    INJECTS,
    DEFINED_IN,
    IMPLEMENTS,
    USES_PIPE,
    USES_DIRECTIVE;

    public boolean isOwnership() {
        return this == DEFINED_IN;
    }

    /**
     * Relationship type name in the graph store.
     */
    public String getGraphType() {
        return name();
    }
}
