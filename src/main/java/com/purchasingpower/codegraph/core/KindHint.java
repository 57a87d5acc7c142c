package com.purchasingpower.codegraph.core;

/**
 * Kind constraint carried by a placeholder target.
 *
 * @since 1.0.0
 */
public enum KindHint {
    /** Matches any declaration kind. Used for module declaration and export lists. */
    ANY("Any"),
    /** Matches a File entity by its root-relative path rather than by name. */
    FILE("File"),
    MODULE("Module"),
    SERVICE("Service"),
    COMPONENT("Component"),
    INTERFACE("Interface"),
    PIPE("Pipe"),
    /** A component is a directive with a template, so it satisfies this hint too. */
    DIRECTIVE("Directive");

    private final String label;

    KindHint(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean accepts(EntityKind kind) {
        if (kind == null) {
            return false;
        }
        return switch (this) {
            case ANY -> kind != EntityKind.FILE;
            case FILE -> kind == EntityKind.FILE;
            case MODULE -> kind == EntityKind.MODULE;
            case SERVICE -> kind == EntityKind.SERVICE;
            case COMPONENT -> kind == EntityKind.COMPONENT;
            case INTERFACE -> kind == EntityKind.INTERFACE;
            case PIPE -> kind == EntityKind.PIPE;
            case DIRECTIVE -> kind == EntityKind.DIRECTIVE || kind == EntityKind.COMPONENT;
        };
    }
}
