package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.core.EntityKind;

import java.util.Optional;

/**
 * The closed set of decorators that refine a class into a specialized entity kind.
 *
 * @since 1.0.0
 */
public enum Stereotype {
    COMPONENT("Component", EntityKind.COMPONENT),
    INJECTABLE("Injectable", EntityKind.SERVICE),
    NG_MODULE("NgModule", EntityKind.MODULE),
    PIPE("Pipe", EntityKind.PIPE),
    DIRECTIVE("Directive", EntityKind.DIRECTIVE);

    private final String decoratorName;
    private final EntityKind kind;

    Stereotype(String decoratorName, EntityKind kind) {
        this.decoratorName = decoratorName;
        this.kind = kind;
    }

    public EntityKind getKind() {
        return kind;
    }

    /**
     * Match a decorator by simple name; {@code core.Component} matches like {@code Component}.
     */
    public static Optional<Stereotype> fromDecorator(String decoratorName) {
        if (decoratorName == null) {
            return Optional.empty();
        }
        String simpleName = decoratorName.substring(decoratorName.lastIndexOf('.') + 1);
        for (Stereotype stereotype : values()) {
            if (stereotype.decoratorName.equals(simpleName)) {
                return Optional.of(stereotype);
            }
        }
        return Optional.empty();
    }
}
