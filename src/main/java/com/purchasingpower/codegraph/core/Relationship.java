package com.purchasingpower.codegraph.core;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outgoing edge recorded at discovery time. Only the target is ever rewritten, and only by the
 * resolver.
 *
 * @since 1.0.0
 */
@Getter
public class Relationship {

    private final RelationshipKind kind;
    private final Map<String, Object> properties;
    private TargetRef target;

    public Relationship(RelationshipKind kind, TargetRef target) {
        this(kind, target, Map.of());
    }

    public Relationship(RelationshipKind kind, TargetRef target, Map<String, Object> properties) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = Objects.requireNonNull(target, "target");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public void retarget(TargetRef newTarget) {
        this.target = Objects.requireNonNull(newTarget, "newTarget");
    }

    /**
     * Same kind, target and properties. Used to avoid appending an edge twice when an entity is
     * rediscovered.
     */
    public boolean sameAs(Relationship other) {
        return other != null
            && kind == other.kind
            && target.equals(other.target)
            && properties.equals(other.properties);
    }

    @Override
    public String toString() {
        return kind + " -> " + target.render();
    }
}
