package com.purchasingpower.codegraph.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A discovered structural unit: a file, a type, or a stereotype-refined type.
 *
 * <p>Property values are strings, booleans or lists of strings so they can be stored directly as
 * graph node properties.
 *
 * @since 1.0.0
 */
@Getter
public class Entity {

    private final EntityId id;
    private EntityKind kind;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<Relationship> relationships = new ArrayList<>();

    public Entity(EntityId id, EntityKind kind) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getName() {
        return id.name();
    }

    public String getFilePath() {
        return id.path();
    }

    public String getKey() {
        return id.key();
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public List<Relationship> getRelationships() {
        return Collections.unmodifiableList(relationships);
    }

    /**
     * Sets a property unless the value is empty. Empty values never replace what is already known.
     */
    public Entity putProperty(String key, Object value) {
        if (hasContent(value)) {
            properties.put(key, normalize(value));
        }
        return this;
    }

    public Entity addRelationship(Relationship relationship) {
        for (Relationship existing : relationships) {
            if (existing.sameAs(relationship)) {
                return this;
            }
        }
        relationships.add(relationship);
        return this;
    }

    /**
     * Drops relationships that became identical after their targets were resolved, keeping the
     * first occurrence.
     *
     * @return number of relationships removed
     */
    public int removeDuplicateRelationships() {
        List<Relationship> unique = new ArrayList<>(relationships.size());
        for (Relationship relationship : relationships) {
            if (unique.stream().noneMatch(relationship::sameAs)) {
                unique.add(relationship);
            }
        }
        int removed = relationships.size() - unique.size();
        if (removed > 0) {
            relationships.clear();
            relationships.addAll(unique);
        }
        return removed;
    }

    /**
     * Folds a rediscovery of the same identity into this entity: the more specific kind wins,
     * non-empty properties override, new relationships are appended.
     */
    public void mergeFrom(Entity other) {
        if (!id.equals(other.id)) {
            throw new IllegalArgumentException("Cannot merge " + other.id + " into " + id);
        }
        kind = kind.refine(other.kind);
        other.properties.forEach(this::putProperty);
        other.relationships.forEach(this::addRelationship);
    }

    private static boolean hasContent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    private static Object normalize(Object value) {
        if (value instanceof Collection<?> collection) {
            List<String> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(String.valueOf(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return kind.getLabel() + "[" + id.key() + "]";
    }
}
