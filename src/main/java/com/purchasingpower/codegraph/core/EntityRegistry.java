package com.purchasingpower.codegraph.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of entities keyed by identity.
 *
 * <p>Lifecycle: created empty, populated through {@link #register(Entity)} (re-registering an
 * identity merges into the existing entity), then {@link #freeze() frozen}. After freezing, only
 * the resolver changes anything: it rewrites relationship targets and collapses edges that became
 * identical.
 *
 * <p>Not thread-safe. Project results are merged one at a time by a single writer.
 *
 * @since 1.0.0
 */
@Slf4j
public class EntityRegistry {

    private final Map<String, Entity> entitiesByKey = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Registers an entity, or merges it into the one already registered under the same identity.
     *
     * @return the entity held by the registry
     */
    public Entity register(Entity entity) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + entity.getKey());
        }
        Entity existing = entitiesByKey.get(entity.getKey());
        if (existing == null) {
            entitiesByKey.put(entity.getKey(), entity);
            return entity;
        }
        if (existing != entity) {
            existing.mergeFrom(entity);
        }
        return existing;
    }

    public void registerAll(Collection<Entity> entities) {
        entities.forEach(this::register);
    }

    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.debug("Entity registry frozen with {} entities", entitiesByKey.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Entity> find(EntityId id) {
        return find(id.key());
    }

    public Optional<Entity> find(String key) {
        return Optional.ofNullable(entitiesByKey.get(key));
    }

    public Collection<Entity> getEntities() {
        return Collections.unmodifiableCollection(entitiesByKey.values());
    }

    public int size() {
        return entitiesByKey.size();
    }

    public int relationshipCount() {
        int count = 0;
        for (Entity entity : entitiesByKey.values()) {
            count += entity.getRelationships().size();
        }
        return count;
    }
}
