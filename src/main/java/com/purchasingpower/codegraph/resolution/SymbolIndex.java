package com.purchasingpower.codegraph.resolution;

import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityId;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.core.KindHint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Name index over a frozen registry, built once per resolver pass. Lookups cost a map access plus
 * a scan of the same-named entities.
 */
public class SymbolIndex {

    private final EntityRegistry registry;
    private final Map<String, List<Entity>> declarationsByName = new HashMap<>();

    public SymbolIndex(EntityRegistry registry) {
        if (!registry.isFrozen()) {
            throw new IllegalStateException("Symbol index requires a frozen registry");
        }
        this.registry = registry;
        for (Entity entity : registry.getEntities()) {
            if (!entity.getId().isFile()) {
                declarationsByName.computeIfAbsent(entity.getName(), name -> new ArrayList<>()).add(entity);
            }
        }
    }

    /**
     * Entities compatible with a placeholder. File hints match by root-relative path, every other
     * hint by name and kind.
     */
    public List<Entity> candidates(KindHint hint, String value) {
        if (hint == KindHint.FILE) {
            return registry.find(EntityId.file(value)).map(List::of).orElse(List.of());
        }
        List<Entity> sameName = declarationsByName.getOrDefault(value, Collections.emptyList());
        List<Entity> compatible = new ArrayList<>(sameName.size());
        for (Entity entity : sameName) {
            if (hint.accepts(entity.getKind())) {
                compatible.add(entity);
            }
        }
        return compatible;
    }
}
