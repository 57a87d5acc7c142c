package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.EntityRegistry;

/**
 * Materializes a resolved registry into the graph store.
 *
 * <p>Phase 1 writes every node and every ownership edge for the whole registry. Phase 2 starts
 * only afterwards and writes dependency edges between existing nodes. The registry is only read.
 *
 * @since 1.0.0
 */
public interface GraphLoader {

    /**
     * @param registry frozen, resolved registry
     * @param repositoryName name of the root Repository node
     * @throws com.purchasingpower.codegraph.exception.GraphStoreUnavailableException if the store
     *         cannot be reached at any point
     */
    LoadResult load(EntityRegistry registry, String repositoryName);
}
