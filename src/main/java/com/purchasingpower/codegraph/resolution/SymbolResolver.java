package com.purchasingpower.codegraph.resolution;

import com.purchasingpower.codegraph.core.EntityRegistry;

/**
 * Rewrites every placeholder target in a frozen registry to a concrete identity or a terminal
 * marker. Only relationship targets are touched.
 *
 * @since 1.0.0
 */
public interface SymbolResolver {

    /**
     * @throws IllegalStateException if the registry is not frozen
     */
    ResolutionReport resolve(EntityRegistry registry);
}
