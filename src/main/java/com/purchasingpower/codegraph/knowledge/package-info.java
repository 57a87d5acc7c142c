/**
 * Knowledge graph construction: persisting the resolved entity registry.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code GraphStore} - idempotent batched writes against Neo4j</li>
 *   <li>{@code GraphLoader} - two-phase load, ownership before dependencies</li>
 *   <li>{@code GraphBuildService} - discovery, analysis, resolution and loading in one run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.knowledge;
