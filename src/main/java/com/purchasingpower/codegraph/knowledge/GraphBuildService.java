package com.purchasingpower.codegraph.knowledge;

/**
 * Builds the code graph of a multi-project source tree.
 *
 * <p>Runs the whole pipeline:
 * <ol>
 *   <li>Discover project manifests under the root</li>
 *   <li>Analyze projects concurrently, merging results one project at a time</li>
 *   <li>Freeze the registry and resolve placeholders</li>
 *   <li>Write the analysis document (optional)</li>
 *   <li>Load the graph store (optional)</li>
 * </ol>
 *
 * @since 1.0.0
 */
public interface GraphBuildService {

    /**
     * Build the graph. Failures of single manifests, files or projects are reported in the
     * result; only an unreachable store or an unwritable document makes the run unsuccessful.
     *
     * @param request build parameters
     * @return counts, resolution outcome, load outcome and errors
     */
    GraphBuildResult build(GraphBuildRequest request);
}
