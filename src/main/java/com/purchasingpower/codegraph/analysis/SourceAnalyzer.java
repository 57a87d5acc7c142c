package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.discovery.ProjectManifest;

import java.nio.file.Path;

/**
 * Turns the member files of one project into entities and locally known relationships.
 *
 * <p>Relationships whose destination cannot be identified from inside the project are emitted with
 * placeholder targets for the resolver. Implementations hold no state shared between calls, so
 * several projects may be analyzed concurrently.
 *
 * @since 1.0.0
 */
public interface SourceAnalyzer {

    /**
     * Analyze one project.
     *
     * @param manifest the project's manifest
     * @param root global root; entity paths are relative to it
     * @return entities discovered in the project, merged per identity
     * @throws com.purchasingpower.codegraph.exception.ProjectAnalysisException if the project as a
     *         whole cannot be analyzed
     */
    ProjectAnalysis analyze(ProjectManifest manifest, Path root);
}
