package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.resolution.ResolutionReport;

import java.util.List;

/**
 * Result of a build run.
 *
 * @since 1.0.0
 */
public interface GraphBuildResult {
    boolean isSuccess();
    int getProjectsDiscovered();
    int getProjectsAnalyzed();
    int getProjectsFailed();
    int getEntityCount();
    int getRelationshipCount();
    ResolutionReport getResolution();

    /** {@code null} when loading was disabled or never started. */
    LoadResult getLoadResult();

    EntityRegistry getRegistry();
    List<String> getErrors();
    long getDurationMs();
}
