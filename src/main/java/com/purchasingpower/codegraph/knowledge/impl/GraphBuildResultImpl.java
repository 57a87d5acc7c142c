package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.knowledge.GraphBuildResult;
import com.purchasingpower.codegraph.knowledge.LoadResult;
import com.purchasingpower.codegraph.resolution.ResolutionReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of GraphBuildResult.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphBuildResultImpl implements GraphBuildResult {

    private boolean success;
    private int projectsDiscovered;
    private int projectsAnalyzed;
    private int projectsFailed;
    private int entityCount;
    private int relationshipCount;
    private ResolutionReport resolution;
    private LoadResult loadResult;

    @ToString.Exclude
    private EntityRegistry registry;

    private long durationMs;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static GraphBuildResultImpl failure(String error, long durationMs) {
        return GraphBuildResultImpl.builder()
            .success(false)
            .errors(new ArrayList<>(List.of(error)))
            .durationMs(durationMs)
            .build();
    }
}
