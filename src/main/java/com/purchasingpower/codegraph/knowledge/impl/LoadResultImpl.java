package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.knowledge.LoadResult;
import com.purchasingpower.codegraph.knowledge.SkipReason;
import com.purchasingpower.codegraph.knowledge.SkippedEdge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of LoadResult.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadResultImpl implements LoadResult {

    private int nodesWritten;
    private int nodesCreated;
    private int nodesFailed;
    private int ownershipEdgesWritten;
    private int dependencyEdgesWritten;
    private int dependencyEdgesCreated;
    private long durationMs;

    @Builder.Default
    private Map<SkipReason, Integer> skippedByReason = new EnumMap<>(SkipReason.class);

    @Builder.Default
    private List<SkippedEdge> skippedEdges = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
