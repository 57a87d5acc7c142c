package com.purchasingpower.codegraph.knowledge;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Parameters of one build run.
 */
@Value
@Builder
public class GraphBuildRequest {

    Path root;

    /** Name of the Repository node; the root directory name when blank. */
    String repositoryName;

    /** Analysis document destination; no document when {@code null}. */
    Path output;

    @Builder.Default
    boolean load = true;
}
