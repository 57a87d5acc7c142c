package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AnalysisProperties {

    /** Extensions of source files that belong to a project, in import-resolution order. */
    @NotEmpty
    private List<String> sourceExtensions = new ArrayList<>(List.of(".ts"));

    /** Number of projects analyzed concurrently. */
    @Min(1)
    @Max(64)
    private int parallelism = 4;
}
