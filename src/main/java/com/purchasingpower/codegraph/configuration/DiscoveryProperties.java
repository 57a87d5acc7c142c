package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DiscoveryProperties {

    @NotEmpty
    private List<String> manifestNames = new ArrayList<>(List.of("tsconfig.json", "tsconfig.app.json"));

    private List<String> ignoredDirectories = new ArrayList<>(
            List.of("node_modules", ".git", "dist", "build", "out", "coverage", ".angular"));
}
