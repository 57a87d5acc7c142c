package com.purchasingpower.codegraph.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * Finds the projects of a multi-project source tree.
 *
 * @since 1.0.0
 */
public interface ProjectDiscoverer {

    /**
     * Walk the tree under {@code root} and return every manifest that declares member files,
     * ordered by path. Unreadable manifests and manifests without a file set are skipped with a
     * warning. An empty list is a valid result.
     *
     * @param root root directory of the source tree
     * @return discovered manifests
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    List<ProjectManifest> discover(Path root);
}
