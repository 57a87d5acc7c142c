package com.purchasingpower.codegraph.discovery.impl;

import com.purchasingpower.codegraph.configuration.DiscoveryProperties;
import com.purchasingpower.codegraph.discovery.ManifestReader;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.purchasingpower.codegraph.support.TestFiles.write;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("File System Project Discoverer Tests")
class FileSystemProjectDiscovererTest {

    @TempDir
    Path root;

    private FileSystemProjectDiscoverer discoverer;

    @BeforeEach
    void setUp() {
        discoverer = new FileSystemProjectDiscoverer(new ManifestReader(), new DiscoveryProperties());
    }

    @Test
    @DisplayName("Finds manifests recursively in path order")
    void discover_findsManifestsInOrder() {
        // Given
        write(root, "libs/shared/tsconfig.json", "{ \"include\": [\"src/**/*.ts\"] }");
        write(root, "apps/shop/tsconfig.app.json", "{ \"files\": [\"src/main.ts\"] }");

        // When
        List<ProjectManifest> manifests = discoverer.discover(root);

        // Then
        assertEquals(2, manifests.size());
        assertEquals("apps/shop/tsconfig.app.json", manifests.get(0).displayName(root.toAbsolutePath().normalize()));
        assertEquals("libs/shared/tsconfig.json", manifests.get(1).displayName(root.toAbsolutePath().normalize()));
    }

    @Test
    @DisplayName("Skips broken manifests and manifests without files or include")
    void discover_skipsBadManifests() {
        write(root, "good/tsconfig.json", "{ \"include\": [\"**/*.ts\"] }");
        write(root, "broken/tsconfig.json", "{ not json");
        write(root, "solution/tsconfig.json", "{ \"references\": [{ \"path\": \"../good\" }] }");

        List<ProjectManifest> manifests = discoverer.discover(root);

        assertEquals(1, manifests.size());
        assertTrue(manifests.get(0).getManifestPath().endsWith(Path.of("good", "tsconfig.json")));
    }

    @Test
    @DisplayName("Does not descend into ignored directories")
    void discover_skipsIgnoredDirectories() {
        write(root, "node_modules/some-lib/tsconfig.json", "{ \"include\": [\"**/*.ts\"] }");
        write(root, "dist/tsconfig.json", "{ \"include\": [\"**/*.ts\"] }");
        write(root, "src/tsconfig.json", "{ \"include\": [\"**/*.ts\"] }");

        List<ProjectManifest> manifests = discoverer.discover(root);

        assertEquals(1, manifests.size());
    }

    @Test
    @DisplayName("No manifests is an empty result, not an error")
    void discover_noManifests_returnsEmpty() {
        write(root, "README.md", "# nothing here");

        assertTrue(discoverer.discover(root).isEmpty());
    }

    @Test
    @DisplayName("A root that is not a directory is rejected")
    void discover_rootNotDirectory_throws() {
        Path file = write(root, "file.txt", "x");

        assertThrows(IllegalArgumentException.class, () -> discoverer.discover(file));
        assertThrows(IllegalArgumentException.class, () -> discoverer.discover(root.resolve("missing")));
    }
}
