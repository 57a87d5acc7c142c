package com.purchasingpower.codegraph.discovery.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.DiscoveryProperties;
import com.purchasingpower.codegraph.discovery.ManifestReader;
import com.purchasingpower.codegraph.discovery.ProjectDiscoverer;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import com.purchasingpower.codegraph.exception.ManifestParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks the directory tree looking for project manifests.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class FileSystemProjectDiscoverer implements ProjectDiscoverer {

    private final ManifestReader manifestReader;
    private final Set<String> manifestNames;
    private final Set<String> ignoredDirectories;

    @Autowired
    public FileSystemProjectDiscoverer(ManifestReader manifestReader, AppProperties properties) {
        this(manifestReader, properties.getDiscovery());
    }

    /** Convenience constructor for tests. */
    public FileSystemProjectDiscoverer(ManifestReader manifestReader, DiscoveryProperties discovery) {
        this.manifestReader = manifestReader;
        this.manifestNames = Set.copyOf(discovery.getManifestNames());
        this.ignoredDirectories = Set.copyOf(discovery.getIgnoredDirectories());
    }

    @Override
    public List<ProjectManifest> discover(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Root is not a directory: " + root);
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();

        List<Path> candidates = findManifestFiles(normalizedRoot);
        List<ProjectManifest> manifests = new ArrayList<>();

        for (Path candidate : candidates) {
            try {
                ProjectManifest manifest = manifestReader.read(candidate);
                if (!manifest.declaresMemberFiles()) {
                    log.warn("⚠️  Skipping {}: declares neither 'files' nor 'include'",
                            manifest.displayName(normalizedRoot));
                    continue;
                }
                manifests.add(manifest);
            } catch (ManifestParseException e) {
                log.warn("⚠️  Could not read or parse {}. Skipping. ({})", candidate, e.getMessage());
            }
        }

        if (manifests.isEmpty()) {
            log.warn("⚠️  No manifests named {} with 'files' or 'include' found under {}",
                    manifestNames, normalizedRoot);
        } else {
            log.info("Discovered {} project manifest(s) under {}", manifests.size(), normalizedRoot);
        }
        return manifests;
    }

    private List<Path> findManifestFiles(Path root) {
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && dir.getFileName() != null
                            && ignoredDirectories.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && manifestNames.contains(file.getFileName().toString())) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("⚠️  Cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
        found.sort(null);
        return found;
    }
}
