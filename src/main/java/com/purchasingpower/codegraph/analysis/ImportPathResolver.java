package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.discovery.ProjectManifest;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps an import specifier to a file on disk for one project.
 *
 * <p>Lookup order: relative to the importing file, then the manifest's alias table (longest
 * prefix first), then {@code baseUrl}, then the global root. For every base path the candidates
 * are {@code <base><ext>} per extension, {@code <base>/index<ext>}, then the raw path.
 */
public class ImportPathResolver {

    private final Path root;
    private final List<String> extensions;
    private final Path baseUrl;
    private final Path pathsBase;
    private final List<Map.Entry<String, List<String>>> aliases;

    public ImportPathResolver(ProjectManifest manifest, Path root, List<String> extensions) {
        this.root = root.toAbsolutePath().normalize();
        this.extensions = List.copyOf(extensions);
        this.baseUrl = manifest.getBaseUrl();
        this.pathsBase = manifest.getPathsBase() != null ? manifest.getPathsBase() : manifest.getProjectDir();
        this.aliases = new ArrayList<>(manifest.getPaths().entrySet());
        this.aliases.sort(Comparator.comparingInt((Map.Entry<String, List<String>> e) -> aliasPrefix(e.getKey()).length())
                .reversed());
    }

    public static boolean isRelative(String specifier) {
        return specifier.equals(".") || specifier.equals("..")
                || specifier.startsWith("./") || specifier.startsWith("../");
    }

    public Optional<Path> resolve(String specifier, Path importingFile) {
        if (specifier == null || specifier.isBlank()) {
            return Optional.empty();
        }
        if (isRelative(specifier)) {
            return firstExisting(importingFile.getParent(), specifier);
        }

        for (Map.Entry<String, List<String>> alias : aliases) {
            Optional<String> captured = match(alias.getKey(), specifier);
            if (captured.isEmpty()) {
                continue;
            }
            for (String target : alias.getValue()) {
                Optional<Path> found = firstExisting(pathsBase, target.replace("*", captured.get()));
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        if (baseUrl != null) {
            Optional<Path> found = firstExisting(baseUrl, specifier);
            if (found.isPresent()) {
                return found;
            }
        }
        return firstExisting(root, specifier);
    }

    private Optional<Path> firstExisting(Path base, String relative) {
        Path candidateBase;
        try {
            candidateBase = base.resolve(relative).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        String basePath = candidateBase.toString();
        for (String extension : extensions) {
            Path candidate = Path.of(basePath + extension);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (String extension : extensions) {
            Path candidate = candidateBase.resolve("index" + extension);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Files.isRegularFile(candidateBase) ? Optional.of(candidateBase) : Optional.empty();
    }

    /** @return the text captured by {@code *}, or empty text for an exact alias */
    private static Optional<String> match(String pattern, String specifier) {
        int star = pattern.indexOf('*');
        if (star < 0) {
            return pattern.equals(specifier) ? Optional.of("") : Optional.empty();
        }
        String prefix = pattern.substring(0, star);
        String suffix = pattern.substring(star + 1);
        if (specifier.length() >= prefix.length() + suffix.length()
                && specifier.startsWith(prefix) && specifier.endsWith(suffix)) {
            return Optional.of(specifier.substring(prefix.length(), specifier.length() - suffix.length()));
        }
        return Optional.empty();
    }

    private static String aliasPrefix(String pattern) {
        int star = pattern.indexOf('*');
        return star < 0 ? pattern + "\u0000" : pattern.substring(0, star);
    }
}
