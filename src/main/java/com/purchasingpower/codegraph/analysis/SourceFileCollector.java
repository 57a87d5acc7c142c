package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expands a manifest's {@code files}, {@code include} and {@code exclude} entries into the
 * project's member source files.
 *
 * <p>Glob semantics follow the tsconfig dialect: {@code **} spans zero or more directories and a
 * pattern without wildcards or extension names a directory. Declaration files ({@code .d.ts}),
 * files in ignored directories and files outside the global root are never members.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class SourceFileCollector {

    private final List<String> sourceExtensions;
    private final Set<String> ignoredDirectories;

    @Autowired
    public SourceFileCollector(AppProperties properties) {
        this(properties.getAnalysis().getSourceExtensions(), properties.getDiscovery().getIgnoredDirectories());
    }

    public SourceFileCollector(List<String> sourceExtensions, List<String> ignoredDirectories) {
        this.sourceExtensions = List.copyOf(sourceExtensions);
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
    }

    /**
     * @return absolute, normalized member files in path order
     * @throws IOException if a directory named by an include pattern cannot be walked
     */
    public List<Path> collect(ProjectManifest manifest, Path root) throws IOException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path projectDir = manifest.getProjectDir();
        List<GlobPattern> excludes = compileAll(manifest.getExclude(), projectDir);
        Set<Path> members = new TreeSet<>();

        if (manifest.getFiles() != null) {
            for (String entry : manifest.getFiles()) {
                Path file = projectDir.resolve(entry).toAbsolutePath().normalize();
                if (!Files.isRegularFile(file)) {
                    log.warn("⚠️  {} lists missing file '{}'", manifest.getManifestPath(), entry);
                    continue;
                }
                if (accepts(file, normalizedRoot)) {
                    members.add(file);
                }
            }
        }

        if (manifest.getInclude() != null) {
            for (String include : manifest.getInclude()) {
                GlobPattern pattern = GlobPattern.compile(include, projectDir);
                if (!Files.isDirectory(pattern.baseDir())) {
                    log.debug("Include '{}' of {} names no directory", include, manifest.getManifestPath());
                    continue;
                }
                walk(pattern, normalizedRoot, excludes, members);
            }
        }

        return new ArrayList<>(members);
    }

    private void walk(GlobPattern pattern, Path root, List<GlobPattern> excludes, Set<Path> members)
            throws IOException {
        Files.walkFileTree(pattern.baseDir(), new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(pattern.baseDir()) && dir.getFileName() != null
                        && ignoredDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path normalized = file.toAbsolutePath().normalize();
                if (attrs.isRegularFile()
                        && pattern.matches(normalized)
                        && excludes.stream().noneMatch(exclude -> exclude.matches(normalized))
                        && accepts(normalized, root)) {
                    members.add(normalized);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("⚠️  Cannot visit {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private boolean accepts(Path file, Path root) {
        if (!file.startsWith(root)) {
            return false;
        }
        String fileName = file.getFileName().toString();
        if (fileName.endsWith(".d.ts")) {
            return false;
        }
        for (Path part : root.relativize(file)) {
            if (ignoredDirectories.contains(part.toString())) {
                return false;
            }
        }
        return sourceExtensions.stream().anyMatch(fileName::endsWith);
    }

    private static List<GlobPattern> compileAll(List<String> patterns, Path projectDir) {
        List<GlobPattern> compiled = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                compiled.add(GlobPattern.compile(pattern, projectDir));
            }
        }
        return compiled;
    }

    /**
     * A glob split into its literal leading directory and the wildcard remainder, matched against
     * paths relative to that directory.
     */
    record GlobPattern(Path baseDir, List<PathMatcher> matchers) {

        static GlobPattern compile(String pattern, Path projectDir) {
            String normalized = pattern.replace('\\', '/');
            while (normalized.startsWith("./")) {
                normalized = normalized.substring(2);
            }
            if (normalized.endsWith("/")) {
                normalized = normalized + "**/*";
            }

            String[] segments = normalized.split("/");
            int literalCount = 0;
            while (literalCount < segments.length && !hasWildcard(segments[literalCount])) {
                literalCount++;
            }

            Path baseDir = projectDir;
            String remainder;
            if (literalCount == segments.length) {
                String last = segments[segments.length - 1];
                boolean directory = !last.contains(".") || last.equals("..") || last.equals(".");
                if (directory) {
                    baseDir = resolve(projectDir, segments, segments.length);
                    remainder = "**/*";
                } else {
                    baseDir = resolve(projectDir, segments, segments.length - 1);
                    remainder = last;
                }
            } else {
                baseDir = resolve(projectDir, segments, literalCount);
                remainder = String.join("/", List.of(segments).subList(literalCount, segments.length));
            }

            Set<String> variants = new LinkedHashSet<>();
            addZeroDirectoryVariants(remainder, 0, variants);
            List<PathMatcher> matchers = new ArrayList<>(variants.size());
            for (String variant : variants) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + variant));
            }
            return new GlobPattern(baseDir.toAbsolutePath().normalize(), List.copyOf(matchers));
        }

        boolean matches(Path file) {
            if (!file.startsWith(baseDir)) {
                return false;
            }
            Path relative = baseDir.relativize(file);
            return matchers.stream().anyMatch(matcher -> matcher.matches(relative));
        }

        /**
         * Java globs need at least one directory for {@code **}{@code /}. Adds the pattern with every
         * combination of its {@code **}{@code /} segments dropped, so each one may also span zero
         * directories independently of the others.
         */
        private static void addZeroDirectoryVariants(String glob, int fromIndex, Set<String> variants) {
            variants.add(glob);
            int index = glob.indexOf("**/", fromIndex);
            while (index >= 0) {
                if (index == 0 || glob.charAt(index - 1) == '/') {
                    addZeroDirectoryVariants(glob.substring(0, index) + glob.substring(index + 3), index, variants);
                }
                index = glob.indexOf("**/", index + 3);
            }
        }

        private static boolean hasWildcard(String segment) {
            return segment.indexOf('*') >= 0 || segment.indexOf('?') >= 0 || segment.indexOf('[') >= 0
                    || segment.indexOf('{') >= 0;
        }

        private static Path resolve(Path projectDir, String[] segments, int count) {
            Path result = projectDir;
            for (int i = 0; i < count; i++) {
                if (!segments[i].isEmpty()) {
                    result = result.resolve(segments[i]);
                }
            }
            return result;
        }
    }
}
