package com.purchasingpower.codegraph.discovery;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A project manifest ({@code tsconfig.json} style) that declares its member files.
 *
 * <p>All paths are absolute and normalized.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ProjectManifest {

    Path manifestPath;

    /** Directory containing the manifest; {@code files} and {@code include} are relative to it. */
    Path projectDir;

    /** Explicit member files, as written. {@code null} when the manifest has no {@code files} key. */
    List<String> files;

    /** Include globs, as written. {@code null} when the manifest has no {@code include} key. */
    List<String> include;

    @Builder.Default
    List<String> exclude = List.of();

    /** {@code compilerOptions.baseUrl}, resolved; {@code null} when not declared anywhere in the chain. */
    Path baseUrl;

    /** Alias prefix pattern to candidate directory patterns, in declaration order. */
    @Builder.Default
    Map<String, List<String>> paths = Map.of();

    /** Directory the alias candidates are relative to. */
    Path pathsBase;

    public boolean declaresMemberFiles() {
        return files != null || include != null;
    }

    public String displayName(Path root) {
        try {
            return root.relativize(manifestPath).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return manifestPath.toString();
        }
    }
}
