package com.purchasingpower.codegraph.discovery;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.purchasingpower.codegraph.exception.ManifestParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code tsconfig}-style manifests.
 *
 * <p>The dialect allows comments and trailing commas. {@code compilerOptions.baseUrl} and
 * {@code compilerOptions.paths} are inherited through relative {@code extends} references, the
 * nearest declaration winning. {@code files}, {@code include} and {@code exclude} are taken from the
 * manifest itself only.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ManifestReader {

    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .build();

    /**
     * Parse a manifest.
     *
     * @param manifestPath path to the manifest file
     * @return the parsed manifest
     * @throws ManifestParseException if the file cannot be read or is not a JSON object
     */
    public ProjectManifest read(Path manifestPath) {
        Path manifest = manifestPath.toAbsolutePath().normalize();
        JsonNode json = readJson(manifest);
        Path projectDir = manifest.getParent();

        CompilerPaths compilerPaths = new CompilerPaths();
        collectCompilerPaths(manifest, json, compilerPaths, new HashSet<>());

        return ProjectManifest.builder()
                .manifestPath(manifest)
                .projectDir(projectDir)
                .files(stringList(json.get("files")))
                .include(stringList(json.get("include")))
                .exclude(orEmpty(stringList(json.get("exclude"))))
                .baseUrl(compilerPaths.baseUrl)
                .paths(compilerPaths.paths != null ? compilerPaths.paths : Map.of())
                .pathsBase(compilerPaths.baseUrl != null ? compilerPaths.baseUrl : compilerPaths.pathsOwnerDir)
                .build();
    }

    private JsonNode readJson(Path manifest) {
        JsonNode json;
        try {
            json = lenientMapper.readTree(Files.readString(manifest));
        } catch (IOException e) {
            throw new ManifestParseException(manifest, "Cannot read manifest " + manifest + ": " + e.getMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new ManifestParseException(manifest, "Manifest " + manifest + " is not a JSON object");
        }
        return json;
    }

    /**
     * Walks the manifest and its {@code extends} chain, filling whatever the nearer manifests left
     * unset.
     */
    private void collectCompilerPaths(Path manifest, JsonNode json, CompilerPaths target, Set<Path> visited) {
        if (!visited.add(manifest)) {
            log.warn("⚠️  Cyclic 'extends' chain at {}", manifest);
            return;
        }

        JsonNode compilerOptions = json.get("compilerOptions");
        if (compilerOptions != null && compilerOptions.isObject()) {
            Path dir = manifest.getParent();
            JsonNode baseUrl = compilerOptions.get("baseUrl");
            if (target.baseUrl == null && baseUrl != null && baseUrl.isTextual()) {
                target.baseUrl = dir.resolve(baseUrl.asText()).normalize();
            }
            JsonNode paths = compilerOptions.get("paths");
            if (target.paths == null && paths != null && paths.isObject()) {
                target.paths = readAliasTable(paths);
                target.pathsOwnerDir = dir;
            }
        }

        for (String parent : extendsReferences(json.get("extends"))) {
            Path parentPath = resolveExtends(manifest, parent);
            if (parentPath == null) {
                log.debug("Not following non-relative 'extends' {} from {}", parent, manifest);
                continue;
            }
            try {
                collectCompilerPaths(parentPath, readJson(parentPath), target, visited);
            } catch (ManifestParseException e) {
                log.warn("⚠️  Ignoring base manifest {} of {}: {}", parentPath, manifest, e.getMessage());
            }
        }
    }

    private Map<String, List<String>> readAliasTable(JsonNode paths) {
        Map<String, List<String>> table = new LinkedHashMap<>();
        paths.fields().forEachRemaining(entry -> {
            List<String> candidates = stringList(entry.getValue());
            if (candidates != null && !candidates.isEmpty()) {
                table.put(entry.getKey(), List.copyOf(candidates));
            }
        });
        return table;
    }

    private List<String> extendsReferences(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        List<String> refs = stringList(node);
        return refs != null ? refs : List.of();
    }

    private Path resolveExtends(Path manifest, String reference) {
        if (!reference.startsWith(".") && !reference.startsWith("/")) {
            return null;
        }
        try {
            Path resolved = manifest.getParent().resolve(reference).normalize();
            if (!Files.isRegularFile(resolved) && !reference.endsWith(".json")) {
                resolved = manifest.getParent().resolve(reference + ".json").normalize();
            }
            return Files.isRegularFile(resolved) ? resolved : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText());
            }
        });
        return values;
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    private static final class CompilerPaths {
        private Path baseUrl;
        private Map<String, List<String>> paths;
        private Path pathsOwnerDir;
    }
}
