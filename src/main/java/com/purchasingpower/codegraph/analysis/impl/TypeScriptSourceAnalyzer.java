package com.purchasingpower.codegraph.analysis.impl;

import com.purchasingpower.codegraph.analysis.ImportPathResolver;
import com.purchasingpower.codegraph.analysis.ProjectAnalysis;
import com.purchasingpower.codegraph.analysis.SourceAnalyzer;
import com.purchasingpower.codegraph.analysis.SourceFileCollector;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityId;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import com.purchasingpower.codegraph.exception.ProjectAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TypeScript analyzer backed by the tree-sitter TypeScript grammar.
 *
 * <p>Every member file is registered as a File entity before any file is scanned, so imports
 * between files of the same project resolve directly regardless of scan order. Imports of files
 * owned by other projects become file placeholders for the resolver.
 *
 * <p>A tree-sitter parser is not thread-safe; each call creates its own.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class TypeScriptSourceAnalyzer implements SourceAnalyzer {

    private final SourceFileCollector fileCollector;
    private final List<String> sourceExtensions;

    @Autowired
    public TypeScriptSourceAnalyzer(SourceFileCollector fileCollector, AppProperties properties) {
        this(fileCollector, properties.getAnalysis().getSourceExtensions());
    }

    public TypeScriptSourceAnalyzer(SourceFileCollector fileCollector, List<String> sourceExtensions) {
        this.fileCollector = fileCollector;
        this.sourceExtensions = List.copyOf(sourceExtensions);
    }

    @Override
    public ProjectAnalysis analyze(ProjectManifest manifest, Path root) {
        long startTime = System.currentTimeMillis();
        Path normalizedRoot = root.toAbsolutePath().normalize();
        String projectName = manifest.displayName(normalizedRoot);

        List<Path> files;
        try {
            files = fileCollector.collect(manifest, normalizedRoot);
        } catch (IOException | UncheckedIOException e) {
            throw new ProjectAnalysisException(manifest.getManifestPath(),
                    "Cannot list member files of " + projectName, e);
        }
        log.info("Analyzing {} ({} files)", projectName, files.size());

        TSParser parser = createParser(manifest);
        ProjectAnalysis analysis = new ProjectAnalysis(manifest);

        Map<Path, String> relativePaths = new LinkedHashMap<>();
        for (Path file : files) {
            String relativePath = TypeScriptFileScanner.relativize(normalizedRoot, file);
            relativePaths.put(file, relativePath);
            analysis.register(new Entity(EntityId.file(relativePath), EntityKind.FILE)
                    .putProperty("project", projectName));
        }
        Set<String> memberPaths = Set.copyOf(relativePaths.values());
        ImportPathResolver importResolver = new ImportPathResolver(manifest, normalizedRoot, sourceExtensions);

        for (Map.Entry<Path, String> entry : relativePaths.entrySet()) {
            Path file = entry.getKey();
            String relativePath = entry.getValue();

            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("⚠️  Cannot read {}: {}", relativePath, e.getMessage());
                analysis.fileFailed();
                continue;
            }

            TSTree tree = parser.parseString(null, content);
            if (tree == null) {
                log.warn("⚠️  Parser produced no tree for {}", relativePath);
                analysis.fileFailed();
                continue;
            }
            TSNode program = tree.getRootNode();
            if (program.hasError()) {
                log.warn("⚠️  Syntax errors in {}; extracting recognized declarations only", relativePath);
                analysis.fileHadSyntaxErrors();
            }

            try {
                new TypeScriptFileScanner(analysis, importResolver, normalizedRoot, memberPaths,
                        file, relativePath, new SourceText(content)).scan(program);
                analysis.fileAnalyzed();
            } catch (RuntimeException e) {
                log.warn("⚠️  Extraction failed for {}: {}", relativePath, e.getMessage());
                log.debug("Extraction failure details", e);
                analysis.fileFailed();
            }
        }

        log.info("✅ Analyzed {}: {} entities from {} files ({} failed, {} with syntax errors, {} imports dropped) in {}ms",
                projectName, analysis.getLocalRegistry().size(), analysis.getFilesAnalyzed(),
                analysis.getFilesFailed(), analysis.getFilesWithSyntaxErrors(), analysis.getDroppedImports(),
                System.currentTimeMillis() - startTime);
        return analysis;
    }

    private TSParser createParser(ProjectManifest manifest) {
        try {
            TSParser parser = new TSParser();
            if (!parser.setLanguage(new TreeSitterTypescript())) {
                throw new ProjectAnalysisException(manifest.getManifestPath(),
                        "TypeScript grammar rejected by tree-sitter", null);
            }
            return parser;
        } catch (LinkageError e) {
            throw new ProjectAnalysisException(manifest.getManifestPath(),
                    "tree-sitter native library could not be loaded", e);
        }
    }
}
