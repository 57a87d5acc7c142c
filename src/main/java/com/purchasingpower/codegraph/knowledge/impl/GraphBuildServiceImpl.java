package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.analysis.ProjectAnalysis;
import com.purchasingpower.codegraph.analysis.SourceAnalyzer;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.discovery.ProjectDiscoverer;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.export.AnalysisDocumentWriter;
import com.purchasingpower.codegraph.knowledge.GraphBuildRequest;
import com.purchasingpower.codegraph.knowledge.GraphBuildResult;
import com.purchasingpower.codegraph.knowledge.GraphBuildService;
import com.purchasingpower.codegraph.knowledge.GraphLoader;
import com.purchasingpower.codegraph.knowledge.LoadResult;
import com.purchasingpower.codegraph.resolution.ResolutionReport;
import com.purchasingpower.codegraph.resolution.SymbolResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default GraphBuildService.
 *
 * <p>Projects are analyzed on the analysis executor into private registries. The calling thread
 * merges them into the global registry in manifest order, so identity lookups are never
 * concurrent. The resolver runs once after every project finished; the loader after the resolver.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class GraphBuildServiceImpl implements GraphBuildService {

    private final ProjectDiscoverer projectDiscoverer;
    private final SourceAnalyzer sourceAnalyzer;
    private final SymbolResolver symbolResolver;
    private final GraphLoader graphLoader;
    private final AnalysisDocumentWriter documentWriter;
    private final Executor analysisExecutor;

    public GraphBuildServiceImpl(ProjectDiscoverer projectDiscoverer,
                                 SourceAnalyzer sourceAnalyzer,
                                 SymbolResolver symbolResolver,
                                 GraphLoader graphLoader,
                                 AnalysisDocumentWriter documentWriter,
                                 @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.projectDiscoverer = projectDiscoverer;
        this.sourceAnalyzer = sourceAnalyzer;
        this.symbolResolver = symbolResolver;
        this.graphLoader = graphLoader;
        this.documentWriter = documentWriter;
        this.analysisExecutor = analysisExecutor;
    }

    @Override
    public GraphBuildResult build(GraphBuildRequest request) {
        long startTime = System.currentTimeMillis();
        Path root = request.getRoot().toAbsolutePath().normalize();
        log.info("Starting graph build for {}", root);

        List<ProjectManifest> manifests;
        try {
            manifests = projectDiscoverer.discover(root);
        } catch (RuntimeException e) {
            log.error("❌ Discovery failed for {}: {}", root, e.getMessage(), e);
            return GraphBuildResultImpl.failure("Discovery failed: " + e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }

        List<String> errors = new ArrayList<>();
        EntityRegistry registry = new EntityRegistry();
        int analyzed = analyzeProjects(manifests, root, registry, errors);
        registry.freeze();

        ResolutionReport resolution = symbolResolver.resolve(registry);
        boolean success = true;

        if (request.getOutput() != null) {
            try {
                documentWriter.write(registry, root, request.getOutput());
                log.info("📄 Analysis document written to {}", request.getOutput());
            } catch (IOException e) {
                log.error("❌ Cannot write analysis document {}: {}", request.getOutput(), e.getMessage());
                errors.add("Cannot write analysis document: " + e.getMessage());
                success = false;
            }
        }

        LoadResult loadResult = null;
        if (request.isLoad()) {
            try {
                loadResult = graphLoader.load(registry, repositoryName(request, root));
                errors.addAll(loadResult.getErrors());
            } catch (GraphStoreException e) {
                log.error("❌ Graph load aborted: {}", e.getMessage());
                errors.add("Graph load aborted: " + e.getMessage());
                success = false;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        GraphBuildResultImpl result = GraphBuildResultImpl.builder()
                .success(success)
                .projectsDiscovered(manifests.size())
                .projectsAnalyzed(analyzed)
                .projectsFailed(manifests.size() - analyzed)
                .entityCount(registry.size())
                .relationshipCount(registry.relationshipCount())
                .resolution(resolution)
                .loadResult(loadResult)
                .registry(registry)
                .errors(errors)
                .durationMs(duration)
                .build();

        log.info("{} Graph build finished in {}ms: {} project(s), {} entities, {} relationships, {} unresolved, {} ambiguous",
                success ? "✅" : "❌", duration, analyzed, result.getEntityCount(), result.getRelationshipCount(),
                resolution.getUnresolved(), resolution.getAmbiguous());
        return result;
    }

    private int analyzeProjects(List<ProjectManifest> manifests, Path root, EntityRegistry registry,
                                List<String> errors) {
        List<CompletableFuture<ProjectAnalysis>> futures = new ArrayList<>(manifests.size());
        for (ProjectManifest manifest : manifests) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> sourceAnalyzer.analyze(manifest, root), analysisExecutor));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }

        int analyzed = 0;
        for (int i = 0; i < manifests.size(); i++) {
            ProjectManifest manifest = manifests.get(i);
            try {
                ProjectAnalysis analysis = futures.get(i).join();
                registry.registerAll(analysis.getEntities());
                analyzed++;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("❌ Project {} aborted: {}", manifest.displayName(root), cause.getMessage(), cause);
                errors.add("Project " + manifest.displayName(root) + " aborted: " + cause.getMessage());
            }
        }
        return analyzed;
    }

    private static String repositoryName(GraphBuildRequest request, Path root) {
        if (request.getRepositoryName() != null && !request.getRepositoryName().isBlank()) {
            return request.getRepositoryName();
        }
        return root.getFileName() != null ? root.getFileName().toString() : root.toString();
    }
}
