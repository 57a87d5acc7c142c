package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.LoaderProperties;
import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityId;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.core.Relationship;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.core.TargetRef;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.knowledge.GraphEdgeRecord;
import com.purchasingpower.codegraph.knowledge.GraphLoader;
import com.purchasingpower.codegraph.knowledge.GraphNodeRecord;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.GraphWriteSummary;
import com.purchasingpower.codegraph.knowledge.LoadResult;
import com.purchasingpower.codegraph.knowledge.SkipReason;
import com.purchasingpower.codegraph.knowledge.SkippedEdge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the registry in two non-interleaved phases.
 *
 * <p>Phase 1: the Repository node, every entity node, then every ownership edge
 * ({@code File -DEFINED_IN-> Repository}, {@code declaration -DEFINED_IN-> File}). Phase 2: every
 * dependency edge whose endpoints were written in phase 1. A dependency edge never reaches the
 * store before the ownership chain of its target exists.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class TwoPhaseGraphLoader implements GraphLoader {

    private final GraphStore graphStore;
    private final int batchSize;
    private final boolean clearBeforeLoad;

    @Autowired
    public TwoPhaseGraphLoader(GraphStore graphStore, AppProperties properties) {
        this(graphStore, properties.getLoader());
    }

    public TwoPhaseGraphLoader(GraphStore graphStore, LoaderProperties loader) {
        this.graphStore = graphStore;
        this.batchSize = loader.getBatchSize();
        this.clearBeforeLoad = loader.isClearBeforeLoad();
    }

    public static String repositoryKey(String repositoryName) {
        return Neo4jGraphStoreImpl.REPOSITORY_LABEL + ":" + repositoryName;
    }

    @Override
    public LoadResult load(EntityRegistry registry, String repositoryName) {
        long startTime = System.currentTimeMillis();
        LoadProgress progress = new LoadProgress();

        graphStore.verifyConnectivity();
        if (clearBeforeLoad) {
            int deleted = graphStore.clear();
            log.info("Cleared {} node(s) before load", deleted);
        }
        graphStore.ensureSchema();

        log.info("Phase 1: {} node(s) and their ownership edges", registry.size() + 1);
        writeNodes(registry, repositoryName, progress);
        writeOwnershipEdges(registry, repositoryName, progress);
        log.info("Phase 1 complete: {} node(s) written, {} ownership edge(s)",
                progress.nodesWritten, progress.ownershipEdgesWritten);

        writeDependencyEdges(registry, progress);
        log.info("Phase 2 complete: {} dependency edge(s) written, {} skipped {}",
                progress.dependencyEdgesWritten, progress.skippedEdges.size(), progress.skippedByReason);

        return LoadResultImpl.builder()
                .nodesWritten(progress.nodesWritten)
                .nodesCreated(progress.nodesCreated)
                .nodesFailed(progress.nodesFailed)
                .ownershipEdgesWritten(progress.ownershipEdgesWritten)
                .dependencyEdgesWritten(progress.dependencyEdgesWritten)
                .dependencyEdgesCreated(progress.dependencyEdgesCreated)
                .skippedByReason(progress.skippedByReason)
                .skippedEdges(progress.skippedEdges)
                .errors(progress.errors)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
    }

    // =========================================================================
    // Phase 1
    // =========================================================================

    private void writeNodes(EntityRegistry registry, String repositoryName, LoadProgress progress) {
        Map<String, List<GraphNodeRecord>> byLabel = new LinkedHashMap<>();
        String repositoryKey = repositoryKey(repositoryName);
        Map<String, Object> repositoryProperties = new LinkedHashMap<>();
        repositoryProperties.put("name", repositoryName);
        repositoryProperties.put("kind", Neo4jGraphStoreImpl.REPOSITORY_LABEL);
        byLabel.computeIfAbsent(Neo4jGraphStoreImpl.REPOSITORY_LABEL, label -> new ArrayList<>())
                .add(new GraphNodeRecord(repositoryKey, Neo4jGraphStoreImpl.REPOSITORY_LABEL, repositoryProperties));

        for (Entity entity : registry.getEntities()) {
            String label = entity.getKind().getLabel();
            byLabel.computeIfAbsent(label, l -> new ArrayList<>())
                    .add(new GraphNodeRecord(entity.getKey(), label, nodeProperties(entity)));
        }

        for (Map.Entry<String, List<GraphNodeRecord>> entry : byLabel.entrySet()) {
            for (List<GraphNodeRecord> batch : partition(entry.getValue())) {
                try {
                    GraphWriteSummary summary = graphStore.mergeNodes(entry.getKey(), batch);
                    progress.nodesWritten += summary.written();
                    progress.nodesCreated += summary.created();
                    batch.forEach(node -> progress.writtenKeys.add(node.key()));
                } catch (GraphStoreUnavailableException e) {
                    throw e;
                } catch (GraphStoreException e) {
                    log.error("❌ Node batch of {} {} node(s) failed: {}", batch.size(), entry.getKey(), e.getMessage());
                    progress.nodesFailed += batch.size();
                    progress.errors.add(e.getMessage());
                }
            }
        }
    }

    private void writeOwnershipEdges(EntityRegistry registry, String repositoryName, LoadProgress progress) {
        String repositoryKey = repositoryKey(repositoryName);
        String type = RelationshipKind.DEFINED_IN.getGraphType();
        List<GraphEdgeRecord> edges = new ArrayList<>();

        for (Entity entity : registry.getEntities()) {
            String ownerKey = entity.getId().isFile()
                    ? repositoryKey
                    : EntityId.file(entity.getFilePath()).key();
            if (!progress.writtenKeys.contains(entity.getKey()) || !progress.writtenKeys.contains(ownerKey)) {
                log.warn("⚠️  Ownership edge {} -> {} skipped: endpoint not written", entity.getKey(), ownerKey);
                progress.skip(new SkippedEdge(entity.getKey(), type, ownerKey, SkipReason.MISSING_ENDPOINT));
                continue;
            }
            edges.add(new GraphEdgeRecord(entity.getKey(), ownerKey, type, Map.of()));
        }

        for (List<GraphEdgeRecord> batch : partition(edges)) {
            try {
                progress.ownershipEdgesWritten += graphStore.mergeEdges(type, batch).written();
            } catch (GraphStoreUnavailableException e) {
                throw e;
            } catch (GraphStoreException e) {
                log.error("❌ Ownership batch of {} edge(s) failed: {}", batch.size(), e.getMessage());
                progress.errors.add(e.getMessage());
                batch.forEach(edge -> progress.skip(
                        new SkippedEdge(edge.fromKey(), type, edge.toKey(), SkipReason.STORE_ERROR)));
            }
        }
    }

    // =========================================================================
    // Phase 2
    // =========================================================================

    private void writeDependencyEdges(EntityRegistry registry, LoadProgress progress) {
        Map<String, List<GraphEdgeRecord>> byType = new LinkedHashMap<>();

        for (Entity entity : registry.getEntities()) {
            for (Relationship relationship : entity.getRelationships()) {
                if (relationship.getKind().isOwnership()) {
                    continue;
                }
                String type = relationship.getKind().getGraphType();
                TargetRef target = relationship.getTarget();
                SkipReason reason = skipReasonFor(target);
                if (reason == null
                        && !(progress.writtenKeys.contains(entity.getKey())
                        && progress.writtenKeys.contains(target.value()))) {
                    reason = SkipReason.MISSING_ENDPOINT;
                }
                if (reason != null) {
                    SkippedEdge skipped = new SkippedEdge(entity.getKey(), type, target.render(), reason);
                    if (reason.isRoutine()) {
                        log.debug("Skipping {} {} -> {} ({})", type, entity.getKey(), target.render(), reason);
                    } else {
                        log.warn("⚠️  Skipping {} {} -> {} ({})", type, entity.getKey(), target.render(), reason);
                    }
                    progress.skip(skipped);
                    continue;
                }
                byType.computeIfAbsent(type, t -> new ArrayList<>())
                        .add(new GraphEdgeRecord(entity.getKey(), target.value(), type, relationship.getProperties()));
            }
        }

        for (Map.Entry<String, List<GraphEdgeRecord>> entry : byType.entrySet()) {
            for (List<GraphEdgeRecord> batch : partition(entry.getValue())) {
                try {
                    GraphWriteSummary summary = graphStore.mergeEdges(entry.getKey(), batch);
                    progress.dependencyEdgesWritten += summary.written();
                    progress.dependencyEdgesCreated += summary.created();
                } catch (GraphStoreUnavailableException e) {
                    throw e;
                } catch (GraphStoreException e) {
                    log.error("❌ {} batch of {} edge(s) failed: {}", entry.getKey(), batch.size(), e.getMessage());
                    progress.errors.add(e.getMessage());
                    batch.forEach(edge -> progress.skip(
                            new SkippedEdge(edge.fromKey(), edge.type(), edge.toKey(), SkipReason.STORE_ERROR)));
                }
            }
        }
    }

    private static SkipReason skipReasonFor(TargetRef target) {
        return switch (target.state()) {
            case RESOLVED -> null;
            case UNRESOLVED -> SkipReason.UNRESOLVED;
            case AMBIGUOUS -> SkipReason.AMBIGUOUS;
            case EXTERNAL -> SkipReason.EXTERNAL;
            case PLACEHOLDER -> SkipReason.PENDING_PLACEHOLDER;
        };
    }

    private static Map<String, Object> nodeProperties(Entity entity) {
        Map<String, Object> properties = new LinkedHashMap<>(entity.getProperties());
        properties.put("name", entity.getName());
        properties.put("filePath", entity.getFilePath());
        properties.put("kind", entity.getKind().getLabel());
        return properties;
    }

    private <T> List<List<T>> partition(List<T> items) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            batches.add(items.subList(i, Math.min(items.size(), i + batchSize)));
        }
        return batches;
    }

    private static final class LoadProgress {
        private final Set<String> writtenKeys = new HashSet<>();
        private final Map<SkipReason, Integer> skippedByReason = new EnumMap<>(SkipReason.class);
        private final List<SkippedEdge> skippedEdges = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private int nodesWritten;
        private int nodesCreated;
        private int nodesFailed;
        private int ownershipEdgesWritten;
        private int dependencyEdgesWritten;
        private int dependencyEdgesCreated;

        private void skip(SkippedEdge edge) {
            skippedEdges.add(edge);
            skippedByReason.merge(edge.reason(), 1, Integer::sum);
        }
    }
}
