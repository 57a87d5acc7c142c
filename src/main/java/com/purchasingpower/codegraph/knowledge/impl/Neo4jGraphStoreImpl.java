package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.knowledge.GraphEdgeRecord;
import com.purchasingpower.codegraph.knowledge.GraphNodeRecord;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.GraphWriteSummary;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.summary.SummaryCounters;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Neo4j implementation of GraphStore.
 *
 * <p>Every node carries the common {@code Entity} label, one kind label and a unique {@code key}.
 * Batches are written with {@code UNWIND ... MERGE} in a single write transaction each.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Neo4jGraphStoreImpl implements GraphStore {

    static final String REPOSITORY_LABEL = "Repository";

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Driver driver;

    @Override
    public void verifyConnectivity() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "VerifyConnectivity", log);
        ctx.logRequest("Checking Bolt connectivity");
        try {
            driver.verifyConnectivity();
            ctx.logResponse("Connected");
        } catch (RuntimeException e) {
            ctx.logError("Neo4j is not reachable", e);
            throw new GraphStoreUnavailableException("Neo4j is not reachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureSchema() {
        try (Session session = driver.session()) {
            session.run("CREATE CONSTRAINT entity_key IF NOT EXISTS FOR (e:Entity) REQUIRE e.key IS UNIQUE");
            session.run("CREATE INDEX entity_name IF NOT EXISTS FOR (e:Entity) ON (e.name)");
            session.run("CREATE INDEX entity_file_path IF NOT EXISTS FOR (e:Entity) ON (e.filePath)");
            log.info("✅ Neo4j constraint and indexes ensured");
        } catch (ServiceUnavailableException | SessionExpiredException | AuthenticationException e) {
            throw translate("Neo4j is not reachable: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            log.warn("⚠️  Failed to create constraint/indexes: {}", e.getMessage());
        }
    }

    @Override
    public int clear() {
        String cypher = """
            MATCH (n:Entity)
            CALL { WITH n DETACH DELETE n } IN TRANSACTIONS OF 10000 ROWS
            """;

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "ClearGraph", log);
        ctx.logRequest("Deleting all Entity nodes");
        int deleted = execute(ctx, "Failed to clear graph", () -> {
            try (Session session = driver.session()) {
                // CALL IN TRANSACTIONS needs an auto-commit transaction
                Result result = session.run(cypher);
                return result.consume().counters().nodesDeleted();
            }
        });
        ctx.logResponse("Graph cleared", "nodesDeleted", deleted);
        return deleted;
    }

    @Override
    public GraphWriteSummary mergeNodes(String label, List<GraphNodeRecord> nodes) {
        if (nodes.isEmpty()) {
            return GraphWriteSummary.EMPTY;
        }
        requireSafe(label);

        Set<String> staleLabels = new LinkedHashSet<>();
        for (EntityKind kind : EntityKind.values()) {
            staleLabels.add(kind.getLabel());
        }
        staleLabels.add(REPOSITORY_LABEL);
        staleLabels.remove(label);

        String cypher = """
            UNWIND $rows AS row
            MERGE (n:Entity {key: row.key})
            SET n = row.properties
            REMOVE n:%s
            SET n:%s
            """.formatted(String.join(":", staleLabels), label);

        List<Map<String, Object>> rows = new ArrayList<>(nodes.size());
        for (GraphNodeRecord node : nodes) {
            Map<String, Object> properties = new HashMap<>(node.properties());
            properties.put("key", node.key());
            rows.add(createParams("key", node.key(), "properties", properties));
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "MergeNodes:" + label, log);
        ctx.logRequest("Merging " + rows.size() + " node(s)",
                "keys", ExternalCallLogger.preview(nodes.stream().map(GraphNodeRecord::key).toList(), 3));
        GraphWriteSummary summary = execute(ctx, "Failed to merge " + label + " nodes", () -> {
            try (Session session = driver.session()) {
                return session.executeWrite(tx -> {
                    SummaryCounters counters = tx.run(cypher, createParams("rows", rows)).consume().counters();
                    return new GraphWriteSummary(rows.size(), counters.nodesCreated());
                });
            }
        });
        ctx.logResponse("Nodes merged", "written", summary.written(), "created", summary.created());
        return summary;
    }

    @Override
    public GraphWriteSummary mergeEdges(String type, List<GraphEdgeRecord> edges) {
        if (edges.isEmpty()) {
            return GraphWriteSummary.EMPTY;
        }
        requireSafe(type);

        String cypher = """
            UNWIND $rows AS row
            MATCH (a:Entity {key: row.fromKey})
            MATCH (b:Entity {key: row.toKey})
            MERGE (a)-[r:%s]->(b)
            SET r = row.properties
            RETURN count(r) AS merged
            """.formatted(type);

        List<Map<String, Object>> rows = new ArrayList<>(edges.size());
        for (GraphEdgeRecord edge : edges) {
            rows.add(createParams(
                "fromKey", edge.fromKey(),
                "toKey", edge.toKey(),
                "properties", edge.properties()
            ));
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "MergeEdges:" + type, log);
        ctx.logRequest("Merging " + rows.size() + " edge(s)");
        GraphWriteSummary summary = execute(ctx, "Failed to merge " + type + " edges", () -> {
            try (Session session = driver.session()) {
                return session.executeWrite(tx -> {
                    Result result = tx.run(cypher, createParams("rows", rows));
                    int merged = result.single().get("merged").asInt();
                    int created = result.consume().counters().relationshipsCreated();
                    return new GraphWriteSummary(merged, created);
                });
            }
        });
        if (summary.written() < rows.size()) {
            log.warn("⚠️  {} of {} {} edge(s) had no endpoint node", rows.size() - summary.written(), rows.size(), type);
        }
        ctx.logResponse("Edges merged", "written", summary.written(), "created", summary.created());
        return summary;
    }

    private <T> T execute(CallContext ctx, String errorMessage, Supplier<T> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            ctx.logError(errorMessage + ": " + e.getMessage(), e);
            throw translate(errorMessage + ": " + e.getMessage(), e);
        }
    }

    private static GraphStoreException translate(String message, RuntimeException e) {
        if (e instanceof GraphStoreException graphStoreException) {
            return graphStoreException;
        }
        if (e instanceof ServiceUnavailableException
                || e instanceof SessionExpiredException
                || e instanceof AuthenticationException) {
            return new GraphStoreUnavailableException(message, e);
        }
        return new GraphStoreException(message, e);
    }

    private static void requireSafe(String identifier) {
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsafe label or relationship type: " + identifier);
        }
    }

    /**
     * Helper to create parameter maps that allow null values (Map.of() does not).
     */
    private Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            params.put(key, value);
        }
        return params;
    }
}
