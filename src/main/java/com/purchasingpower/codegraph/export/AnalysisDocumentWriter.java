package com.purchasingpower.codegraph.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.core.Relationship;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the analysis document, pretty printed.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class AnalysisDocumentWriter {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public AnalysisDocument toDocument(EntityRegistry registry, Path root) {
        List<AnalysisDocument.Node> nodes = new ArrayList<>(registry.size());
        for (Entity entity : registry.getEntities()) {
            List<AnalysisDocument.Edge> edges = new ArrayList<>(entity.getRelationships().size());
            for (Relationship relationship : entity.getRelationships()) {
                edges.add(new AnalysisDocument.Edge(
                        relationship.getKind().getGraphType(),
                        relationship.getTarget().render(),
                        relationship.getTarget().state().name(),
                        relationship.getProperties()));
            }
            nodes.add(new AnalysisDocument.Node(
                    entity.getKey(),
                    entity.getKind().getLabel(),
                    entity.getName(),
                    entity.getFilePath(),
                    entity.getProperties(),
                    edges));
        }
        return new AnalysisDocument(root.toString(), Instant.now(), nodes);
    }

    /**
     * @throws IOException if the document cannot be written; parent directories are created
     */
    public void write(EntityRegistry registry, Path root, Path output) throws IOException {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.FILESYSTEM, "WriteAnalysisDocument", log);
        ctx.logRequest("Writing " + registry.size() + " node(s)", "output", output);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(output.toFile(), toDocument(registry, root));
            ctx.logResponse("Document written", "bytes", Files.size(output));
        } catch (IOException e) {
            ctx.logError("Cannot write " + output, e);
            throw e;
        }
    }
}
