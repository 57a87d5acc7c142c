package com.purchasingpower.codegraph.resolution.impl;

import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityId;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.core.KindHint;
import com.purchasingpower.codegraph.core.Relationship;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.core.TargetRef;
import com.purchasingpower.codegraph.resolution.ResolutionReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Global Symbol Resolver Tests")
class GlobalSymbolResolverTest {

    private final GlobalSymbolResolver resolver = new GlobalSymbolResolver();

    @Test
    @DisplayName("Exactly one compatible candidate resolves to its identity")
    void resolve_singleCandidate() {
        // Given
        EntityRegistry registry = new EntityRegistry();
        registry.register(new Entity(EntityId.declaration("Alpha", "a/alpha.ts"), EntityKind.SERVICE));
        Entity beta = registry.register(injecting("Beta", "b/beta.ts", "Alpha"));
        registry.freeze();

        // When
        ResolutionReport report = resolver.resolve(registry);

        // Then
        assertEquals(TargetRef.resolved(EntityId.declaration("Alpha", "a/alpha.ts")), target(beta));
        assertEquals(1, report.getResolved());
    }

    @Test
    @DisplayName("Two compatible candidates resolve to Ambiguous, never to either")
    void resolve_ambiguous() {
        EntityRegistry registry = new EntityRegistry();
        registry.register(new Entity(EntityId.declaration("Logger", "a/logger.ts"), EntityKind.SERVICE));
        registry.register(new Entity(EntityId.declaration("Logger", "b/logger.ts"), EntityKind.SERVICE));
        Entity consumer = registry.register(injecting("Consumer", "c/consumer.ts", "Logger"));
        registry.freeze();

        ResolutionReport report = resolver.resolve(registry);

        assertEquals(TargetRef.ambiguous("Logger"), target(consumer));
        assertEquals("Ambiguous:Logger", target(consumer).render());
        assertEquals(1, report.getAmbiguous());
    }

    @Test
    @DisplayName("No candidate resolves to Unresolved")
    void resolve_unresolved() {
        EntityRegistry registry = new EntityRegistry();
        Entity module = registry.register(new Entity(EntityId.declaration("AppModule", "app.module.ts"), EntityKind.MODULE)
                .addRelationship(new Relationship(RelationshipKind.PROVIDES, TargetRef.placeholder(KindHint.SERVICE, "Gamma"))));
        registry.freeze();

        ResolutionReport report = resolver.resolve(registry);

        assertEquals("Unresolved:Gamma", target(module).render());
        assertEquals(1, report.getUnresolved());
    }

    @Test
    @DisplayName("Kind hints filter candidates; Any matches every declaration kind")
    void resolve_kindHints() {
        EntityRegistry registry = new EntityRegistry();
        registry.register(new Entity(EntityId.declaration("Highlight", "a/highlight.ts"), EntityKind.DIRECTIVE));
        registry.register(new Entity(EntityId.declaration("Highlight", "b/highlight.ts"), EntityKind.TYPE));
        Entity module = registry.register(new Entity(EntityId.declaration("M", "m.ts"), EntityKind.MODULE)
                .addRelationship(new Relationship(RelationshipKind.DECLARES, TargetRef.placeholder(KindHint.ANY, "Highlight")))
                .addRelationship(new Relationship(RelationshipKind.PROVIDES, TargetRef.placeholder(KindHint.SERVICE, "Highlight"))));
        Entity component = registry.register(new Entity(EntityId.declaration("C", "c.ts"), EntityKind.COMPONENT)
                .addRelationship(new Relationship(RelationshipKind.USES_DIRECTIVE, TargetRef.placeholder(KindHint.DIRECTIVE, "Highlight"))));
        registry.freeze();

        resolver.resolve(registry);

        List<Relationship> moduleEdges = module.getRelationships();
        assertEquals(TargetRef.ambiguous("Highlight"), moduleEdges.get(0).getTarget());
        assertEquals(TargetRef.unresolved("Highlight"), moduleEdges.get(1).getTarget());
        assertEquals(TargetRef.resolved(EntityId.declaration("Highlight", "a/highlight.ts")), target(component));
    }

    @Test
    @DisplayName("File placeholders resolve by path")
    void resolve_filePlaceholder() {
        EntityRegistry registry = new EntityRegistry();
        registry.register(new Entity(EntityId.file("libs/a/index.ts"), EntityKind.FILE));
        Entity importer = registry.register(new Entity(EntityId.file("apps/b/main.ts"), EntityKind.FILE)
                .addRelationship(new Relationship(RelationshipKind.IMPORTS, TargetRef.placeholder(KindHint.FILE, "libs/a/index.ts")))
                .addRelationship(new Relationship(RelationshipKind.IMPORTS, TargetRef.placeholder(KindHint.FILE, "libs/a/gone.ts")))
                .addRelationship(new Relationship(RelationshipKind.IMPORTS, TargetRef.external("rxjs"))));
        registry.freeze();

        ResolutionReport report = resolver.resolve(registry);

        assertEquals(TargetRef.resolved(EntityId.file("libs/a/index.ts")), importer.getRelationships().get(0).getTarget());
        assertEquals(TargetRef.unresolved("libs/a/gone.ts"), importer.getRelationships().get(1).getTarget());
        assertEquals(TargetRef.external("rxjs"), importer.getRelationships().get(2).getTarget());
        assertEquals(1, report.getUntouched());
    }

    @Test
    @DisplayName("Registration order does not change resolved targets")
    void resolve_orderIndependent() {
        EntityRegistry forward = new EntityRegistry();
        forward.register(new Entity(EntityId.declaration("Alpha", "a.ts"), EntityKind.SERVICE));
        Entity betaForward = forward.register(injecting("Beta", "b.ts", "Alpha"));
        forward.freeze();

        EntityRegistry reversed = new EntityRegistry();
        Entity betaReversed = reversed.register(injecting("Beta", "b.ts", "Alpha"));
        reversed.register(new Entity(EntityId.declaration("Alpha", "a.ts"), EntityKind.SERVICE));
        reversed.freeze();

        resolver.resolve(forward);
        resolver.resolve(reversed);

        assertEquals(target(betaForward), target(betaReversed));
        assertTrue(target(betaReversed).isResolved());
    }

    @Test
    @DisplayName("An import recorded once resolved and once as a file placeholder collapses to one edge")
    void resolve_collapsesEdgesThatBecomeIdentical() {
        // Given: the same shared file scanned by its owning project and by a second project
        EntityRegistry registry = new EntityRegistry();
        registry.register(new Entity(EntityId.file("shared/y.ts"), EntityKind.FILE));
        Map<String, Object> from = Map.of("from", "./y");
        registry.register(new Entity(EntityId.file("shared/x.ts"), EntityKind.FILE)
                .addRelationship(new Relationship(RelationshipKind.IMPORTS,
                        TargetRef.resolved(EntityId.file("shared/y.ts")), from)));
        Entity shared = registry.register(new Entity(EntityId.file("shared/x.ts"), EntityKind.FILE)
                .addRelationship(new Relationship(RelationshipKind.IMPORTS,
                        TargetRef.placeholder(KindHint.FILE, "shared/y.ts"), from)));
        registry.freeze();
        assertEquals(2, shared.getRelationships().size());

        // When
        ResolutionReport report = resolver.resolve(registry);

        // Then
        assertEquals(1, shared.getRelationships().size());
        assertEquals("File:shared/y.ts", target(shared).render());
        assertEquals(1, report.getDuplicatesRemoved());
        assertEquals(1, registry.relationshipCount());
    }

    @Test
    @DisplayName("Refuses a registry that is not frozen")
    void resolve_requiresFrozenRegistry() {
        assertThrows(IllegalStateException.class, () -> resolver.resolve(new EntityRegistry()));
    }

    private static Entity injecting(String name, String path, String dependency) {
        return new Entity(EntityId.declaration(name, path), EntityKind.SERVICE)
                .addRelationship(new Relationship(RelationshipKind.INJECTS,
                        TargetRef.placeholder(KindHint.SERVICE, dependency)));
    }

    private static TargetRef target(Entity entity) {
        return entity.getRelationships().get(0).getTarget();
    }
}
