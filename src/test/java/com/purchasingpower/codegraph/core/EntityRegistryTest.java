package com.purchasingpower.codegraph.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entity Registry Tests")
class EntityRegistryTest {

    private EntityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EntityRegistry();
    }

    @Test
    @DisplayName("Same identity registered twice yields one entity")
    void register_sameIdentityTwice_keepsOneEntity() {
        // Given
        EntityId id = EntityId.declaration("Alpha", "libs/a/alpha.service.ts");

        // When
        Entity first = registry.register(new Entity(id, EntityKind.TYPE));
        Entity second = registry.register(new Entity(id, EntityKind.TYPE));

        // Then
        assertSame(first, second);
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("A Type later recognized as Component is refined, not duplicated")
    void register_refinesKind() {
        EntityId id = EntityId.declaration("AppComponent", "src/app.component.ts");

        registry.register(new Entity(id, EntityKind.TYPE).putProperty("line", 3));
        registry.register(new Entity(id, EntityKind.COMPONENT).putProperty("selector", "app-root"));

        Entity entity = registry.find(id).orElseThrow();
        assertEquals(EntityKind.COMPONENT, entity.getKind());
        assertEquals("3", entity.getProperties().get("line"));
        assertEquals("app-root", entity.getProperties().get("selector"));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("A less specific rediscovery never downgrades the kind")
    void register_lessSpecificKind_keepsSpecific() {
        EntityId id = EntityId.declaration("Alpha", "a.ts");

        registry.register(new Entity(id, EntityKind.SERVICE));
        registry.register(new Entity(id, EntityKind.TYPE));

        assertEquals(EntityKind.SERVICE, registry.find(id).orElseThrow().getKind());
    }

    @Test
    @DisplayName("Empty values never overwrite known properties")
    void register_emptyValues_doNotOverwrite() {
        EntityId id = EntityId.declaration("Alpha", "a.ts");

        registry.register(new Entity(id, EntityKind.SERVICE).putProperty("providedIn", "root"));
        registry.register(new Entity(id, EntityKind.SERVICE)
                .putProperty("providedIn", "")
                .putProperty("decorators", List.of()));

        Map<String, Object> properties = registry.find(id).orElseThrow().getProperties();
        assertEquals("root", properties.get("providedIn"));
        assertFalse(properties.containsKey("decorators"));
    }

    @Test
    @DisplayName("Identical relationships are appended once")
    void register_duplicateRelationship_appendedOnce() {
        EntityId id = EntityId.declaration("Beta", "b.ts");
        Relationship injects = new Relationship(RelationshipKind.INJECTS,
                TargetRef.placeholder(KindHint.SERVICE, "Alpha"), Map.of("parameterName", "alpha"));

        registry.register(new Entity(id, EntityKind.SERVICE).addRelationship(injects));
        registry.register(new Entity(id, EntityKind.SERVICE).addRelationship(
                new Relationship(RelationshipKind.INJECTS, TargetRef.placeholder(KindHint.SERVICE, "Alpha"),
                        Map.of("parameterName", "alpha"))));
        registry.register(new Entity(id, EntityKind.SERVICE).addRelationship(
                new Relationship(RelationshipKind.INJECTS, TargetRef.placeholder(KindHint.SERVICE, "Alpha"),
                        Map.of("parameterName", "other"))));

        assertEquals(2, registry.find(id).orElseThrow().getRelationships().size());
        assertEquals(2, registry.relationshipCount());
    }

    @Test
    @DisplayName("Class and interface of the same name in one file share an identity")
    void register_classAndInterfaceSameName_shareIdentity() {
        registry.register(new Entity(EntityId.declaration("Store", "store.ts"), EntityKind.INTERFACE));
        registry.register(new Entity(EntityId.declaration("Store", "store.ts"), EntityKind.SERVICE));

        assertEquals(1, registry.size());
        assertEquals(EntityKind.SERVICE, registry.find("Type:Store:store.ts").orElseThrow().getKind());
    }

    @Test
    @DisplayName("Frozen registry rejects registration")
    void freeze_rejectsRegistration() {
        registry.register(new Entity(EntityId.file("a.ts"), EntityKind.FILE));
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class,
                () -> registry.register(new Entity(EntityId.file("b.ts"), EntityKind.FILE)));
    }

    @Test
    @DisplayName("Keys follow the File and Type families")
    void entityId_keys() {
        assertEquals("File:apps/shop/src/main.ts", EntityId.file("apps/shop/src/main.ts").key());
        assertEquals("main.ts", EntityId.file("apps/shop/src/main.ts").name());
        assertEquals("Type:Alpha:a.ts", EntityId.declaration("Alpha", "a.ts").key());
    }

    @Test
    @DisplayName("Targets render their resolution state")
    void targetRef_render() {
        assertEquals("Type:Alpha:a.ts", TargetRef.resolved(EntityId.declaration("Alpha", "a.ts")).render());
        assertEquals("Placeholder:Service:Alpha", TargetRef.placeholder(KindHint.SERVICE, "Alpha").render());
        assertEquals("Unresolved:Gamma", TargetRef.unresolved("Gamma").render());
        assertEquals("Ambiguous:X", TargetRef.ambiguous("X").render());
        assertEquals("External:@angular/core", TargetRef.external("@angular/core").render());
    }

    @Test
    @DisplayName("Directive hint accepts components, Any hint rejects files")
    void kindHint_accepts() {
        assertTrue(KindHint.DIRECTIVE.accepts(EntityKind.COMPONENT));
        assertTrue(KindHint.DIRECTIVE.accepts(EntityKind.DIRECTIVE));
        assertFalse(KindHint.COMPONENT.accepts(EntityKind.DIRECTIVE));
        assertTrue(KindHint.ANY.accepts(EntityKind.PIPE));
        assertFalse(KindHint.ANY.accepts(EntityKind.FILE));
        assertFalse(KindHint.SERVICE.accepts(EntityKind.TYPE));
    }
}
