package com.purchasingpower.codegraph.analysis.impl;

import com.purchasingpower.codegraph.analysis.ImportPathResolver;
import com.purchasingpower.codegraph.analysis.ProjectAnalysis;
import com.purchasingpower.codegraph.analysis.Stereotype;
import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityId;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.KindHint;
import com.purchasingpower.codegraph.core.Relationship;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.core.TargetRef;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.purchasingpower.codegraph.analysis.impl.SourceText.field;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.firstNamedChild;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.is;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.line;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.namedChildren;

/**
 * Extracts the entities of one parsed source file into the project's analysis.
 *
 * <p>Only top-level statements are inspected: imports, re-exports, classes and interfaces, with or
 * without {@code export}.
 */
@Slf4j
final class TypeScriptFileScanner {

    private final ProjectAnalysis analysis;
    private final ImportPathResolver importResolver;
    private final Path root;
    private final Set<String> memberPaths;
    private final Path file;
    private final String relativePath;
    private final SourceText source;
    private final Entity fileEntity;

    TypeScriptFileScanner(ProjectAnalysis analysis, ImportPathResolver importResolver, Path root,
                          Set<String> memberPaths, Path file, String relativePath, SourceText source) {
        this.analysis = analysis;
        this.importResolver = importResolver;
        this.root = root;
        this.memberPaths = memberPaths;
        this.file = file;
        this.relativePath = relativePath;
        this.source = source;
        this.fileEntity = new Entity(EntityId.file(relativePath), EntityKind.FILE);
    }

    void scan(TSNode program) {
        for (TSNode statement : namedChildren(program)) {
            switch (statement.getType()) {
                case "import_statement" -> recordImport(field(statement, "source"), false);
                case "export_statement" -> scanExport(statement);
                case "class_declaration", "abstract_class_declaration" ->
                        scanClass(statement, namedChildren(statement, "decorator"), false);
                case "interface_declaration" -> scanInterface(statement, false);
                default -> {
                }
            }
        }
        analysis.register(fileEntity);
    }

    private void scanExport(TSNode statement) {
        TSNode reexportSource = field(statement, "source");
        if (reexportSource != null) {
            recordImport(reexportSource, true);
        }
        TSNode declaration = field(statement, "declaration");
        if (declaration == null) {
            return;
        }
        switch (declaration.getType()) {
            case "class_declaration", "abstract_class_declaration" -> {
                List<TSNode> decorators = new ArrayList<>(namedChildren(statement, "decorator"));
                decorators.addAll(namedChildren(declaration, "decorator"));
                scanClass(declaration, decorators, true);
            }
            case "interface_declaration" -> scanInterface(declaration, true);
            default -> {
            }
        }
    }

    // --- imports -------------------------------------------------------------------------------

    private void recordImport(TSNode specifierNode, boolean reexport) {
        if (specifierNode == null) {
            return;
        }
        String specifier = source.unquote(specifierNode);
        if (specifier.isBlank()) {
            return;
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("from", specifier);
        if (reexport) {
            properties.put("reexport", Boolean.TRUE);
        }

        Optional<Path> resolved = importResolver.resolve(specifier, file);
        if (resolved.isPresent()) {
            Path target = resolved.get();
            if (!target.startsWith(root)) {
                log.debug("Import '{}' in {} points outside the root; ignored", specifier, relativePath);
                return;
            }
            String targetPath = relativize(root, target);
            TargetRef ref = memberPaths.contains(targetPath)
                    ? TargetRef.resolved(EntityId.file(targetPath))
                    : TargetRef.placeholder(KindHint.FILE, targetPath);
            fileEntity.addRelationship(new Relationship(RelationshipKind.IMPORTS, ref, properties));
        } else if (ImportPathResolver.isRelative(specifier)) {
            log.warn("⚠️  Unresolvable relative import '{}' in {} (line {})",
                    specifier, relativePath, line(specifierNode));
            analysis.importDropped();
        } else {
            fileEntity.addRelationship(new Relationship(RelationshipKind.IMPORTS, TargetRef.external(specifier), properties));
        }
    }

    // --- declarations --------------------------------------------------------------------------

    private void scanInterface(TSNode node, boolean exported) {
        TSNode name = field(node, "name");
        if (name == null) {
            return;
        }
        Entity entity = new Entity(EntityId.declaration(source.text(name), relativePath), EntityKind.INTERFACE);
        entity.putProperty("line", line(node));
        entity.putProperty("exported", exported);
        analysis.register(entity);
    }

    private void scanClass(TSNode node, List<TSNode> decoratorNodes, boolean exported) {
        TSNode name = field(node, "name");
        if (name == null) {
            return;
        }

        List<DecoratorUsage> decorators = new ArrayList<>();
        for (TSNode decoratorNode : decoratorNodes) {
            decorators.add(readDecorator(decoratorNode));
        }
        EntityKind kind = EntityKind.TYPE;
        for (DecoratorUsage decorator : decorators) {
            if (decorator.stereotype() != null) {
                kind = decorator.stereotype().getKind();
            }
        }

        Entity entity = new Entity(EntityId.declaration(source.text(name), relativePath), kind);
        entity.putProperty("line", line(node));
        entity.putProperty("exported", exported);
        if ("abstract_class_declaration".equals(node.getType())) {
            entity.putProperty("abstract", true);
        }
        entity.putProperty("decorators", decorators.stream().map(DecoratorUsage::name).toList());

        for (DecoratorUsage decorator : decorators) {
            if (decorator.stereotype() != null) {
                applyStereotype(entity, decorator.stereotype(), decorator.metadata());
            }
        }
        scanHeritage(entity, node);
        scanBody(entity, field(node, "body"));
        analysis.register(entity);
    }

    private DecoratorUsage readDecorator(TSNode decorator) {
        TSNode expression = firstNamedChild(decorator);
        TSNode callee = expression;
        TSNode arguments = null;
        if (is(expression, "call_expression")) {
            callee = field(expression, "function");
            arguments = field(expression, "arguments");
        }
        String calleeText = source.text(callee);
        String simpleName = calleeText.substring(calleeText.lastIndexOf('.') + 1);
        Stereotype stereotype = Stereotype.fromDecorator(calleeText).orElse(null);
        DecoratorMetadata metadata = stereotype != null
                ? DecoratorMetadata.fromArguments(arguments, source)
                : DecoratorMetadata.empty(source);
        return new DecoratorUsage(simpleName, stereotype, metadata);
    }

    private void applyStereotype(Entity entity, Stereotype stereotype, DecoratorMetadata metadata) {
        switch (stereotype) {
            case COMPONENT -> {
                entity.putProperty("selector", metadata.value("selector"));
                entity.putProperty("templateUrl", metadata.value("templateUrl"));
                entity.putProperty("styleUrls", metadata.value("styleUrls"));
                entity.putProperty("styleUrl", metadata.value("styleUrl"));
                entity.putProperty("standalone", metadata.value("standalone"));
                entity.putProperty("hasInlineTemplate", metadata.has("template"));
                placeholders(entity, metadata, "providers", RelationshipKind.PROVIDES, KindHint.SERVICE);
                for (String imported : metadata.referencedNames("imports")) {
                    addPlaceholder(entity, classifyStandaloneImport(imported), imported);
                }
            }
            case INJECTABLE -> entity.putProperty("providedIn", metadata.value("providedIn"));
            case NG_MODULE -> {
                placeholders(entity, metadata, "declarations", RelationshipKind.DECLARES, KindHint.ANY);
                placeholders(entity, metadata, "imports", RelationshipKind.IMPORTS_MODULE, KindHint.MODULE);
                placeholders(entity, metadata, "providers", RelationshipKind.PROVIDES, KindHint.SERVICE);
                placeholders(entity, metadata, "exports", RelationshipKind.EXPORTS_MODULE, KindHint.ANY);
                placeholders(entity, metadata, "bootstrap", RelationshipKind.BOOTSTRAPS, KindHint.COMPONENT);
            }
            case PIPE -> {
                entity.putProperty("pipeName", metadata.value("name"));
                entity.putProperty("pure", metadata.value("pure"));
                entity.putProperty("standalone", metadata.value("standalone"));
            }
            case DIRECTIVE -> {
                entity.putProperty("selector", metadata.value("selector"));
                entity.putProperty("exportAs", metadata.value("exportAs"));
                entity.putProperty("standalone", metadata.value("standalone"));
                placeholders(entity, metadata, "providers", RelationshipKind.PROVIDES, KindHint.SERVICE);
            }
        }
    }

    /** Records the raw list as a property and one placeholder edge per referenced name. */
    private void placeholders(Entity entity, DecoratorMetadata metadata, String key,
                              RelationshipKind relationshipKind, KindHint hint) {
        entity.putProperty(key, metadata.value(key));
        for (String name : metadata.referencedNames(key)) {
            entity.addRelationship(new Relationship(relationshipKind, TargetRef.placeholder(hint, name)));
        }
    }

    private static void addPlaceholder(Entity entity, StandaloneImport kind, String name) {
        entity.addRelationship(new Relationship(kind.relationshipKind, TargetRef.placeholder(kind.hint, name)));
    }

    private static StandaloneImport classifyStandaloneImport(String name) {
        if (name.endsWith("Pipe")) {
            return StandaloneImport.PIPE;
        }
        if (name.endsWith("Module")) {
            return StandaloneImport.MODULE;
        }
        return StandaloneImport.DIRECTIVE;
    }

    private void scanHeritage(Entity entity, TSNode classNode) {
        List<String> implemented = new ArrayList<>();
        for (TSNode heritage : namedChildren(classNode, "class_heritage")) {
            for (TSNode clause : namedChildren(heritage, "implements_clause")) {
                for (TSNode type : namedChildren(clause)) {
                    String interfaceName = baseTypeName(type);
                    implemented.add(interfaceName);
                    entity.addRelationship(new Relationship(RelationshipKind.IMPLEMENTS,
                            TargetRef.placeholder(KindHint.INTERFACE, interfaceName)));
                }
            }
        }
        entity.putProperty("implements", implemented);
    }

    private void scanBody(Entity entity, TSNode body) {
        List<String> injected = new ArrayList<>();
        for (TSNode member : namedChildren(body)) {
            if (is(member, "method_definition") && "constructor".equals(source.text(field(member, "name")))) {
                scanConstructor(entity, field(member, "parameters"), injected);
            } else if (is(member, "public_field_definition")) {
                scanFieldInjection(entity, member, injected);
            }
        }
        entity.putProperty("injectedParameters", injected);
    }

    private void scanConstructor(Entity entity, TSNode parameters, List<String> injected) {
        for (TSNode parameter : namedChildren(parameters)) {
            if (!is(parameter, "required_parameter") && !is(parameter, "optional_parameter")) {
                continue;
            }
            TSNode pattern = field(parameter, "pattern");
            TSNode typeNode = firstNamedChild(field(parameter, "type"));
            if (!is(pattern, "identifier") || typeNode == null) {
                continue;
            }
            String parameterName = source.text(pattern);
            String parameterType = source.text(typeNode);

            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("parameterName", parameterName);
            properties.put("parameterType", parameterType);
            injectToken(parameter).ifPresent(token -> properties.put("token", token));

            entity.addRelationship(new Relationship(RelationshipKind.INJECTS,
                    TargetRef.placeholder(KindHint.SERVICE, baseTypeName(typeNode)), properties));
            injected.add(parameterName + ":" + parameterType);
        }
    }

    /** Argument of an {@code @Inject(...)} parameter decorator. */
    private Optional<String> injectToken(TSNode parameter) {
        for (TSNode decorator : namedChildren(parameter, "decorator")) {
            DecoratorUsage usage = readDecorator(decorator);
            if (!"Inject".equals(usage.name())) {
                continue;
            }
            TSNode call = firstNamedChild(decorator);
            TSNode argument = firstNamedChild(field(call, "arguments"));
            if (argument != null) {
                return Optional.of(is(argument, "string") ? source.unquote(argument) : source.text(argument));
            }
        }
        return Optional.empty();
    }

    /** {@code private readonly http = inject(HttpClient);} */
    private void scanFieldInjection(Entity entity, TSNode member, List<String> injected) {
        TSNode value = field(member, "value");
        if (!is(value, "call_expression") || !"inject".equals(source.text(field(value, "function")))) {
            return;
        }
        TSNode argument = firstNamedChild(field(value, "arguments"));
        if (!is(argument, "identifier") && !is(argument, "member_expression")) {
            return;
        }
        String fieldName = source.text(field(member, "name"));
        String typeName = source.text(argument);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("parameterName", fieldName);
        properties.put("parameterType", typeName);
        properties.put("injectionStyle", "field");
        entity.addRelationship(new Relationship(RelationshipKind.INJECTS,
                TargetRef.placeholder(KindHint.SERVICE, typeName), properties));
        injected.add(fieldName + ":" + typeName);
    }

    /** {@code Repository<User>} → {@code Repository}; other type forms keep their full text. */
    private String baseTypeName(TSNode type) {
        if (is(type, "generic_type")) {
            TSNode name = field(type, "name");
            if (name != null) {
                return source.text(name);
            }
        }
        return source.text(type);
    }

    static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private record DecoratorUsage(String name, Stereotype stereotype, DecoratorMetadata metadata) {
    }

    private enum StandaloneImport {
        PIPE(RelationshipKind.USES_PIPE, KindHint.PIPE),
        MODULE(RelationshipKind.IMPORTS_MODULE, KindHint.MODULE),
        DIRECTIVE(RelationshipKind.USES_DIRECTIVE, KindHint.DIRECTIVE);

        private final RelationshipKind relationshipKind;
        private final KindHint hint;

        StandaloneImport(RelationshipKind relationshipKind, KindHint hint) {
            this.relationshipKind = relationshipKind;
            this.hint = hint;
        }
    }
}
