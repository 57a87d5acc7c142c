package com.purchasingpower.codegraph.analysis.impl;

import com.purchasingpower.codegraph.analysis.ProjectAnalysis;
import com.purchasingpower.codegraph.analysis.SourceFileCollector;
import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityId;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.KindHint;
import com.purchasingpower.codegraph.core.Relationship;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.core.TargetRef;
import com.purchasingpower.codegraph.discovery.ManifestReader;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.purchasingpower.codegraph.support.TestFiles.write;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TypeScript Source Analyzer Tests")
class TypeScriptSourceAnalyzerTest {

    @TempDir
    Path tempDir;

    private Path root;
    private TypeScriptSourceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        root = tempDir.toAbsolutePath().normalize();
        analyzer = new TypeScriptSourceAnalyzer(
                new SourceFileCollector(List.of(".ts"), List.of("node_modules")), List.of(".ts"));

        write(root, "apps/shop/tsconfig.json", """
                {
                  "compilerOptions": { "baseUrl": ".", "paths": { "@lib/*": ["../../libs/shared/src/*"] } },
                  "include": ["src/**/*.ts"]
                }
                """);
        write(root, "libs/shared/src/alpha.service.ts", """
                import { Injectable } from '@angular/core';

                @Injectable({ providedIn: 'root' })
                export class Alpha {}
                """);
    }

    @Test
    @DisplayName("Registers every member file with a root-relative identity")
    void analyze_registersFiles() {
        write(root, "apps/shop/src/main.ts", "console.log('hi');\n");
        write(root, "apps/shop/src/app/empty.ts", "");

        ProjectAnalysis analysis = analyze();

        assertTrue(analysis.getLocalRegistry().find("File:apps/shop/src/main.ts").isPresent());
        assertTrue(analysis.getLocalRegistry().find("File:apps/shop/src/app/empty.ts").isPresent());
        assertEquals(2, analysis.getFilesAnalyzed());
    }

    @Test
    @DisplayName("Imports resolve to project files, cross-project file placeholders or external markers")
    void analyze_imports() {
        // Given
        write(root, "apps/shop/src/beta.service.ts", """
                import { Injectable } from '@angular/core';
                import { Alpha } from '@lib/alpha.service';
                import { helper } from './util';
                import { gone } from './missing';
                export * from './util';

                @Injectable()
                export class Beta {
                  constructor(private readonly alpha: Alpha) {}
                }
                """);
        write(root, "apps/shop/src/util.ts", "export const helper = 1;\n");

        // When
        ProjectAnalysis analysis = analyze();

        // Then
        Entity file = entity(analysis, "File:apps/shop/src/beta.service.ts");
        List<Relationship> imports = file.getRelationships();
        assertTrue(imports.stream().allMatch(r -> r.getKind() == RelationshipKind.IMPORTS));

        assertTrue(hasTarget(imports, TargetRef.external("@angular/core")));
        assertTrue(hasTarget(imports, TargetRef.placeholder(KindHint.FILE, "libs/shared/src/alpha.service.ts")));
        Relationship local = imports.stream()
                .filter(r -> r.getTarget().equals(TargetRef.resolved(EntityId.file("apps/shop/src/util.ts"))))
                .filter(r -> !r.getProperties().containsKey("reexport"))
                .findFirst()
                .orElseThrow(() -> new AssertionError("Local import should resolve directly"));
        assertEquals("./util", local.getProperties().get("from"));
        assertTrue(imports.stream().anyMatch(r -> Boolean.TRUE.equals(r.getProperties().get("reexport"))));
        assertEquals(1, analysis.getDroppedImports(), "Unresolvable relative import is dropped");
    }

    @Test
    @DisplayName("Constructor parameters and inject() fields emit Injects placeholders")
    void analyze_injection() {
        write(root, "apps/shop/src/beta.service.ts", """
                import { Inject, Injectable, inject } from '@angular/core';

                @Injectable({ providedIn: 'root' })
                export class Beta {
                  private readonly http = inject(HttpClient);

                  constructor(private alpha: Alpha, @Inject(API_URL) private url: string, repo?: Repository<User>) {}
                }
                """);

        Entity beta = entity(analyze(), "Type:Beta:apps/shop/src/beta.service.ts");

        assertEquals(EntityKind.SERVICE, beta.getKind());
        assertEquals("root", beta.getProperties().get("providedIn"));

        Relationship alpha = injects(beta, "alpha");
        assertEquals(TargetRef.placeholder(KindHint.SERVICE, "Alpha"), alpha.getTarget());
        assertEquals("Alpha", alpha.getProperties().get("parameterType"));

        Relationship url = injects(beta, "url");
        assertEquals("API_URL", url.getProperties().get("token"));
        assertEquals("string", url.getProperties().get("parameterType"));

        Relationship repo = injects(beta, "repo");
        assertEquals(TargetRef.placeholder(KindHint.SERVICE, "Repository"), repo.getTarget());
        assertEquals("Repository<User>", repo.getProperties().get("parameterType"));

        Relationship http = injects(beta, "http");
        assertEquals("field", http.getProperties().get("injectionStyle"));
        assertEquals(TargetRef.placeholder(KindHint.SERVICE, "HttpClient"), http.getTarget());

        // field initializers precede the constructor in the class body
        assertEquals(List.of("http:HttpClient", "alpha:Alpha", "url:string", "repo:Repository<User>"),
                beta.getProperties().get("injectedParameters"));
    }

    @Test
    @DisplayName("NgModule lists become properties and placeholder edges")
    void analyze_ngModule() {
        write(root, "apps/shop/src/app.module.ts", """
                import { NgModule } from '@angular/core';

                @NgModule({
                  declarations: [AppComponent, HighlightDirective],
                  imports: [BrowserModule, RouterModule.forRoot(routes)],
                  providers: [Gamma, { provide: Logger, useClass: ConsoleLogger }, { provide: API_URL, useValue: '/api' }],
                  exports: [HighlightDirective],
                  bootstrap: [AppComponent]
                })
                export class AppModule {}
                """);

        Entity module = entity(analyze(), "Type:AppModule:apps/shop/src/app.module.ts");

        assertEquals(EntityKind.MODULE, module.getKind());
        assertEquals(List.of("AppComponent", "HighlightDirective"), module.getProperties().get("declarations"));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.DECLARES, TargetRef.placeholder(KindHint.ANY, "AppComponent")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.IMPORTS_MODULE, TargetRef.placeholder(KindHint.MODULE, "BrowserModule")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.IMPORTS_MODULE, TargetRef.placeholder(KindHint.MODULE, "RouterModule")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.PROVIDES, TargetRef.placeholder(KindHint.SERVICE, "Gamma")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.PROVIDES, TargetRef.placeholder(KindHint.SERVICE, "ConsoleLogger")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.PROVIDES, TargetRef.placeholder(KindHint.SERVICE, "API_URL")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.EXPORTS_MODULE, TargetRef.placeholder(KindHint.ANY, "HighlightDirective")));
        assertTrue(hasTarget(module.getRelationships(), RelationshipKind.BOOTSTRAPS, TargetRef.placeholder(KindHint.COMPONENT, "AppComponent")));
    }

    @Test
    @DisplayName("Standalone component metadata and imports are classified by name")
    void analyze_standaloneComponent() {
        write(root, "apps/shop/src/app.component.ts", """
                import { Component } from '@angular/core';

                @Component({
                  selector: 'app-root',
                  standalone: true,
                  imports: [CommonModule, CurrencyPipe, HighlightDirective],
                  templateUrl: './app.component.html',
                  styleUrls: ['./app.component.css'],
                  changeDetection: ChangeDetectionStrategy.OnPush,
                  animations: [trigger('fade', [])],
                  providers: [CartService]
                })
                export class AppComponent implements OnInit, Store<State> {}
                """);

        Entity component = entity(analyze(), "Type:AppComponent:apps/shop/src/app.component.ts");

        assertEquals(EntityKind.COMPONENT, component.getKind());
        assertEquals("app-root", component.getProperties().get("selector"));
        assertEquals(Boolean.TRUE, component.getProperties().get("standalone"));
        assertEquals("./app.component.html", component.getProperties().get("templateUrl"));
        assertEquals(List.of("./app.component.css"), component.getProperties().get("styleUrls"));
        assertEquals(Boolean.FALSE, component.getProperties().get("hasInlineTemplate"));
        assertEquals(List.of("Component"), component.getProperties().get("decorators"));

        List<Relationship> edges = component.getRelationships();
        assertTrue(hasTarget(edges, RelationshipKind.IMPORTS_MODULE, TargetRef.placeholder(KindHint.MODULE, "CommonModule")));
        assertTrue(hasTarget(edges, RelationshipKind.USES_PIPE, TargetRef.placeholder(KindHint.PIPE, "CurrencyPipe")));
        assertTrue(hasTarget(edges, RelationshipKind.USES_DIRECTIVE, TargetRef.placeholder(KindHint.DIRECTIVE, "HighlightDirective")));
        assertTrue(hasTarget(edges, RelationshipKind.PROVIDES, TargetRef.placeholder(KindHint.SERVICE, "CartService")));
        assertTrue(hasTarget(edges, RelationshipKind.IMPLEMENTS, TargetRef.placeholder(KindHint.INTERFACE, "OnInit")));
        assertTrue(hasTarget(edges, RelationshipKind.IMPLEMENTS, TargetRef.placeholder(KindHint.INTERFACE, "Store")));
    }

    @Test
    @DisplayName("Pipes, directives, interfaces and plain classes get their kinds")
    void analyze_otherKinds() {
        write(root, "apps/shop/src/kinds.ts", """
                @Pipe({ name: 'price', pure: false, standalone: true })
                export class PricePipe {}

                @Directive({ selector: '[appHighlight]', exportAs: 'highlight' })
                export class HighlightDirective {}

                export interface State { count: number; }

                @Logged()
                class Plain {}

                export abstract class Base {}
                """);

        ProjectAnalysis analysis = analyze();

        Entity pipe = entity(analysis, "Type:PricePipe:apps/shop/src/kinds.ts");
        assertEquals(EntityKind.PIPE, pipe.getKind());
        assertEquals("price", pipe.getProperties().get("pipeName"));
        assertEquals(Boolean.FALSE, pipe.getProperties().get("pure"));

        Entity directive = entity(analysis, "Type:HighlightDirective:apps/shop/src/kinds.ts");
        assertEquals(EntityKind.DIRECTIVE, directive.getKind());
        assertEquals("[appHighlight]", directive.getProperties().get("selector"));
        assertEquals("highlight", directive.getProperties().get("exportAs"));

        assertEquals(EntityKind.INTERFACE, entity(analysis, "Type:State:apps/shop/src/kinds.ts").getKind());

        Entity plain = entity(analysis, "Type:Plain:apps/shop/src/kinds.ts");
        assertEquals(EntityKind.TYPE, plain.getKind());
        assertEquals(List.of("Logged"), plain.getProperties().get("decorators"));

        assertEquals(Boolean.TRUE, entity(analysis, "Type:Base:apps/shop/src/kinds.ts").getProperties().get("abstract"));
    }

    @Test
    @DisplayName("Non-literal metadata is kept as a complex value marker")
    void analyze_complexValue() {
        write(root, "apps/shop/src/dynamic.component.ts", """
                @Component({ selector: `app-${suffix}`, template: '<p>hi</p>', standalone: isStandalone() })
                export class DynamicComponent {}
                """);

        Entity component = entity(analyze(), "Type:DynamicComponent:apps/shop/src/dynamic.component.ts");

        assertEquals("[Complex Value: template_string]", component.getProperties().get("selector"));
        assertEquals("[Complex Value: call_expression]", component.getProperties().get("standalone"));
        assertEquals(Boolean.TRUE, component.getProperties().get("hasInlineTemplate"));
    }

    @Test
    @DisplayName("Syntax errors do not abort the file")
    void analyze_syntaxErrorRecovers() {
        write(root, "apps/shop/src/broken.ts", """
                @Injectable()
                export class Survivor {}

                export class Broken {
                  method( {
                }
                """);

        ProjectAnalysis analysis = analyze();

        assertEquals(1, analysis.getFilesWithSyntaxErrors());
        assertTrue(analysis.getLocalRegistry().find("File:apps/shop/src/broken.ts").isPresent());
        assertTrue(analysis.getLocalRegistry().find("Type:Survivor:apps/shop/src/broken.ts").isPresent());
    }

    private ProjectAnalysis analyze() {
        ProjectManifest manifest = new ManifestReader().read(root.resolve("apps/shop/tsconfig.json"));
        return analyzer.analyze(manifest, root);
    }

    private static Entity entity(ProjectAnalysis analysis, String key) {
        return analysis.getLocalRegistry().find(key)
                .orElseThrow(() -> new AssertionError("Missing entity " + key));
    }

    private static Relationship injects(Entity entity, String parameterName) {
        return entity.getRelationships().stream()
                .filter(r -> r.getKind() == RelationshipKind.INJECTS)
                .filter(r -> parameterName.equals(r.getProperties().get("parameterName")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No Injects edge for " + parameterName));
    }

    private static boolean hasTarget(List<Relationship> relationships, TargetRef target) {
        return relationships.stream().anyMatch(r -> r.getTarget().equals(target));
    }

    private static boolean hasTarget(List<Relationship> relationships, RelationshipKind kind, TargetRef target) {
        return relationships.stream().anyMatch(r -> r.getKind() == kind && r.getTarget().equals(target));
    }
}
