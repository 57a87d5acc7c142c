package com.purchasingpower.codegraph.runner;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.knowledge.GraphBuildRequest;
import com.purchasingpower.codegraph.knowledge.GraphBuildResult;
import com.purchasingpower.codegraph.knowledge.GraphBuildService;
import com.purchasingpower.codegraph.knowledge.LoadResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 *   --root=&lt;dir&gt;            source tree to analyze (or codegraph.root)
 *   --output=&lt;file&gt;         write the analysis document (or codegraph.output)
 *   --repository-name=&lt;n&gt;  name of the Repository node
 *   --no-load               skip loading into Neo4j
 * </pre>
 *
 * Exit codes: 0 success, 1 failed build, 2 missing or invalid root.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "codegraph.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GraphBuildRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_BUILD_FAILED = 1;
    static final int EXIT_BAD_ROOT = 2;

    private final GraphBuildService graphBuildService;
    private final AppProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        String rootArg = option(args, "root", properties.getRoot());
        if (rootArg == null || rootArg.isBlank()) {
            log.error("❌ No source root given. Use --root=<dir> or set codegraph.root");
            exitCode = EXIT_BAD_ROOT;
            return;
        }
        Path root = Path.of(rootArg);
        if (!Files.isDirectory(root)) {
            log.error("❌ Source root {} is not a directory", root.toAbsolutePath());
            exitCode = EXIT_BAD_ROOT;
            return;
        }

        String output = option(args, "output", properties.getOutput());
        GraphBuildRequest request = GraphBuildRequest.builder()
                .root(root)
                .repositoryName(option(args, "repository-name", properties.getRepositoryName()))
                .output(output == null || output.isBlank() ? null : Path.of(output))
                .load(properties.isLoad() && !args.containsOption("no-load"))
                .build();

        GraphBuildResult result = graphBuildService.build(request);
        report(result);
        exitCode = result.isSuccess() ? EXIT_OK : EXIT_BUILD_FAILED;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void report(GraphBuildResult result) {
        log.info("=== Code graph build summary ===");
        log.info("Projects:      {} discovered, {} analyzed, {} failed",
                result.getProjectsDiscovered(), result.getProjectsAnalyzed(), result.getProjectsFailed());
        log.info("Entities:      {}", result.getEntityCount());
        log.info("Relationships: {}", result.getRelationshipCount());
        if (result.getResolution() != null) {
            log.info("Placeholders:  {} resolved, {} unresolved, {} ambiguous",
                    result.getResolution().getResolved(), result.getResolution().getUnresolved(),
                    result.getResolution().getAmbiguous());
        }
        LoadResult load = result.getLoadResult();
        if (load != null) {
            log.info("Nodes:         {} written ({} created, {} failed)",
                    load.getNodesWritten(), load.getNodesCreated(), load.getNodesFailed());
            log.info("Edges:         {} ownership, {} dependency ({} created)",
                    load.getOwnershipEdgesWritten(), load.getDependencyEdgesWritten(), load.getDependencyEdgesCreated());
            log.info("Skipped edges: {} {}", load.getSkippedEdgeCount(), load.getSkippedByReason());
        }
        for (String error : result.getErrors()) {
            log.warn("⚠️  {}", error);
        }
        log.info("Duration:      {}ms", result.getDurationMs());
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values != null && !values.isEmpty()) {
            return values.get(values.size() - 1);
        }
        return fallback;
    }
}
