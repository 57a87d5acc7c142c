package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.core.Entity;
import com.purchasingpower.codegraph.core.EntityRegistry;
import com.purchasingpower.codegraph.discovery.ProjectManifest;
import lombok.Getter;

import java.util.Collection;

/**
 * Partial result of analyzing one project, merged into the global registry once the project is done.
 *
 * @since 1.0.0
 */
@Getter
public class ProjectAnalysis {

    private final ProjectManifest manifest;
    private final EntityRegistry localRegistry = new EntityRegistry();
    private int filesAnalyzed;
    private int filesFailed;
    private int filesWithSyntaxErrors;
    private int droppedImports;

    public ProjectAnalysis(ProjectManifest manifest) {
        this.manifest = manifest;
    }

    public Entity register(Entity entity) {
        return localRegistry.register(entity);
    }

    public Collection<Entity> getEntities() {
        return localRegistry.getEntities();
    }

    public void fileAnalyzed() {
        filesAnalyzed++;
    }

    public void fileFailed() {
        filesFailed++;
    }

    public void fileHadSyntaxErrors() {
        filesWithSyntaxErrors++;
    }

    public void importDropped() {
        droppedImports++;
    }
}
