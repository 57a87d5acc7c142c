package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Analysis of one project failed as a whole. Only that project is abandoned.
 */
@Getter
public class ProjectAnalysisException extends RuntimeException {

    private final Path manifestPath;

    public ProjectAnalysisException(Path manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }
}
