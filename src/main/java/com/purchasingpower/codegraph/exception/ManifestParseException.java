package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A project manifest could not be read or parsed. Discovery skips the manifest and continues.
 */
@Getter
public class ManifestParseException extends RuntimeException {

    private final Path manifestPath;

    public ManifestParseException(Path manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }

    public ManifestParseException(Path manifestPath, String message) {
        this(manifestPath, message, null);
    }
}
