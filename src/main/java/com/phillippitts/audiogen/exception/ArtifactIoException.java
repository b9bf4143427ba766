package com.phillippitts.audiogen.exception;

import java.nio.file.Path;

/**
 * Thrown when reading or writing chunk files, the final artifact, or the provenance log fails.
 */
public class ArtifactIoException extends AudioGenException {

    private final Path path;

    public ArtifactIoException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public ArtifactIoException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
