package com.phillippitts.audiogen.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Final audio file for one request: the chunks' bytes appended in ascending index order.
 *
 * @param path       location of the artifact
 * @param sizeBytes  total size of the artifact
 * @param chunkCount number of chunks combined into it
 */
public record AudioArtifact(Path path, long sizeBytes, int chunkCount) {

    public AudioArtifact {
        Objects.requireNonNull(path, "Artifact path must not be null");
    }
}
