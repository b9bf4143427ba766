package com.phillippitts.audiogen.domain;

import java.util.Objects;

/**
 * One row of the provenance log: which source text an artifact was rendered from.
 */
public record ProvenanceRecord(String filename, String text) {

    public ProvenanceRecord {
        Objects.requireNonNull(filename, "Filename must not be null");
        Objects.requireNonNull(text, "Text must not be null");
    }
}
