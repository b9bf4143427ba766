package com.phillippitts.audiogen.service.assembly;

import com.phillippitts.audiogen.domain.AudioFormat;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Names artifacts {@code <12-char id>_<speaker>.<ext>}.
 *
 * <p>The id is random per artifact, so re-running the same request never overwrites an
 * earlier artifact. Characters outside {@code [A-Za-z0-9_-]} in the speaker are replaced
 * with {@code _}.
 */
@Component
public class ArtifactNamer {

    static final int ID_LENGTH = 12;

    private final Supplier<String> idSupplier;

    public ArtifactNamer() {
        this(() -> UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH));
    }

    public ArtifactNamer(Supplier<String> idSupplier) {
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier");
    }

    public String fileName(String speaker, AudioFormat format) {
        Objects.requireNonNull(format, "format");
        return idSupplier.get() + "_" + sanitize(speaker) + "." + format.extension();
    }

    public Path resolve(Path outputDir, String speaker, AudioFormat format) {
        return outputDir.resolve(fileName(speaker, format));
    }

    static String sanitize(String speaker) {
        if (speaker == null || speaker.isBlank()) {
            return "unknown";
        }
        return speaker.trim().replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
