package com.phillippitts.audiogen.service.assembly;

import com.phillippitts.audiogen.domain.AudioArtifact;
import com.phillippitts.audiogen.domain.SynthesizedChunk;
import com.phillippitts.audiogen.exception.ArtifactIoException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Stages the audio of one request's chunks on disk and concatenates them into the artifact.
 *
 * <p>Each chunk is written to {@code <index>.part} inside a private temporary directory. On
 * {@link #assemble(Path, int)} the staged files are ordered by their <em>parsed numeric</em>
 * index (so {@code 2.part} precedes {@code 10.part}) and raw-appended, with no re-encoding and
 * no separators. The result is written next to the target and moved into place, so a failed
 * assembly never leaves a partial artifact behind.
 *
 * <p>An instance belongs to exactly one request and is not thread-safe for assembly; concurrent
 * {@link #write(int, byte[])} calls for distinct indexes are safe. Always use it in a
 * try-with-resources block: {@link #close()} deletes the staging directory on success and failure.
 */
public final class ChunkAssembler implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ChunkAssembler.class);
    static final String PART_SUFFIX = ".part";

    private final Path stagingDir;

    private ChunkAssembler(Path stagingDir) {
        this.stagingDir = stagingDir;
    }

    /**
     * Creates the staging directory for one request.
     *
     * @param tempParent parent directory, or null for the platform temp directory
     * @param requestId  request id, used as the directory name prefix
     */
    public static ChunkAssembler open(Path tempParent, String requestId) {
        String prefix = "audiogen-" + safePrefix(requestId) + "-";
        try {
            Path dir;
            if (tempParent == null) {
                dir = Files.createTempDirectory(prefix);
            } else {
                Files.createDirectories(tempParent);
                dir = Files.createTempDirectory(tempParent, prefix);
            }
            LOG.debug("Staging chunks in {}", dir);
            return new ChunkAssembler(dir);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to create chunk staging directory",
                    tempParent == null ? Path.of(System.getProperty("java.io.tmpdir")) : tempParent, e);
        }
    }

    public Path stagingDir() {
        return stagingDir;
    }

    /**
     * Stages the audio bytes of one chunk.
     */
    public void write(int index, byte[] audio) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        Objects.requireNonNull(audio, "audio");
        Path part = stagingDir.resolve(index + PART_SUFFIX);
        try {
            Files.write(part, audio, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to stage chunk " + index, part, e);
        }
    }

    /**
     * Stages every chunk, then assembles them into {@code output}.
     */
    public AudioArtifact assemble(List<SynthesizedChunk> chunks, Path output) {
        for (SynthesizedChunk chunk : chunks) {
            write(chunk.index(), chunk.audio());
        }
        return assemble(output, chunks.size());
    }

    /**
     * Concatenates the staged chunks, in ascending numeric index order, into {@code output}.
     *
     * @param output        final artifact path; parent directories are created
     * @param expectedCount number of chunks the request produced; indexes must be exactly 0..n-1
     * @return the written artifact
     * @throws ArtifactIoException when a chunk is missing or any file operation fails
     */
    public AudioArtifact assemble(Path output, int expectedCount) {
        List<IndexedPart> parts = listParts();
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i).index() != i) {
                throw new ArtifactIoException("Missing staged chunk " + i, stagingDir);
            }
        }
        if (parts.size() != expectedCount) {
            throw new ArtifactIoException("Expected " + expectedCount + " staged chunks but found "
                    + parts.size(), stagingDir);
        }

        Path tmp = output.resolveSibling(output.getFileName() + ".tmp");
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(tmp)) {
                for (IndexedPart part : parts) {
                    Files.copy(part.path(), out);
                }
            }
            Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
            long size = Files.size(output);
            LOG.info("Assembled {} chunks into {} ({} bytes)", parts.size(), output.getFileName(), size);
            return new AudioArtifact(output, size, parts.size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ArtifactIoException("Failed to assemble artifact", output, e);
        }
    }

    private List<IndexedPart> listParts() {
        List<IndexedPart> parts = new ArrayList<>();
        try (Stream<Path> files = Files.list(stagingDir)) {
            files.forEach(p -> {
                String name = p.getFileName().toString();
                if (!name.endsWith(PART_SUFFIX)) {
                    return;
                }
                String digits = name.substring(0, name.length() - PART_SUFFIX.length());
                try {
                    parts.add(new IndexedPart(Integer.parseInt(digits), p));
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring unexpected file in staging directory: {}", name);
                }
            });
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to list staged chunks", stagingDir, e);
        }
        // Numeric, never lexicographic: "10" must sort after "2"
        parts.sort(Comparator.comparingInt(IndexedPart::index));
        return parts;
    }

    /**
     * Deletes the staging directory and everything in it.
     */
    @Override
    public void close() {
        if (!Files.exists(stagingDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(stagingDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(ChunkAssembler::deleteQuietly);
        } catch (IOException e) {
            LOG.warn("Failed to clean up staging directory {}: {}", stagingDir, e.getMessage());
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.warn("Failed to delete {}: {}", p, e.getMessage());
        }
    }

    private static String safePrefix(String requestId) {
        if (requestId == null) {
            return "req";
        }
        String cleaned = requestId.replaceAll("[^A-Za-z0-9_-]", "_");
        return cleaned.length() > 32 ? cleaned.substring(0, 32) : cleaned;
    }

    private record IndexedPart(int index, Path path) {
    }
}
