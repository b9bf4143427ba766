package com.phillippitts.audiogen.service.provenance;

import com.phillippitts.audiogen.config.properties.PipelineProperties;
import com.phillippitts.audiogen.domain.ProvenanceRecord;
import com.phillippitts.audiogen.exception.ArtifactIoException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only CSV log mapping each produced artifact to its source text.
 *
 * <p>Format: UTF-8, {@code \r\n} line endings, columns {@code Filename,Text}. Fields containing
 * a comma, quote or line break are quoted and inner quotes doubled, so multi-line texts
 * survive a round trip. The header is written once: when the file is missing or empty.
 *
 * <p>Existing content is never rewritten or truncated. {@link #append(Path, String)} is
 * synchronized, so one instance can be shared by concurrent requests.
 */
@Component
public class ProvenanceLog {

    private static final Logger LOG = LogManager.getLogger(ProvenanceLog.class);

    static final String HEADER_FILENAME = "Filename";
    static final String HEADER_TEXT = "Text";
    private static final String EOL = "\r\n";

    private final Path file;

    @Autowired
    public ProvenanceLog(PipelineProperties props) {
        this(props.provenancePath());
    }

    public ProvenanceLog(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    /**
     * Appends one record, writing the header first if the log does not exist yet.
     *
     * @param artifact path of a successfully assembled artifact
     * @param text     source text the artifact was rendered from
     * @throws ArtifactIoException if the log cannot be written
     */
    public synchronized void append(Path artifact, String text) {
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(text, "text");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean needsHeader = !Files.exists(file) || Files.size(file) == 0;
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                if (needsHeader) {
                    writeRow(w, HEADER_FILENAME, HEADER_TEXT);
                }
                writeRow(w, artifact.toString(), text);
            }
            LOG.debug("Provenance recorded for {}", artifact.getFileName());
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to append provenance record", file, e);
        }
    }

    /**
     * Reads every data row (header excluded). Returns an empty list when the log does not exist.
     */
    public synchronized List<ProvenanceRecord> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to read provenance log", file, e);
        }
        List<List<String>> rows = parse(content);
        List<ProvenanceRecord> records = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (i == 0 && row.size() == 2 && HEADER_FILENAME.equals(row.get(0)) && HEADER_TEXT.equals(row.get(1))) {
                continue;
            }
            if (row.size() != 2) {
                throw new ArtifactIoException("Malformed provenance row " + (i + 1)
                        + " (expected 2 fields, got " + row.size() + ")", file);
            }
            records.add(new ProvenanceRecord(row.get(0), row.get(1)));
        }
        return List.copyOf(records);
    }

    private static void writeRow(BufferedWriter w, String filename, String text) throws IOException {
        w.write(quote(filename));
        w.write(',');
        w.write(quote(text));
        w.write(EOL);
    }

    static String quote(String field) {
        boolean needsQuotes = field.indexOf(',') >= 0 || field.indexOf('"') >= 0
                || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    static List<List<String>> parse(String content) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean rowHasData = false;
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < content.length() && content.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
                rowHasData = true;
            } else if (c == ',') {
                row.add(field.toString());
                field.setLength(0);
                rowHasData = true;
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                    i++;
                }
                if (rowHasData || field.length() > 0) {
                    row.add(field.toString());
                    rows.add(row);
                }
                row = new ArrayList<>();
                field.setLength(0);
                rowHasData = false;
            } else {
                field.append(c);
                rowHasData = true;
            }
            i++;
        }
        if (rowHasData || field.length() > 0) {
            row.add(field.toString());
            rows.add(row);
        }
        return rows;
    }
}
