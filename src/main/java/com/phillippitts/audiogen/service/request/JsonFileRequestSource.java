package com.phillippitts.audiogen.service.request;

import com.phillippitts.audiogen.domain.SynthesisRequest;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads requests from a JSON array of {@code {"id": ..., "speaker": ..., "text": ...}} objects.
 *
 * <p>{@code id} may be a string or a number. Any malformed entry rejects the whole file: a
 * half-loaded catalog would silently skip work.
 */
public class JsonFileRequestSource implements RequestSource {

    private static final Logger LOG = LogManager.getLogger(JsonFileRequestSource.class);
    private static final String SETTING = "audiogen.pipeline.requests-file";

    private final Path file;

    public JsonFileRequestSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<SynthesisRequest> load() {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidConfigException(SETTING, "cannot read " + file, e);
        }

        try {
            JSONArray array = new JSONArray(content);
            List<SynthesisRequest> requests = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                JSONObject entry = array.getJSONObject(i);
                String id = String.valueOf(entry.get("id"));
                String speaker = entry.getString("speaker");
                String text = entry.getString("text");
                if (speaker.isBlank()) {
                    throw new InvalidConfigException(SETTING, "entry " + i + " has a blank speaker");
                }
                requests.add(new SynthesisRequest(id, speaker, text));
            }
            LOG.info("Loaded {} requests from {}", requests.size(), file);
            return List.copyOf(requests);
        } catch (JSONException e) {
            throw new InvalidConfigException(SETTING, "malformed request catalog " + file + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "file " + file;
    }
}
