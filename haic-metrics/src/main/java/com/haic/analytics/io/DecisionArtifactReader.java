package com.haic.analytics.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import com.haic.analytics.error.InputShapeException;
import com.haic.analytics.util.JsonSupport;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads decision artifacts (JSON object with a {@code decisions} array), bare JSON arrays and
 * JSONL files produced by the logging side.
 */
public final class DecisionArtifactReader {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(DecisionArtifactReader.class);

    private DecisionArtifactReader() {}

    public static JsonNode readJson(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return JsonSupport.MAPPER.readTree(reader);
        }
    }

    /**
     * One JSON value per line; blank lines are skipped.
     *
     * @throws InputShapeException naming the 1-based line number of the first malformed line
     */
    public static ArrayNode readJsonl(Path path) throws IOException {
        ArrayNode rows = JsonSupport.MAPPER.createArrayNode();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    rows.add(JsonSupport.MAPPER.readTree(trimmed));
                } catch (JsonProcessingException ex) {
                    throw new InputShapeException("invalid_jsonl_line",
                            "Invalid JSON on line " + lineNumber + " of " + path + ": " + ex.getOriginalMessage(), ex);
                }
            }
        }
        LOG.debug("Read {} JSONL rows from {}", rows.size(), path);
        return rows;
    }

    /**
     * Reads a JSON object that must carry a {@code decisions} array.
     */
    public static JsonNode readArtifact(Path path) throws IOException {
        JsonNode root = readJson(path);
        if (root == null || !root.isObject() || !root.path("decisions").isArray()) {
            throw new InputShapeException("missing_decisions",
                    path + " is not a decisions artifact (missing 'decisions' list)");
        }
        return root;
    }

    /**
     * Dispatches on file extension: {@code .jsonl} files become a decisions array, anything else is
     * read as a single JSON document (artifact or bare list).
     */
    public static JsonNode read(Path path) throws IOException {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".jsonl")) {
            return readJsonl(path);
        }
        return readJson(path);
    }
}
