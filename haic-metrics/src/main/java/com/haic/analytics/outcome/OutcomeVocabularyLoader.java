package com.haic.analytics.outcome;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads the outcome label vocabulary from filesystem or classpath.
 *
 * Lookup order:
 * 1) JVM property `haic.outcome.vocabulary.path`
 * 2) classpath resource `/reference/outcome_vocabulary.v1.json`
 */
public final class OutcomeVocabularyLoader {
    public static final String VOCABULARY_PROPERTY = "haic.outcome.vocabulary.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/outcome_vocabulary.v1.json";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(OutcomeVocabularyLoader.class);

    private static volatile OutcomeVocabulary cachedDefault;

    private OutcomeVocabularyLoader() {}

    /**
     * Default vocabulary, loaded once per JVM.
     */
    public static OutcomeVocabulary loadDefault() {
        OutcomeVocabulary vocabulary = cachedDefault;
        if (vocabulary == null) {
            synchronized (OutcomeVocabularyLoader.class) {
                vocabulary = cachedDefault;
                if (vocabulary == null) {
                    vocabulary = resolveDefault();
                    cachedDefault = vocabulary;
                }
            }
        }
        return vocabulary;
    }

    static OutcomeVocabulary resolveDefault() {
        String overridePath = System.getProperty(VOCABULARY_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }
        OutcomeVocabulary fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath == null) {
            throw new IllegalStateException("Outcome vocabulary resource not found: " + DEFAULT_CLASSPATH_RESOURCE);
        }
        return fromClasspath;
    }

    static OutcomeVocabulary loadFromClasspath(String resourcePath) {
        try (InputStream in = OutcomeVocabularyLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            JsonNode root = JsonSupport.MAPPER.readTree(in);
            return parseVocabulary(root);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load outcome vocabulary from classpath: " + resourcePath, ex);
        }
    }

    public static OutcomeVocabulary loadFromFile(Path path) {
        try {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Outcome vocabulary file not found: " + path);
            }
            JsonNode root = JsonSupport.MAPPER.readTree(path.toFile());
            OutcomeVocabulary vocabulary = parseVocabulary(root);
            LOG.info("Loaded outcome vocabulary version={} from {}", vocabulary.version(), path);
            return vocabulary;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load outcome vocabulary from file: " + path, ex);
        }
    }

    private static OutcomeVocabulary parseVocabulary(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Outcome vocabulary is not a JSON object");
        }
        JsonNode positive = root.path("positive");
        JsonNode negative = root.path("negative");
        if (!positive.isArray() || !negative.isArray()) {
            throw new IllegalStateException("Outcome vocabulary missing positive/negative arrays");
        }
        return new OutcomeVocabulary(
                root.path("vocabulary_version").asText("unknown"),
                textSet(positive),
                textSet(negative),
                textSet(root.path("correct_tokens")),
                textSet(root.path("incorrect_tokens")));
    }

    private static Set<String> textSet(JsonNode array) {
        Set<String> out = new LinkedHashSet<>();
        if (array.isArray()) {
            for (JsonNode entry : array) {
                if (entry.isTextual()) {
                    out.add(entry.asText());
                }
            }
        }
        return out;
    }
}
