package com.haic.analytics.time;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.error.TimeFormatException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Converts epoch numbers and ISO-8601 strings to epoch seconds.
 *
 * <p>Accepted text forms:
 * - {@code 2026-01-31T12:00:00Z} (UTC)
 * - {@code 2026-01-31T12:00:00+02:00} or {@code 2026-01-31T12:00:00+0200} (offset-aware)
 * - {@code 2026-01-31T12:00:00} or {@code 2026-01-31} (naive, assumed UTC with a note)
 * </p>
 */
public final class TimeParser {
    public static final String NAIVE_UTC_NOTE = "Naive ISO datetime provided; assuming UTC.";

    /** Epoch values above this are taken to be milliseconds by the lenient path. */
    static final double EPOCH_MILLIS_THRESHOLD = 1e12;

    // Offsets without a colon, e.g. +0200 or +02.
    private static final DateTimeFormatter COMPACT_OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HHmm", "Z")
            .toFormatter(Locale.ROOT);

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d.*");

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(TimeParser.class);

    private TimeParser() {}

    /**
     * Strict parse used for window bounds. Numbers are epoch seconds as given.
     *
     * @param notes optional sink for diagnostics such as the naive-UTC assumption
     * @throws TimeFormatException for unsupported types or unparseable strings
     */
    public static double parse(JsonNode value, List<String> notes) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            throw new TimeFormatException("missing_time", "Time value is missing");
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (!value.isTextual()) {
            throw new TimeFormatException("unsupported_time_type",
                    "Unsupported time value type: " + value.getNodeType());
        }
        return parseIso(value.asText(), notes);
    }

    /**
     * Parses an ISO-8601 string to epoch seconds.
     */
    public static double parseIso(String raw, List<String> notes) {
        if (raw == null) {
            throw new TimeFormatException("missing_time", "Time value is missing");
        }
        String trimmed = raw.trim();
        final String text = SPACE_SEPARATED.matcher(trimmed).matches()
                ? trimmed.substring(0, 10) + "T" + trimmed.substring(11)
                : trimmed;

        OffsetDateTime aware = tryParse(() -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        if (aware == null) {
            aware = tryParse(() -> OffsetDateTime.parse(text, COMPACT_OFFSET_DATE_TIME));
        }
        if (aware != null) {
            return toEpochSeconds(aware.toInstant());
        }
        LocalDateTime naive = tryParse(() -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        if (naive != null) {
            noteNaive(notes);
            return toEpochSeconds(naive.toInstant(ZoneOffset.UTC));
        }
        LocalDate date = tryParse(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
        if (date != null) {
            noteNaive(notes);
            return toEpochSeconds(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        throw new TimeFormatException("unparseable_time", "Invalid ISO datetime: '" + raw + "'");
    }

    /**
     * Lenient parse used while normalizing records: numbers above {@value #EPOCH_MILLIS_THRESHOLD}
     * are read as epoch milliseconds and anything unparseable yields null.
     */
    public static Double tryParseInstant(JsonNode value, List<String> notes) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            double raw = value.asDouble();
            if (!Double.isFinite(raw)) {
                return null;
            }
            return raw > EPOCH_MILLIS_THRESHOLD ? raw / 1000.0 : raw;
        }
        if (!value.isTextual()) {
            return null;
        }
        try {
            return parseIso(value.asText(), notes);
        } catch (TimeFormatException ex) {
            LOG.debug("Ignoring unparseable record timestamp {}", value.asText());
            return null;
        }
    }

    static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    private static <T> T tryParse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static void noteNaive(List<String> notes) {
        if (notes != null && !notes.contains(NAIVE_UTC_NOTE)) {
            notes.add(NAIVE_UTC_NOTE);
        }
    }
}
