package org.alphaminer.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import org.alphaminer.exceptions.TimestampParseException;

/**
 * Utility class for parsing and formatting event timestamps.
 * All accepted formats are normalised to an {@link Instant}; date-times without an offset are taken as UTC.
 */
public class TimeStampUtils {

    public static final DateTimeFormatter STANDARD_TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final DateTimeFormatter STANDARD_MILLIS_TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    public static final DateTimeFormatter COMPACT_TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    // Tried in order; the first one that parses wins
    private static final List<Function<String, Instant>> PARSERS = Arrays.asList(
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDateTime.parse(value, STANDARD_TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC),
        value -> LocalDateTime.parse(value, STANDARD_MILLIS_TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC),
        value -> LocalDateTime.parse(value, COMPACT_TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC));

    private TimeStampUtils() {
    }

    /**
     * Parse an event timestamp.
     *
     * Accepted, in order of preference:
     *   ISO-8601 with offset   2024-01-05T10:15:30+01:00, 2024-01-05T10:15:30Z
     *   ISO-8601 local         2024-01-05T10:15:30
     *   standard               2024-01-05 10:15:30 (optionally .SSS)
     *   compact                20240105101530
     *   date only              2024-01-05
     *   epoch milliseconds     1704449730000
     *
     * @param raw       the raw field value
     * @param rowNumber data row the value came from, for error context
     */
    public static Instant parseTimestamp(String raw, long rowNumber) throws TimestampParseException {
        if (raw == null || raw.trim().isEmpty()) {
            throw new TimestampParseException("Empty timestamp", raw, rowNumber);
        }
        String value = raw.trim();

        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }

        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new TimestampParseException("Epoch value out of range", raw, rowNumber, e);
            }
        }
        throw new TimestampParseException("Unrecognised timestamp format", raw, rowNumber, lastFailure);
    }

    /**
     * Format an instant in standard format (UTC)
     */
    public static String formatTimestamp(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).format(STANDARD_TIMESTAMP_FORMAT);
    }
}
