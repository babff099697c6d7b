package org.alphaminer.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.alphaminer.config.MinerParameters;
import org.alphaminer.constants.MinerConstants;
import org.alphaminer.exceptions.MiningException;
import org.alphaminer.exceptions.SchemaException;
import org.alphaminer.exceptions.TimestampParseException;
import org.alphaminer.model.EventRecord;
import org.alphaminer.utils.TimeStampUtils;
import org.alphaminer.validation.ValidationResult;
import org.apache.log4j.Logger;

import au.com.bytecode.opencsv.CSVReader;

/**
 * Reads an event log from CSV. The first line is a header; the case id, activity and timestamp
 * columns are located by name and every other column is ignored.
 *
 * All rows are checked before anything is returned: every missing field and unparseable timestamp
 * is reported through the logger, then the first one is thrown.
 */
public class EventLogCsvReader {

    private static final Logger logger = Logger.getLogger(EventLogCsvReader.class);

    private final String caseIdColumn;
    private final String activityColumn;
    private final String timestampColumn;

    public EventLogCsvReader() {
        this(MinerConstants.CASE_ID_COLUMN, MinerConstants.ACTIVITY_COLUMN, MinerConstants.TIMESTAMP_COLUMN);
    }

    public EventLogCsvReader(MinerParameters parameters) {
        this(parameters.getCaseIdColumn(), parameters.getActivityColumn(), parameters.getTimestampColumn());
    }

    public EventLogCsvReader(String caseIdColumn, String activityColumn, String timestampColumn) {
        this.caseIdColumn = Objects.requireNonNull(caseIdColumn, "caseIdColumn cannot be null");
        this.activityColumn = Objects.requireNonNull(activityColumn, "activityColumn cannot be null");
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "timestampColumn cannot be null");
    }

    public List<EventRecord> read(Path file) throws IOException, MiningException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.getFileName().toString());
        }
    }

    /**
     * @param source name used in log messages
     */
    public List<EventRecord> read(Reader input, String source) throws IOException, MiningException {
        CSVReader reader = new CSVReader(input);
        try {
            String[] header = reader.readNext();
            if (header == null) {
                throw new SchemaException(source + " is empty: no header line", caseIdColumn);
            }
            int caseIdIndex = columnIndex(header, caseIdColumn, source);
            int activityIndex = columnIndex(header, activityColumn, source);
            int timestampIndex = columnIndex(header, timestampColumn, source);

            ValidationResult validation = new ValidationResult(source);
            MiningException firstFailure = null;
            List<EventRecord> events = new ArrayList<>();

            String[] line;
            long rowNumber = 0;
            while ((line = reader.readNext()) != null) {
                rowNumber++;
                if (isBlankLine(line)) {
                    continue;
                }
                if (line.length > header.length) {
                    validation.addWarning("EXTRA_FIELDS", line.length + " fields against " + header.length
                        + " header columns", "row " + rowNumber, null);
                }
                try {
                    String caseId = requireField(line, caseIdIndex, caseIdColumn, rowNumber);
                    String activity = requireField(line, activityIndex, activityColumn, rowNumber);
                    String rawTimestamp = requireField(line, timestampIndex, timestampColumn, rowNumber);
                    Instant timestamp = TimeStampUtils.parseTimestamp(rawTimestamp, rowNumber);
                    events.add(new EventRecord(caseId, activity, timestamp));
                } catch (SchemaException e) {
                    validation.addError("MISSING_FIELD", e.getMessage(), "row " + rowNumber, e.getFieldName());
                    firstFailure = firstFailure == null ? e : firstFailure;
                } catch (TimestampParseException e) {
                    validation.addError("BAD_TIMESTAMP", e.getMessage(), "row " + rowNumber, e.getRawValue());
                    firstFailure = firstFailure == null ? e : firstFailure;
                }
            }

            validation.reportErrors();
            if (validation.hasErrors()) {
                throw firstFailure;
            }
            logger.info("Read " + events.size() + " events from " + source);
            return events;
        } finally {
            reader.close();
        }
    }

    private static int columnIndex(String[] header, String column, String source) throws SchemaException {
        for (int i = 0; i < header.length; i++) {
            if (column.equals(stripBom(header[i]).trim())) {
                return i;
            }
        }
        throw new SchemaException(source + " has no '" + column + "' column", column);
    }

    private static String requireField(String[] line, int index, String column, long rowNumber)
            throws SchemaException {
        if (index >= line.length || line[index] == null || line[index].trim().isEmpty()) {
            throw new SchemaException("Missing value for '" + column + "'", column, rowNumber);
        }
        return line[index].trim();
    }

    private static boolean isBlankLine(String[] line) {
        for (String field : line) {
            if (field != null && !field.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String stripBom(String value) {
        return value.startsWith("﻿") ? value.substring(1) : value;
    }
}
