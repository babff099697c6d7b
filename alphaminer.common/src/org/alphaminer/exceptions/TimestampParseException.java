package org.alphaminer.exceptions;

/**
 * A timestamp could not be parsed into an orderable instant.
 */
public class TimestampParseException extends MiningException {

    private static final long serialVersionUID = 1L;

    private final String rawValue;
    private final long rowNumber;

    public TimestampParseException(String message, String rawValue, long rowNumber) {
        super(message, "ingestion", rowNumber >= 0 ? "row " + rowNumber : null, "PARSE_ERROR");
        this.rawValue = rawValue;
        this.rowNumber = rowNumber;
    }

    public TimestampParseException(String message, String rawValue, long rowNumber, Throwable cause) {
        super(message, cause, "ingestion", rowNumber >= 0 ? "row " + rowNumber : null, "PARSE_ERROR");
        this.rawValue = rawValue;
        this.rowNumber = rowNumber;
    }

    public String getRawValue() {
        return rawValue;
    }

    public long getRowNumber() {
        return rowNumber;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        if (rawValue != null) {
            sb.append(" (value: '").append(rawValue).append("')");
        }
        return sb.toString();
    }
}
