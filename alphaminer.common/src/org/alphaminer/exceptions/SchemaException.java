package org.alphaminer.exceptions;

/**
 * A required field of an event record is missing or empty.
 */
public class SchemaException extends MiningException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final long rowNumber;

    public SchemaException(String message, String fieldName, long rowNumber) {
        super(message, "ingestion", rowNumber >= 0 ? "row " + rowNumber : null, "SCHEMA_ERROR");
        this.fieldName = fieldName;
        this.rowNumber = rowNumber;
    }

    public SchemaException(String message, String fieldName) {
        this(message, fieldName, -1);
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return 1-based data row, or -1 when the problem is in the header
     */
    public long getRowNumber() {
        return rowNumber;
    }
}
