package org.alphaminer.exceptions;

/**
 * Base of the discovery failures. Each subclass fixes its error code; the stage names the part of
 * the pipeline that failed and the context id the row, case, trace or parameter involved.
 */
public class MiningException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String stage;
    private final String contextId;
    private final String errorCode;

    protected MiningException(String message, String stage, String contextId, String errorCode) {
        this(message, null, stage, contextId, errorCode);
    }

    protected MiningException(String message, Throwable cause, String stage, String contextId, String errorCode) {
        super(message, cause);
        this.stage = stage;
        this.contextId = contextId;
        this.errorCode = errorCode;
    }

    public String getStage() {
        return stage;
    }

    /**
     * @return row, case, trace or parameter the failure refers to, or null
     */
    public String getContextId() {
        return contextId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * {@code SCHEMA_ERROR at ingestion/row 2: Missing value for 'activity_name'}
     */
    @Override
    public String toString() {
        String where = contextId == null ? stage : stage + "/" + contextId;
        return errorCode + (where == null ? "" : " at " + where) + ": " + getMessage();
    }
}
