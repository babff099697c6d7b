package org.alphaminer.exceptions;

/**
 * A trace carries an invalid case count. Fatal for the current run.
 */
public class TraceValidationException extends MiningException {

    private static final long serialVersionUID = 1L;

    private final String trace;
    private final long count;

    public TraceValidationException(String message, String stage, String trace, long count) {
        super(message, stage, trace, "VALIDATION_ERROR");
        this.trace = trace;
        this.count = count;
    }

    /**
     * @return printable form of the offending trace
     */
    public String getTrace() {
        return trace;
    }

    public long getCount() {
        return count;
    }
}
