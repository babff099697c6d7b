package org.alphaminer.exceptions;

/**
 * An activity label collides with one of the synthetic boundary markers.
 */
public class ReservedLabelException extends MiningException {

    private static final long serialVersionUID = 1L;

    private final String label;

    public ReservedLabelException(String message, String label, String caseId) {
        super(message, "ingestion", caseId, "RESERVED_LABEL");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
