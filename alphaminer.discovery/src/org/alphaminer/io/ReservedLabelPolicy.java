package org.alphaminer.io;

/**
 * What ingestion does with a real activity named like a boundary marker.
 */
public enum ReservedLabelPolicy {
    /** fail the run with a ReservedLabelException */
    REJECT,
    /** rename the activity by appending a suffix, and log a warning */
    RENAME
}
