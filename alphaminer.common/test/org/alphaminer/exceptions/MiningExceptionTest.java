package org.alphaminer.exceptions;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class MiningExceptionTest {

    @Test
    public void testToStringNamesCodeStageAndContext() {
        SchemaException e = new SchemaException("Missing value for 'activity_name'", "activity_name", 2);

        assertEquals("SCHEMA_ERROR at ingestion/row 2: Missing value for 'activity_name'", e.toString());
        assertEquals("ingestion", e.getStage());
        assertEquals("row 2", e.getContextId());
    }

    @Test
    public void testHeaderProblemHasNoRow() {
        SchemaException e = new SchemaException("log.csv has no 'timestamp' column", "timestamp");

        assertNull(e.getContextId());
        assertEquals("SCHEMA_ERROR at ingestion: log.csv has no 'timestamp' column", e.toString());
    }

    @Test
    public void testCauseIsKept() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        MinerConfigurationException e = new MinerConfigurationException("Unknown policy", "reserved_label_policy", cause);

        assertSame(cause, e.getCause());
        assertEquals("reserved_label_policy", e.getParameter());
        assertEquals("CONFIG_ERROR", e.getErrorCode());
    }
}
