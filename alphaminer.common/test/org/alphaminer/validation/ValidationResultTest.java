package org.alphaminer.validation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ValidationResultTest {

    @Test
    public void testCollectsErrorsAndWarnings() {
        ValidationResult result = new ValidationResult("log.csv");
        assertFalse(result.hasErrors());

        result.addWarning("EXTRA_FIELDS", "5 fields against 4 header columns", "row 3", null);
        assertFalse(result.hasErrors());

        result.addError("MISSING_FIELD", "Missing value for 'activity_name'", "row 2", "activity_name");
        result.addError("BAD_TIMESTAMP", "Unrecognised timestamp format", "row 4", "noon");
        result.addError("MISSING_FIELD", "Missing value for 'case_id'", "row 5", "case_id");
        result.reportErrors();

        assertTrue(result.hasErrors());
        assertEquals(3, result.getErrorCount());
        assertEquals(1, result.getWarningCount());
        assertEquals("row 2", result.getErrors().get(0).recordId);
        assertEquals("EXTRA_FIELDS", result.getWarnings().get(0).type);
        assertThrows(UnsupportedOperationException.class, () -> result.getErrors().clear());
    }

    @Test
    public void testErrorText() {
        ValidationResult.ValidationError error = new ValidationResult.ValidationError("BAD_TIMESTAMP", "bad", null, null);

        assertEquals("[Record UNKNOWN] BAD_TIMESTAMP: bad (Context: N/A)", error.toString());
        assertThrows(NullPointerException.class, () -> new ValidationResult.ValidationError(null, "m", null, null));
    }
}
