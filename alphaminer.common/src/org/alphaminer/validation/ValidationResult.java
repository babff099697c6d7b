package org.alphaminer.validation;

import java.util.*;
import org.apache.log4j.Logger;

/**
 * Collects the problems found while checking an event log, so that all of them can be
 * reported in one pass before the first fatal one is raised.
 */
public class ValidationResult {
    private static final Logger logger = Logger.getLogger(ValidationResult.class);

    private final String source;
    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ValidationError> warnings = new ArrayList<>();

    public ValidationResult(String source) {
        this.source = source;
    }

    public static class ValidationError {
        public final String type;
        public final String message;
        public final String recordId;
        public final String context;

        public ValidationError(String type, String message, String recordId, String context) {
            this.type = Objects.requireNonNull(type, "type cannot be null");
            this.message = Objects.requireNonNull(message, "message cannot be null");
            this.recordId = recordId; // Can be null
            this.context = context; // Can be null
        }

        @Override
        public String toString() {
            return String.format("[Record %s] %s: %s (Context: %s)",
                               recordId != null ? recordId : "UNKNOWN", type, message,
                               context != null ? context : "N/A");
        }
    }

    public void addError(String type, String message, String recordId, String context) {
        errors.add(new ValidationError(type, message, recordId, context));
    }

    public void addWarning(String type, String message, String recordId, String context) {
        warnings.add(new ValidationError(type, message, recordId, context));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationError> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }


    public void reportErrors() {
        for (ValidationError warning : warnings) {
            logger.warn(source + ": " + warning);
        }
        if (errors.isEmpty()) {
            return;
        }

        logger.error("=== EVENT LOG VALIDATION ERRORS: " + source + " ===");
        logger.error("Found " + errors.size() + " validation errors:");

        // Group errors by type, keeping first-seen order
        Map<String, List<ValidationError>> errorsByType = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            errorsByType.computeIfAbsent(error.type, k -> new ArrayList<>()).add(error);
        }

        for (Map.Entry<String, List<ValidationError>> entry : errorsByType.entrySet()) {
            String errorType = entry.getKey();
            List<ValidationError> typeErrors = entry.getValue();

            logger.error("--- " + errorType + " (" + typeErrors.size() + " errors) ---");
            for (ValidationError error : typeErrors) {
                logger.error("  " + error.toString());
            }
        }

        logger.error("=== END EVENT LOG VALIDATION ERRORS ===");
    }

}
