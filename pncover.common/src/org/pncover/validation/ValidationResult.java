package org.pncover.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Collects net validation findings so that every problem is reported at once
 * instead of failing on the first one.
 */
public class ValidationResult {
    private static final Logger logger = Logger.getLogger(ValidationResult.class);

    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ValidationError> warnings = new ArrayList<>();

    public static class ValidationError {
        public final String type;
        public final String message;
        public final String element;

        public ValidationError(String type, String message, String element) {
            this.type = type;
            this.message = message;
            this.element = element;
        }

        @Override
        public String toString() {
            return String.format("[%s] %s: %s", element != null ? element : "net", type, message);
        }
    }

    public void addError(String type, String message, String element) {
        errors.add(new ValidationError(type, message, element));
    }

    public void addWarning(String type, String message, String element) {
        warnings.add(new ValidationError(type, message, element));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public List<ValidationError> getErrors() {
        return new ArrayList<>(errors);
    }

    public List<ValidationError> getWarnings() {
        return new ArrayList<>(warnings);
    }

    /**
     * Error descriptions in the order they were found.
     */
    public List<String> describeErrors() {
        List<String> descriptions = new ArrayList<>();
        for (ValidationError error : errors) {
            descriptions.add(error.toString());
        }
        return descriptions;
    }

    public void reportWarnings() {
        for (ValidationError warning : warnings) {
            logger.warn(warning.toString());
        }
    }

    public void reportErrors() {
        if (errors.isEmpty()) {
            return;
        }

        logger.error("=== NET VALIDATION ERRORS ===");
        logger.error("Found " + errors.size() + " validation errors:");

        // Group errors by type
        Map<String, List<ValidationError>> errorsByType = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            errorsByType.computeIfAbsent(error.type, k -> new ArrayList<>()).add(error);
        }

        for (Map.Entry<String, List<ValidationError>> entry : errorsByType.entrySet()) {
            logger.error("--- " + entry.getKey() + " (" + entry.getValue().size() + " errors) ---");
            for (ValidationError error : entry.getValue()) {
                logger.error("  " + error.toString());
            }
        }

        logger.error("=== END NET VALIDATION ERRORS ===");
    }
}
