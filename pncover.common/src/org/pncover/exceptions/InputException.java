package org.pncover.exceptions;

/**
 * Malformed or inconsistent net input: bad JSON, missing fields, wrong types,
 * dimension mismatches between M0 / I_minus / I_plus, unreadable PNML.
 * Always fatal, nothing is explored.
 */
public class InputException extends ReachabilityException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "INPUT_ERROR";

    private final String invalidJson;
    private final int errorPosition;

    public InputException(String message) {
        this(message, (String) null);
    }

    public InputException(String message, String field) {
        super(message, field, ERROR_CODE);
        this.invalidJson = null;
        this.errorPosition = -1;
    }

    public InputException(String message, Throwable cause) {
        super(message, cause, null, ERROR_CODE);
        this.invalidJson = null;
        this.errorPosition = -1;
    }

    public InputException(String message, Throwable cause, String invalidJson, int errorPosition) {
        super(message, cause, null, ERROR_CODE);
        this.invalidJson = invalidJson;
        this.errorPosition = errorPosition;
    }

    /**
     * The JSON field that failed, or null when the whole document is broken.
     */
    public String getField() {
        return getSubject();
    }

    public int getErrorPosition() {
        return errorPosition;
    }

    /**
     * Get a snippet around the error position for debugging
     */
    public String getJsonSnippet() {
        if (invalidJson == null || errorPosition < 0) {
            return null;
        }

        int start = Math.max(0, errorPosition - 40);
        int end = Math.min(invalidJson.length(), errorPosition + 40);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) snippet.append("...");
        snippet.append(invalidJson, start, end);
        if (end < invalidJson.length()) snippet.append("...");

        return snippet.toString();
    }

    /**
     * Create a detailed error message for logging
     */
    public String getDetailedErrorMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Input Error: ").append(getMessage()).append("\n");

        if (getField() != null) {
            sb.append("Field: ").append(getField()).append("\n");
        }

        if (errorPosition >= 0) {
            sb.append("Error Position: ").append(errorPosition).append("\n");
        }

        String snippet = getJsonSnippet();
        if (snippet != null) {
            sb.append("JSON Snippet: ").append(snippet).append("\n");
        }

        if (getCause() != null) {
            sb.append("Underlying Cause: ").append(getCause().getMessage());
        }

        return sb.toString();
    }
}
