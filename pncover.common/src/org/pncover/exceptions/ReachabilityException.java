package org.pncover.exceptions;

/**
 * Base exception for all coverability tree errors.
 * Carries an error code so callers (and the CLI) can classify failures
 * without inspecting the concrete type.
 */
public class ReachabilityException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String errorCode;
    private final String subject;

    public ReachabilityException(String message, String subject, String errorCode) {
        super(message);
        this.subject = subject;
        this.errorCode = errorCode;
    }

    public ReachabilityException(String message, Throwable cause, String subject, String errorCode) {
        super(message, cause);
        this.subject = subject;
        this.errorCode = errorCode;
    }

    public ReachabilityException(String message) {
        this(message, null, "GENERAL_ERROR");
    }

    public ReachabilityException(String message, Throwable cause) {
        this(message, cause, null, "GENERAL_ERROR");
    }

    /**
     * What the error is about: a JSON field, a subnet id, a worker name.
     * May be null.
     */
    public String getSubject() {
        return subject;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append(" [").append(errorCode);
        if (subject != null) {
            sb.append(":").append(subject);
        }
        sb.append("]");
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
