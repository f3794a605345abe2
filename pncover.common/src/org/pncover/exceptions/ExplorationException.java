package org.pncover.exceptions;

/**
 * A coverability run could not finish: a subnet worker reported a failure,
 * the coordinator was interrupted, or merge bookkeeping was left inconsistent.
 */
public class ExplorationException extends ReachabilityException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "EXPLORATION_ERROR";

    public ExplorationException(String message) {
        super(message, null, ERROR_CODE);
    }

    public ExplorationException(String message, String worker, Throwable cause) {
        super(message, cause, worker, ERROR_CODE);
    }
}
