package org.pncover.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * The subnet decomposition does not describe a valid partition of the net:
 * indices out of range, overlapping or missing places, unowned transitions.
 * Raised at model construction, before any exploration starts.
 */
public class InvalidNetException extends ReachabilityException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "INVALID_NET";

    private final List<String> violations;

    public InvalidNetException(String message) {
        this(message, Collections.singletonList(message));
    }

    public InvalidNetException(String message, List<String> violations) {
        super(message, null, ERROR_CODE);
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        for (String violation : violations) {
            sb.append("\n  ").append(violation);
        }
        return sb.toString();
    }
}
