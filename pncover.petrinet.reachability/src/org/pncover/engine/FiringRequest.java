package org.pncover.engine;

import org.pncover.model.Marking;

/**
 * Coordinator to worker: fire transition at origin. A request without an
 * origin is the shutdown signal.
 */
final class FiringRequest {

    private static final FiringRequest SHUTDOWN = new FiringRequest(null, -1);

    final Marking origin;
    final int transition;

    FiringRequest(Marking origin, int transition) {
        this.origin = origin;
        this.transition = transition;
    }

    static FiringRequest shutdown() {
        return SHUTDOWN;
    }

    boolean isShutdown() {
        return origin == null;
    }

    @Override
    public String toString() {
        return isShutdown() ? "FiringRequest{SHUTDOWN}" : "FiringRequest{" + origin + ", t" + transition + "}";
    }
}
