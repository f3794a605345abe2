package org.pncover.engine;

/**
 * Lifecycle of one coordinator run.
 * NEW -> SEEDING -> DISPATCHING <-> MERGING -> DRAINED, or FAILED from any
 * running state.
 */
public enum CoordinatorState {
    NEW,
    SEEDING,
    DISPATCHING,
    MERGING,
    DRAINED,
    FAILED;

    public boolean isTerminal() {
        return this == DRAINED || this == FAILED;
    }
}
