package org.pncover.graph;

import org.pncover.model.Marking;

/**
 * One accepted canonical marking. Children point at their parent, never the
 * other way round.
 */
public final class ReachabilityNode {

    public static final int NO_TRANSITION = -1;

    private final int index;
    private final String name;
    private final Marking marking;
    private final ReachabilityNode parent;
    private final int transition;

    ReachabilityNode(int index, String name, Marking marking, ReachabilityNode parent, int transition) {
        this.index = index;
        this.name = name;
        this.marking = marking;
        this.parent = parent;
        this.transition = transition;
    }

    /** Creation order, 0 for the root. */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public Marking getMarking() {
        return marking;
    }

    /** Null for the root. */
    public ReachabilityNode getParent() {
        return parent;
    }

    /** Transition fired from the parent, NO_TRANSITION for the root. */
    public int getTransition() {
        return transition;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String toString() {
        return name + " " + marking;
    }
}
