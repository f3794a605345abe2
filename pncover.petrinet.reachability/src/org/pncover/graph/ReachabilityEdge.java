package org.pncover.graph;

import java.util.Objects;

/**
 * Directed edge labelled with the transition that was fired.
 *
 * Tree edges lead to the node the firing created; revisit edges lead to a node
 * that already existed when the same canonical marking was derived again.
 */
public final class ReachabilityEdge {
    public final ReachabilityNode from;
    public final ReachabilityNode to;
    public final int transition;
    public final boolean treeEdge;

    ReachabilityEdge(ReachabilityNode from, ReachabilityNode to, int transition, boolean treeEdge) {
        this.from = Objects.requireNonNull(from, "from cannot be null");
        this.to = Objects.requireNonNull(to, "to cannot be null");
        this.transition = transition;
        this.treeEdge = treeEdge;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReachabilityEdge that = (ReachabilityEdge) o;
        return transition == that.transition && from == that.from && to == that.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from.getName(), to.getName(), transition);
    }

    @Override
    public String toString() {
        return String.format("%s -> %s [t%d%s]", from.getName(), to.getName(), transition,
                treeEdge ? "" : ", revisit");
    }
}
