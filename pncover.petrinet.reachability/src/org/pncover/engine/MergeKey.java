package org.pncover.engine;

import java.util.Objects;

import org.pncover.model.Marking;

/**
 * (origin marking, transition): identifies the replies that belong to one firing.
 */
final class MergeKey {
    final Marking origin;
    final int transition;

    MergeKey(Marking origin, int transition) {
        this.origin = Objects.requireNonNull(origin, "origin cannot be null");
        this.transition = transition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MergeKey that = (MergeKey) o;
        return transition == that.transition && origin.equals(that.origin);
    }

    @Override
    public int hashCode() {
        return 31 * origin.hashCode() + transition;
    }

    @Override
    public String toString() {
        return "(" + origin + ", t" + transition + ")";
    }
}
