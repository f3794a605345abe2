package org.pncover.model;

import java.util.Arrays;

import org.pncover.constants.ReachabilityConstants;

/**
 * Immutable token distribution over the places of a net.
 *
 * A component is either a non-negative token count or OMEGA (unbounded).
 * Markings are value objects: equal components mean equal markings, so they
 * serve directly as map keys for the visited set and pending merges.
 */
public final class Marking {

    public static final int OMEGA = ReachabilityConstants.OMEGA;

    private final int[] tokens;
    private final int hash;

    private Marking(int[] tokens) {
        this.tokens = tokens;
        this.hash = Arrays.hashCode(tokens);
    }

    /**
     * Copies the given values. Any value below zero other than OMEGA is rejected.
     */
    public static Marking of(int... tokens) {
        int[] copy = tokens.clone();
        for (int p = 0; p < copy.length; p++) {
            if (copy[p] < 0 && copy[p] != OMEGA) {
                throw new IllegalArgumentException("Place " + p + " has negative token count " + copy[p]);
            }
        }
        return new Marking(copy);
    }

    public int size() {
        return tokens.length;
    }

    public int get(int place) {
        return tokens[place];
    }

    public boolean isOmega(int place) {
        return tokens[place] == OMEGA;
    }

    public boolean hasOmega() {
        for (int value : tokens) {
            if (value == OMEGA) {
                return true;
            }
        }
        return false;
    }

    public int[] toArray() {
        return tokens.clone();
    }

    /**
     * Renders the marking as {@code [1, 0, ω]} with the given symbol for unbounded places.
     */
    public String render(String omegaSymbol) {
        StringBuilder sb = new StringBuilder("[");
        for (int p = 0; p < tokens.length; p++) {
            if (p > 0) {
                sb.append(", ");
            }
            sb.append(tokens[p] == OMEGA ? omegaSymbol : Integer.toString(tokens[p]));
        }
        return sb.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Marking that = (Marking) o;
        return hash == that.hash && Arrays.equals(tokens, that.tokens);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return render(ReachabilityConstants.OMEGA_SYMBOL);
    }
}
