package org.pncover.model;

import java.util.Arrays;

/**
 * Raw subnet description as read from the input: an id plus the global place
 * and transition indices it claims. Nothing is checked here; see
 * {@link SubnetDecomposition}.
 */
public final class SubnetDefinition {
    public final int id;
    private final int[] placeIndices;
    private final int[] transitionIndices;

    public SubnetDefinition(int id, int[] placeIndices, int[] transitionIndices) {
        this.id = id;
        this.placeIndices = placeIndices.clone();
        this.transitionIndices = transitionIndices.clone();
    }

    public int[] getPlaceIndices() {
        return placeIndices.clone();
    }

    public int[] getTransitionIndices() {
        return transitionIndices.clone();
    }

    @Override
    public String toString() {
        return String.format("SubnetDefinition{id=%d, places=%s, transitions=%s}",
                id, Arrays.toString(placeIndices), Arrays.toString(transitionIndices));
    }
}
