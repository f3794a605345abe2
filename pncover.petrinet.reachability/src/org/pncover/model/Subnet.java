package org.pncover.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A group of places together with the transitions it takes part in, and the
 * restriction of I- / I+ to those rows and columns.
 *
 * Local row i corresponds to global place {@code placeIndices[i]}; local
 * column j to global transition {@code transitionIndices[j]}.
 */
public final class Subnet {

    private final int id;
    private final int[] placeIndices;
    private final int[] transitionIndices;
    private final int[][] localConsumption;
    private final int[][] localProduction;
    private final Map<Integer, Integer> globalToLocalTransition;

    Subnet(int id, int[] placeIndices, int[] transitionIndices, PetriNet net) {
        this.id = id;
        this.placeIndices = placeIndices.clone();
        this.transitionIndices = transitionIndices.clone();
        this.localConsumption = new int[placeIndices.length][transitionIndices.length];
        this.localProduction = new int[placeIndices.length][transitionIndices.length];
        for (int i = 0; i < placeIndices.length; i++) {
            for (int j = 0; j < transitionIndices.length; j++) {
                localConsumption[i][j] = net.consumption(placeIndices[i], transitionIndices[j]);
                localProduction[i][j] = net.production(placeIndices[i], transitionIndices[j]);
            }
        }
        Map<Integer, Integer> map = new HashMap<>();
        for (int j = 0; j < transitionIndices.length; j++) {
            map.put(transitionIndices[j], j);
        }
        this.globalToLocalTransition = Collections.unmodifiableMap(map);
    }

    public int getId() {
        return id;
    }

    public int getPlaceCount() {
        return placeIndices.length;
    }

    /** Global index of local place i. */
    public int globalPlace(int localPlace) {
        return placeIndices[localPlace];
    }

    public int[] getPlaceIndices() {
        return placeIndices.clone();
    }

    public int[] getTransitionIndices() {
        return transitionIndices.clone();
    }

    public boolean ownsTransition(int transition) {
        return globalToLocalTransition.containsKey(transition);
    }

    /**
     * Local column of a global transition, or -1 when this subnet does not own it.
     */
    public int localTransition(int transition) {
        Integer local = globalToLocalTransition.get(transition);
        return local == null ? -1 : local;
    }

    public int localConsumption(int localPlace, int localTransition) {
        return localConsumption[localPlace][localTransition];
    }

    public int localProduction(int localPlace, int localTransition) {
        return localProduction[localPlace][localTransition];
    }

    /**
     * The components of a global marking that belong to this subnet, in local order.
     */
    public int[] localMarking(Marking global) {
        int[] local = new int[placeIndices.length];
        for (int i = 0; i < placeIndices.length; i++) {
            local[i] = global.get(placeIndices[i]);
        }
        return local;
    }

    @Override
    public String toString() {
        return String.format("Subnet{id=%d, places=%s, transitions=%s}",
                id, Arrays.toString(placeIndices), Arrays.toString(transitionIndices));
    }
}
