package org.pncover.model;

import org.pncover.exceptions.InputException;

/**
 * Place/transition net given by its consumption (I-) and production (I+)
 * matrices, both P x T, and an initial marking of length P.
 * Immutable once created; shared read-only by every worker.
 */
public final class PetriNet {

    private final int places;
    private final int transitions;
    private final int[][] consumption;
    private final int[][] production;
    private final Marking initialMarking;

    private PetriNet(int[][] consumption, int[][] production, Marking initialMarking) {
        this.places = consumption.length;
        this.transitions = consumption[0].length;
        this.consumption = consumption;
        this.production = production;
        this.initialMarking = initialMarking;
    }

    /**
     * Checks dimensions and values and copies the matrices.
     *
     * @throws InputException if a matrix is empty, not rectangular, disagrees
     *         with the other matrix or with the marking length, or holds a
     *         negative weight
     */
    public static PetriNet create(int[] initialMarking, int[][] iMinus, int[][] iPlus) throws InputException {
        if (initialMarking == null || iMinus == null || iPlus == null) {
            throw new InputException("M0, I_minus and I_plus are all required");
        }
        if (iMinus.length == 0 || iMinus[0].length == 0) {
            throw new InputException("Incidence matrix I_minus is empty", "I_minus");
        }
        if (iPlus.length == 0 || iPlus[0].length == 0) {
            throw new InputException("Incidence matrix I_plus is empty", "I_plus");
        }
        int places = initialMarking.length;
        int transitions = iMinus[0].length;
        checkShape(iMinus, "I_minus", places, transitions);
        checkShape(iPlus, "I_plus", places, transitions);

        for (int p = 0; p < places; p++) {
            if (initialMarking[p] < 0 && initialMarking[p] != Marking.OMEGA) {
                throw new InputException("M0[" + p + "] = " + initialMarking[p]
                        + " is neither a token count nor -1 (unbounded)", "M0");
            }
        }

        return new PetriNet(copy(iMinus), copy(iPlus), Marking.of(initialMarking));
    }

    private static void checkShape(int[][] matrix, String field, int places, int transitions) throws InputException {
        if (matrix.length != places) {
            throw new InputException(field + " has " + matrix.length + " rows but M0 has " + places + " places", field);
        }
        for (int p = 0; p < places; p++) {
            if (matrix[p] == null || matrix[p].length != transitions) {
                throw new InputException(field + " row " + p + " does not have " + transitions + " columns", field);
            }
            for (int t = 0; t < transitions; t++) {
                if (matrix[p][t] < 0) {
                    throw new InputException(field + "[" + p + "][" + t + "] is negative", field);
                }
            }
        }
    }

    private static int[][] copy(int[][] matrix) {
        int[][] result = new int[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    public int getPlaceCount() {
        return places;
    }

    public int getTransitionCount() {
        return transitions;
    }

    public Marking getInitialMarking() {
        return initialMarking;
    }

    /** I-[p][t] */
    public int consumption(int place, int transition) {
        return consumption[place][transition];
    }

    /** I+[p][t] */
    public int production(int place, int transition) {
        return production[place][transition];
    }

    public int[][] getConsumption() {
        return copy(consumption);
    }

    public int[][] getProduction() {
        return copy(production);
    }

    /**
     * C = I+ - I-
     */
    public int[][] getIncidence() {
        int[][] incidence = new int[places][transitions];
        for (int p = 0; p < places; p++) {
            for (int t = 0; t < transitions; t++) {
                incidence[p][t] = production[p][t] - consumption[p][t];
            }
        }
        return incidence;
    }

    /**
     * True when transition t consumes from or produces into place p.
     */
    public boolean touches(int transition, int place) {
        return consumption[place][transition] != 0 || production[place][transition] != 0;
    }

    @Override
    public String toString() {
        return String.format("PetriNet{places=%d, transitions=%d, M0=%s}", places, transitions, initialMarking);
    }
}
