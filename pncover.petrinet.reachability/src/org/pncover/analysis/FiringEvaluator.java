package org.pncover.analysis;

import org.pncover.model.Marking;
import org.pncover.model.PetriNet;
import org.pncover.model.Subnet;

/**
 * Applies the effect of a transition, M' = M - I-[., t] + I+[., t].
 * Unbounded places never change.
 *
 * Callers fire only enabled transitions; enablement is not re-checked here.
 * Token counts that would leave the int range raise {@link ArithmeticException}
 * rather than wrapping.
 */
public final class FiringEvaluator {

    private FiringEvaluator() {
    }

    /**
     * Fires t restricted to the places of one subnet and returns the subnet's
     * new local marking. A subnet that does not own t returns its current local
     * marking unchanged.
     */
    public static int[] fireLocal(Subnet subnet, Marking global, int transition) {
        int[] local = subnet.localMarking(global);
        int lt = subnet.localTransition(transition);
        if (lt < 0) {
            return local;
        }
        for (int i = 0; i < local.length; i++) {
            if (local[i] != Marking.OMEGA) {
                local[i] = Math.addExact(Math.subtractExact(local[i], subnet.localConsumption(i, lt)),
                        subnet.localProduction(i, lt));
            }
        }
        return local;
    }

    /**
     * Fires t on the whole net, without decomposition.
     */
    public static Marking fire(PetriNet net, Marking marking, int transition) {
        if (transition < 0 || transition >= net.getTransitionCount()) {
            throw new IndexOutOfBoundsException("No transition " + transition + " in " + net);
        }
        int[] next = marking.toArray();
        for (int p = 0; p < next.length; p++) {
            if (next[p] != Marking.OMEGA) {
                next[p] = Math.addExact(Math.subtractExact(next[p], net.consumption(p, transition)),
                        net.production(p, transition));
            }
        }
        return Marking.of(next);
    }

    /**
     * State equation M' = M + C . sigma for an incidence matrix C = I+ - I- and a
     * firing count vector sigma. Places unbounded in M stay unbounded.
     *
     * @throws IllegalArgumentException if a bounded place would go negative
     */
    public static Marking fire(Marking marking, int[][] incidence, int[] firingVector) {
        if (incidence.length != marking.size()) {
            throw new IllegalArgumentException("Incidence has " + incidence.length + " rows, marking has "
                    + marking.size() + " places");
        }
        int[] next = marking.toArray();
        for (int p = 0; p < next.length; p++) {
            if (next[p] == Marking.OMEGA) {
                continue;
            }
            if (incidence[p].length != firingVector.length) {
                throw new IllegalArgumentException("Firing vector has " + firingVector.length
                        + " entries, incidence has " + incidence[p].length + " columns");
            }
            int delta = 0;
            for (int t = 0; t < firingVector.length; t++) {
                delta = Math.addExact(delta, Math.multiplyExact(incidence[p][t], firingVector[t]));
            }
            next[p] = Math.addExact(next[p], delta);
            if (next[p] < 0) {
                throw new IllegalArgumentException("Place " + p + " would hold " + next[p] + " tokens");
            }
        }
        return Marking.of(next);
    }
}
