package org.pncover.analysis;

import java.util.ArrayList;
import java.util.List;

import org.pncover.model.Marking;
import org.pncover.model.PetriNet;

/**
 * Decides which transitions may fire at a marking.
 *
 * Always evaluated on the full global marking: the subnet decomposition only
 * splits the firing arithmetic, never this test.
 */
public final class EnablementEvaluator {

    private EnablementEvaluator() {
    }

    /**
     * t is enabled iff every place is unbounded or holds at least I-[p][t] tokens.
     */
    public static boolean isEnabled(Marking marking, int[][] consumption, int transition) {
        for (int p = 0; p < marking.size(); p++) {
            if (!marking.isOmega(p) && marking.get(p) < consumption[p][transition]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Enabled transitions in ascending index order.
     */
    public static List<Integer> enabled(Marking marking, int[][] consumption) {
        if (consumption.length != marking.size()) {
            throw new IllegalArgumentException("Marking has " + marking.size() + " places, I- has "
                    + consumption.length + " rows");
        }
        List<Integer> enabled = new ArrayList<>();
        int transitions = consumption.length == 0 ? 0 : consumption[0].length;
        for (int t = 0; t < transitions; t++) {
            if (isEnabled(marking, consumption, t)) {
                enabled.add(t);
            }
        }
        return enabled;
    }

    public static List<Integer> enabled(Marking marking, PetriNet net) {
        List<Integer> enabled = new ArrayList<>();
        for (int t = 0; t < net.getTransitionCount(); t++) {
            if (isEnabled(marking, net, t)) {
                enabled.add(t);
            }
        }
        return enabled;
    }

    public static boolean isEnabled(Marking marking, PetriNet net, int transition) {
        for (int p = 0; p < net.getPlaceCount(); p++) {
            if (!marking.isOmega(p) && marking.get(p) < net.consumption(p, transition)) {
                return false;
            }
        }
        return true;
    }
}
