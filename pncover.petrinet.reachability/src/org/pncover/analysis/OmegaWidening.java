package org.pncover.analysis;

import org.pncover.model.Marking;

/**
 * Karp-Miller style widening of a freshly merged marking.
 *
 * A candidate that covers some previously accepted marking K, and is strictly
 * larger than K in some places, is taken to sit on a repeatable growth cycle:
 * those places become unbounded. The comparison runs over every accepted
 * marking of the run, not only the ancestors of the candidate.
 */
public final class OmegaWidening {

    private OmegaWidening() {
    }

    /**
     * candidate covers k iff every place of candidate is unbounded, or both are
     * bounded and candidate holds at least as many tokens.
     */
    public static boolean covers(Marking candidate, Marking k) {
        if (candidate.size() != k.size()) {
            throw new IllegalArgumentException("Markings differ in length: " + candidate + " vs " + k);
        }
        for (int p = 0; p < candidate.size(); p++) {
            if (candidate.isOmega(p)) {
                continue;
            }
            if (k.isOmega(p) || candidate.get(p) < k.get(p)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Places where candidate is strictly above k: unbounded over bounded, or
     * both bounded with more tokens. Only meaningful when candidate covers k.
     */
    static void markStrict(Marking candidate, Marking k, boolean[] strict) {
        for (int p = 0; p < candidate.size(); p++) {
            if (candidate.isOmega(p)) {
                if (!k.isOmega(p)) {
                    strict[p] = true;
                }
            } else if (!k.isOmega(p) && candidate.get(p) > k.get(p)) {
                strict[p] = true;
            }
        }
    }

    /**
     * Returns the canonical form of candidate: every place strictly above some
     * covered history marking is set to OMEGA, the rest keep their value.
     * The union over all covered markings makes the result independent of the
     * iteration order of history.
     */
    public static Marking widen(Marking candidate, Iterable<Marking> history) {
        boolean[] strict = new boolean[candidate.size()];
        boolean widened = false;
        for (Marking k : history) {
            if (covers(candidate, k)) {
                markStrict(candidate, k, strict);
            }
        }
        int[] canonical = candidate.toArray();
        for (int p = 0; p < canonical.length; p++) {
            if (strict[p] && canonical[p] != Marking.OMEGA) {
                canonical[p] = Marking.OMEGA;
                widened = true;
            }
        }
        return widened ? Marking.of(canonical) : candidate;
    }
}
