package org.pncover.engine;

import java.util.Map;
import java.util.TreeMap;

import org.pncover.model.Marking;
import org.pncover.model.Subnet;
import org.pncover.model.SubnetDecomposition;

/**
 * Local markings received so far for one (origin, transition) firing, by
 * subnet id. Owned by the coordinator, dropped once merged.
 */
final class PendingMerge {

    private final Map<Integer, int[]> partials = new TreeMap<>();

    /**
     * @return false when this subnet had already replied (the first reply is kept)
     */
    boolean record(int subnetId, int[] localMarking) {
        if (partials.containsKey(subnetId)) {
            return false;
        }
        partials.put(subnetId, localMarking);
        return true;
    }

    int replyCount() {
        return partials.size();
    }

    /**
     * Writes every recorded local marking over the origin, place by place.
     */
    Marking mergeInto(Marking origin, SubnetDecomposition decomposition) {
        int[] merged = origin.toArray();
        for (Map.Entry<Integer, int[]> entry : partials.entrySet()) {
            Subnet subnet = decomposition.getSubnet(entry.getKey());
            int[] local = entry.getValue();
            for (int i = 0; i < local.length; i++) {
                merged[subnet.globalPlace(i)] = local[i];
            }
        }
        return Marking.of(merged);
    }
}
