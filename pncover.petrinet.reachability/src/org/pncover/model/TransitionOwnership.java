package org.pncover.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * For every global transition, the ids of the subnets that own it.
 * A merge for (marking, t) is complete once every owner of t has replied.
 */
public final class TransitionOwnership {

    private final List<List<Integer>> owners;

    TransitionOwnership(int transitions, List<Subnet> subnets) {
        List<List<Integer>> table = new ArrayList<>(transitions);
        for (int t = 0; t < transitions; t++) {
            List<Integer> ids = new ArrayList<>();
            for (Subnet subnet : subnets) {
                if (subnet.ownsTransition(t)) {
                    ids.add(subnet.getId());
                }
            }
            table.add(Collections.unmodifiableList(ids));
        }
        this.owners = Collections.unmodifiableList(table);
    }

    public int getTransitionCount() {
        return owners.size();
    }

    public List<Integer> ownersOf(int transition) {
        return owners.get(transition);
    }

    public int ownerCount(int transition) {
        return owners.get(transition).size();
    }

    public boolean isOwner(int transition, int subnetId) {
        return owners.get(transition).contains(subnetId);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TransitionOwnership{");
        for (int t = 0; t < owners.size(); t++) {
            if (t > 0) sb.append(", ");
            sb.append('t').append(t).append("->").append(owners.get(t));
        }
        return sb.append('}').toString();
    }
}
