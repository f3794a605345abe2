package org.pncover.io;

import java.util.Collections;
import java.util.List;

import org.pncover.exceptions.InvalidNetException;
import org.pncover.model.PetriNet;
import org.pncover.model.SubnetDecomposition;
import org.pncover.model.SubnetDefinition;

/**
 * A loaded net together with the subnet layout it was shipped with, if any.
 */
public final class NetInput {

    private final PetriNet net;
    private final List<SubnetDefinition> subnetDefinitions;

    public NetInput(PetriNet net, List<SubnetDefinition> subnetDefinitions) {
        this.net = net;
        this.subnetDefinitions = subnetDefinitions == null ? null : Collections.unmodifiableList(subnetDefinitions);
    }

    public PetriNet getNet() {
        return net;
    }

    public boolean hasSubnetDefinitions() {
        return subnetDefinitions != null;
    }

    /** Null when the input carried no subnet layout. */
    public List<SubnetDefinition> getSubnetDefinitions() {
        return subnetDefinitions;
    }

    /**
     * Builds the declared decomposition, or one subnet owning the whole net
     * when none was declared.
     */
    public SubnetDecomposition decompose() throws InvalidNetException {
        if (subnetDefinitions == null) {
            return SubnetDecomposition.singleSubnet(net);
        }
        return SubnetDecomposition.build(net, subnetDefinitions);
    }
}
