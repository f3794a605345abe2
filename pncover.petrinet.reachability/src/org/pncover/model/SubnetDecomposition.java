package org.pncover.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.pncover.exceptions.InvalidNetException;
import org.pncover.validation.ValidationResult;

/**
 * A net split into subnets: the place sets partition the net, the transition
 * sets may overlap. Built once and shared read-only by the coordinator and
 * every worker.
 */
public final class SubnetDecomposition {

    private static final Logger logger = Logger.getLogger(SubnetDecomposition.class);

    private final PetriNet net;
    private final List<Subnet> subnets;
    private final TransitionOwnership ownership;
    private final int[] placeOwner;

    private SubnetDecomposition(PetriNet net, List<Subnet> subnets) {
        this.net = net;
        this.subnets = Collections.unmodifiableList(subnets);
        this.ownership = new TransitionOwnership(net.getTransitionCount(), subnets);
        this.placeOwner = new int[net.getPlaceCount()];
        for (Subnet subnet : subnets) {
            for (int p : subnet.getPlaceIndices()) {
                placeOwner[p] = subnet.getId();
            }
        }
    }

    /**
     * Validates the definitions against the net and builds the subnets.
     * Subnet ids must be exactly 0..N-1 (in any order), since a subnet id is
     * also the index of its worker.
     *
     * @throws InvalidNetException listing every violation found
     */
    public static SubnetDecomposition build(PetriNet net, List<SubnetDefinition> definitions)
            throws InvalidNetException {
        ValidationResult result = validate(net, definitions);
        result.reportWarnings();
        if (result.hasErrors()) {
            result.reportErrors();
            throw new InvalidNetException("Subnet decomposition is invalid (" + result.getErrorCount()
                    + " errors)", result.describeErrors());
        }

        SubnetDefinition[] byId = new SubnetDefinition[definitions.size()];
        for (SubnetDefinition definition : definitions) {
            byId[definition.id] = definition;
        }
        List<Subnet> subnets = new ArrayList<>(byId.length);
        for (SubnetDefinition definition : byId) {
            subnets.add(new Subnet(definition.id, definition.getPlaceIndices(),
                    definition.getTransitionIndices(), net));
        }

        SubnetDecomposition decomposition = new SubnetDecomposition(net, subnets);
        logger.info("Built " + subnets.size() + " subnets for " + net + ", " + decomposition.ownership);
        return decomposition;
    }

    /**
     * One subnet owning every place and every transition. Used when the input
     * names no decomposition.
     */
    public static SubnetDecomposition singleSubnet(PetriNet net) {
        int[] places = new int[net.getPlaceCount()];
        for (int p = 0; p < places.length; p++) {
            places[p] = p;
        }
        int[] transitions = new int[net.getTransitionCount()];
        for (int t = 0; t < transitions.length; t++) {
            transitions[t] = t;
        }
        List<Subnet> subnets = new ArrayList<>();
        subnets.add(new Subnet(0, places, transitions, net));
        return new SubnetDecomposition(net, subnets);
    }

    /**
     * Collects every error (and warning) of a decomposition without building it.
     */
    public static ValidationResult validate(PetriNet net, List<SubnetDefinition> definitions) {
        ValidationResult result = new ValidationResult();
        int places = net.getPlaceCount();
        int transitions = net.getTransitionCount();

        if (definitions == null || definitions.isEmpty()) {
            result.addError("NO_SUBNETS", "At least one subnet definition is required", null);
            return result;
        }

        int count = definitions.size();
        boolean[] seenIds = new boolean[count];
        int[] placeOwner = new int[places];
        Arrays.fill(placeOwner, -1);
        List<List<Integer>> transitionOwners = new ArrayList<>();
        for (int t = 0; t < transitions; t++) {
            transitionOwners.add(new ArrayList<>());
        }

        for (SubnetDefinition definition : definitions) {
            String element = "subnet " + definition.id;
            if (definition.id < 0 || definition.id >= count) {
                result.addError("SUBNET_ID_OUT_OF_RANGE",
                        "Subnet id " + definition.id + " is outside 0.." + (count - 1), element);
            } else if (seenIds[definition.id]) {
                result.addError("DUPLICATE_SUBNET_ID", "Subnet id " + definition.id + " is used twice", element);
            } else {
                seenIds[definition.id] = true;
            }

            for (int p : definition.getPlaceIndices()) {
                if (p < 0 || p >= places) {
                    result.addError("PLACE_OUT_OF_RANGE",
                            "Place index " + p + " is outside 0.." + (places - 1), element);
                } else if (placeOwner[p] >= 0) {
                    result.addError("PLACE_OVERLAP", "Place " + p + " is already owned by subnet "
                            + placeOwner[p], element);
                } else {
                    placeOwner[p] = definition.id;
                }
            }

            boolean[] seenTransitions = new boolean[transitions];
            for (int t : definition.getTransitionIndices()) {
                if (t < 0 || t >= transitions) {
                    result.addError("TRANSITION_OUT_OF_RANGE",
                            "Transition index " + t + " is outside 0.." + (transitions - 1), element);
                } else if (seenTransitions[t]) {
                    result.addError("DUPLICATE_TRANSITION", "Transition " + t + " is listed twice", element);
                } else {
                    seenTransitions[t] = true;
                    transitionOwners.get(t).add(definition.id);
                }
            }
        }

        for (int p = 0; p < places; p++) {
            if (placeOwner[p] < 0) {
                result.addError("PLACE_UNASSIGNED", "Place " + p + " is not owned by any subnet", null);
            }
        }

        for (int t = 0; t < transitions; t++) {
            List<Integer> owners = transitionOwners.get(t);
            if (owners.isEmpty()) {
                result.addError("TRANSITION_UNOWNED", "Transition " + t + " is not owned by any subnet", null);
                continue;
            }
            for (int p = 0; p < places; p++) {
                if (placeOwner[p] >= 0 && net.touches(t, p) && !owners.contains(placeOwner[p])) {
                    result.addWarning("FOREIGN_PLACE_EFFECT", "Transition " + t + " changes place " + p
                            + " but its subnet " + placeOwner[p] + " does not own the transition; "
                            + "the change is dropped when firing", "transition " + t);
                }
            }
        }
        return result;
    }

    public PetriNet getNet() {
        return net;
    }

    public int getSubnetCount() {
        return subnets.size();
    }

    public Subnet getSubnet(int id) {
        return subnets.get(id);
    }

    public List<Subnet> getSubnets() {
        return subnets;
    }

    public TransitionOwnership getOwnership() {
        return ownership;
    }

    /** Id of the subnet owning global place p. */
    public int ownerOfPlace(int place) {
        return placeOwner[place];
    }
}
