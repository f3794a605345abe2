package org.pncover.engine;

import org.pncover.exceptions.ExplorationException;
import org.pncover.graph.ReachabilityGraph;

/**
 * Builds the coverability graph of a net from its initial marking.
 * An engine instance performs a single run.
 */
public interface ReachabilityEngine {

    String getName();

    ReachabilityGraph explore() throws ExplorationException;
}
