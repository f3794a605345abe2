package org.pncover.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pncover.constants.ReachabilityConstants;
import org.pncover.model.Marking;

/**
 * Nodes keyed by canonical marking, kept in creation order, plus the edges
 * between them. Grows monotonically: nodes and edges are only ever added.
 *
 * Not thread-safe. During a concurrent run the coordinator is its only writer.
 */
public final class ReachabilityGraph {

    private final String nodePrefix;
    private final Map<Marking, ReachabilityNode> nodes = new LinkedHashMap<>();
    private final List<ReachabilityEdge> edges = new ArrayList<>();
    private ReachabilityNode root;

    public ReachabilityGraph() {
        this(ReachabilityConstants.NODE_PREFIX);
    }

    public ReachabilityGraph(String nodePrefix) {
        this.nodePrefix = nodePrefix;
    }

    public ReachabilityNode addRoot(Marking initial) {
        if (root != null) {
            throw new IllegalStateException("Root already set to " + root);
        }
        root = newNode(initial, null, ReachabilityNode.NO_TRANSITION);
        return root;
    }

    /**
     * Adds the node for a marking not seen before, with its tree edge from parent.
     */
    public ReachabilityNode addNode(Marking marking, ReachabilityNode parent, int transition) {
        if (root == null) {
            throw new IllegalStateException("addRoot must be called first");
        }
        if (nodes.containsKey(marking)) {
            throw new IllegalArgumentException("Marking " + marking + " already has node " + nodes.get(marking));
        }
        ReachabilityNode node = newNode(marking, parent, transition);
        edges.add(new ReachabilityEdge(parent, node, transition, true));
        return node;
    }

    /**
     * Records that firing transition at from derived the marking of an existing node.
     */
    public ReachabilityEdge addRevisitEdge(ReachabilityNode from, ReachabilityNode to, int transition) {
        ReachabilityEdge edge = new ReachabilityEdge(from, to, transition, false);
        edges.add(edge);
        return edge;
    }

    private ReachabilityNode newNode(Marking marking, ReachabilityNode parent, int transition) {
        int index = nodes.size();
        ReachabilityNode node = new ReachabilityNode(index, nodePrefix + index, marking, parent, transition);
        nodes.put(marking, node);
        return node;
    }

    public ReachabilityNode getRoot() {
        return root;
    }

    public boolean contains(Marking marking) {
        return nodes.containsKey(marking);
    }

    /** Null when the marking has no node. */
    public ReachabilityNode getNode(Marking marking) {
        return nodes.get(marking);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    /** Nodes in creation order, root first. */
    public List<ReachabilityNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public Collection<Marking> getMarkings() {
        return Collections.unmodifiableCollection(nodes.keySet());
    }

    /** Edges that created a node, in creation order. */
    public List<ReachabilityEdge> getTreeEdges() {
        List<ReachabilityEdge> tree = new ArrayList<>();
        for (ReachabilityEdge edge : edges) {
            if (edge.treeEdge) {
                tree.add(edge);
            }
        }
        return tree;
    }

    public List<ReachabilityEdge> getRevisitEdges() {
        List<ReachabilityEdge> revisits = new ArrayList<>();
        for (ReachabilityEdge edge : edges) {
            if (!edge.treeEdge) {
                revisits.add(edge);
            }
        }
        return revisits;
    }

    /** Every edge in the order it was recorded. */
    public List<ReachabilityEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    @Override
    public String toString() {
        return String.format("ReachabilityGraph{nodes=%d, edges=%d}", nodes.size(), edges.size());
    }
}
