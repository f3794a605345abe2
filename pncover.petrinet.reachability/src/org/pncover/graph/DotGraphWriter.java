package org.pncover.graph;

import java.util.ArrayList;
import java.util.List;

import org.pncover.constants.ReachabilityConstants;

/**
 * Turns a reachability graph into export rows and Graphviz DOT text.
 *
 * Node labels carry the node name and the marking, with unbounded places shown
 * by a symbol rather than the numeric sentinel.
 */
public class DotGraphWriter {

    private final String omegaSymbol;
    private final String transitionPrefix;
    private final boolean includeRevisitEdges;

    public DotGraphWriter() {
        this(ReachabilityConstants.OMEGA_SYMBOL, ReachabilityConstants.TRANSITION_PREFIX, true);
    }

    public DotGraphWriter(String omegaSymbol, String transitionPrefix, boolean includeRevisitEdges) {
        this.omegaSymbol = omegaSymbol;
        this.transitionPrefix = transitionPrefix;
        this.includeRevisitEdges = includeRevisitEdges;
    }

    public String label(ReachabilityNode node) {
        return node.getName() + "\n" + node.getMarking().render(omegaSymbol);
    }

    public String transitionLabel(int transition) {
        return transitionPrefix + transition;
    }

    /**
     * One row per node in creation order; the root comes first and has no parent.
     */
    public List<GraphExportRow> exportRows(ReachabilityGraph graph) {
        List<GraphExportRow> rows = new ArrayList<>();
        for (ReachabilityNode node : graph.getNodes()) {
            if (node.isRoot()) {
                rows.add(new GraphExportRow(node.getName(), label(node), null, null));
            } else {
                rows.add(new GraphExportRow(node.getName(), label(node), node.getParent().getName(),
                        transitionLabel(node.getTransition())));
            }
        }
        return rows;
    }

    public String write(ReachabilityGraph graph) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph G {\n");

        List<GraphExportRow> rows = exportRows(graph);
        for (GraphExportRow row : rows) {
            dot.append("    ").append(row.name)
               .append(" [label=\"").append(escape(row.label)).append("\"];\n");
        }

        for (GraphExportRow row : rows) {
            if (row.hasParent()) {
                appendEdge(dot, row.parentName, row.name, row.transitionLabel);
            }
        }

        if (includeRevisitEdges) {
            for (ReachabilityEdge edge : graph.getRevisitEdges()) {
                appendEdge(dot, edge.from.getName(), edge.to.getName(), transitionLabel(edge.transition));
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    private static void appendEdge(StringBuilder dot, String from, String to, String label) {
        dot.append("    ").append(from).append(" -> ").append(to)
           .append(" [label=\"").append(escape(label)).append("\"];\n");
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
