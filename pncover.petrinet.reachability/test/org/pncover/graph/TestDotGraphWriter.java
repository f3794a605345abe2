package org.pncover.graph;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.pncover.model.Marking;

public class TestDotGraphWriter {

    private static ReachabilityGraph twoCycleGraph() {
        ReachabilityGraph graph = new ReachabilityGraph();
        ReachabilityNode root = graph.addRoot(Marking.of(1, 0));
        ReachabilityNode next = graph.addNode(Marking.of(0, 1), root, 0);
        graph.addRevisitEdge(next, root, 1);
        return graph;
    }

    @Test
    public void writesNodesThenEdges() {
        String expected = "digraph G {\n"
                + "    m_0 [label=\"m_0\\n[1, 0]\"];\n"
                + "    m_1 [label=\"m_1\\n[0, 1]\"];\n"
                + "    m_0 -> m_1 [label=\"t0\"];\n"
                + "    m_1 -> m_0 [label=\"t1\"];\n"
                + "}\n";
        Assert.assertEquals(expected, new DotGraphWriter().write(twoCycleGraph()));
    }

    @Test
    public void revisitEdgesCanBeLeftOut() {
        String dot = new DotGraphWriter("w", "T", false).write(twoCycleGraph());
        Assert.assertTrue(dot.contains("m_0 -> m_1 [label=\"T0\"]"));
        Assert.assertFalse(dot.contains("m_1 -> m_0"));
    }

    @Test
    public void showsOmegaAsSymbol() {
        ReachabilityGraph graph = new ReachabilityGraph();
        graph.addRoot(Marking.of(1, Marking.OMEGA));
        Assert.assertTrue(new DotGraphWriter().write(graph).contains("m_0\\n[1, ω]"));
        Assert.assertTrue(new DotGraphWriter("inf", "t", true).write(graph).contains("m_0\\n[1, inf]"));
        Assert.assertFalse(new DotGraphWriter().write(graph).contains("-1"));
    }

    @Test
    public void exportRowsFollowCreationOrder() {
        List<GraphExportRow> rows = new DotGraphWriter().exportRows(twoCycleGraph());
        Assert.assertEquals(2, rows.size());
        Assert.assertFalse(rows.get(0).hasParent());
        Assert.assertEquals("m_0", rows.get(1).parentName);
        Assert.assertEquals("t0", rows.get(1).transitionLabel);
        Assert.assertEquals("m_1\n[0, 1]", rows.get(1).label);
    }

    @Test
    public void escapesQuotesAndBackslashes() {
        Assert.assertEquals("a\\\"b\\\\c\\nd", DotGraphWriter.escape("a\"b\\c\nd"));
    }
}
