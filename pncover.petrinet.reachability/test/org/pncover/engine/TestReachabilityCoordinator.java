package org.pncover.engine;

import java.util.HashSet;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;
import org.pncover.SampleNets;
import org.pncover.analysis.FiringEvaluator;
import org.pncover.exceptions.ExplorationException;
import org.pncover.graph.DotGraphComparator;
import org.pncover.graph.ReachabilityEdge;
import org.pncover.graph.ReachabilityGraph;
import org.pncover.graph.ReachabilityNode;
import org.pncover.logger.ExplorationEventLogger;
import org.pncover.model.Marking;
import org.pncover.model.SubnetDecomposition;

public class TestReachabilityCoordinator {

    private static final int W = Marking.OMEGA;

    private static ReachabilityCoordinator coordinator(SubnetDecomposition decomposition) {
        return new ReachabilityCoordinator(decomposition, EngineSettings.defaults().withEventHistory(true));
    }

    private static Set<Marking> markings(ReachabilityGraph graph) {
        return new HashSet<>(graph.getMarkings());
    }

    @Test(timeout = 30000)
    public void twoCycleAcrossTwoSubnets() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(SampleNets.twoCycleSplit());
        ReachabilityGraph graph = coordinator.explore();

        Assert.assertEquals(2, graph.getNodeCount());
        Assert.assertEquals(2, graph.getEdgeCount());
        Assert.assertEquals(Marking.of(1, 0), graph.getRoot().getMarking());
        ReachabilityNode second = graph.getNode(Marking.of(0, 1));
        Assert.assertEquals("m_1", second.getName());
        Assert.assertSame(graph.getRoot(), second.getParent());

        ReachabilityEdge back = graph.getRevisitEdges().get(0);
        Assert.assertSame(second, back.from);
        Assert.assertSame(graph.getRoot(), back.to);
        Assert.assertEquals(1, back.transition);
        Assert.assertEquals(CoordinatorState.DRAINED, coordinator.getState());
    }

    @Test(timeout = 30000)
    public void mutexWithSharedLockSubnet() throws Exception {
        ReachabilityGraph graph = coordinator(SampleNets.mutexSplit()).explore();

        Assert.assertEquals(new HashSet<>(SampleNets.mutexMarkings()), markings(graph));
        Assert.assertEquals(4, graph.getEdgeCount());
        Assert.assertEquals(2, graph.getTreeEdges().size());
        // both critical sections are never entered together
        for (Marking marking : graph.getMarkings()) {
            Assert.assertFalse(marking.get(3) == 1 && marking.get(4) == 1);
        }
    }

    @Test(timeout = 30000)
    public void unboundedPlaceIsWidened() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(SampleNets.unboundedProducerSplit());
        ReachabilityGraph graph = coordinator.explore();

        Assert.assertEquals(2, graph.getNodeCount());
        ReachabilityNode widened = graph.getNode(Marking.of(1, W));
        Assert.assertNotNull(widened);
        Assert.assertEquals(0, widened.getTransition());
        Assert.assertFalse(graph.contains(Marking.of(1, 1)));
        // t0 and t1 both lead back to [1, ω]
        Assert.assertEquals(2, graph.getRevisitEdges().size());

        ExplorationEventLogger events = coordinator.getEventLogger();
        Assert.assertEquals(1, events.getEventCount(ExplorationEventLogger.MARKING_WIDENED));
        Assert.assertEquals(2, events.getEventCount(ExplorationEventLogger.DUPLICATE_DISCARDED));
    }

    @Test(timeout = 30000)
    public void omegaNeverRevertsAlongEdges() throws Exception {
        ReachabilityGraph graph = coordinator(SampleNets.unboundedProducerSplit()).explore();
        for (ReachabilityEdge edge : graph.getEdges()) {
            Marking from = edge.from.getMarking();
            for (int p = 0; p < from.size(); p++) {
                if (from.isOmega(p)) {
                    Assert.assertTrue(edge.toString(), edge.to.getMarking().isOmega(p));
                }
            }
        }
    }

    @Test(timeout = 30000)
    public void predeclaredOmegaStaysOmega() throws Exception {
        ReachabilityGraph graph = coordinator(SubnetDecomposition.singleSubnet(SampleNets.omegaSource())).explore();
        Assert.assertEquals(2, graph.getNodeCount());
        Assert.assertTrue(graph.contains(Marking.of(W, 0)));
        Assert.assertTrue(graph.contains(Marking.of(W, W)));
    }

    @Test(timeout = 30000)
    public void duplicateMarkingGetsOneNode() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(SubnetDecomposition.singleSubnet(SampleNets.parallelArcs()));
        ReachabilityGraph graph = coordinator.explore();

        Assert.assertEquals(2, graph.getNodeCount());
        Assert.assertEquals(1, graph.getTreeEdges().size());
        Assert.assertEquals(1, graph.getRevisitEdges().size());
        Assert.assertEquals(1, coordinator.getEventLogger().getEventCount(ExplorationEventLogger.DUPLICATE_DISCARDED));
    }

    @Test(timeout = 30000)
    public void nothingEnabledDrainsImmediately() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(SubnetDecomposition.singleSubnet(SampleNets.dead()));
        ReachabilityGraph graph = coordinator.explore();

        Assert.assertEquals(1, graph.getNodeCount());
        Assert.assertEquals(0, graph.getEdgeCount());
        Assert.assertEquals(0, coordinator.getDispatchedCount());
        Assert.assertEquals(CoordinatorState.DRAINED, coordinator.getState());
    }

    @Test(timeout = 30000)
    public void everyRequestIsAnsweredOnce() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(SampleNets.unboundedProducerSplit());
        coordinator.explore();

        // t0 at the root, then t0 and t1 at [1, ω], each sent to both workers
        Assert.assertEquals(6, coordinator.getDispatchedCount());
        Assert.assertEquals(coordinator.getDispatchedCount(), coordinator.getProcessedCount());
        Assert.assertEquals(3, coordinator.getMergeCount());
        Assert.assertEquals(0, coordinator.getInFlightCount());
        Assert.assertEquals(0, coordinator.getPendingMergeCount());
        Assert.assertEquals(1, coordinator.getDrainCount());
        // subnet 0 does not own t1
        Assert.assertEquals(1, coordinator.getEventLogger()
                .getEventCount(ExplorationEventLogger.NON_OWNER_REPLY_DISCARDED));
    }

    @Test(timeout = 30000)
    public void ownersOnlyDispatchSendsFewerRequests() throws Exception {
        ReachabilityCoordinator all = coordinator(SampleNets.unboundedProducerSplit());
        ReachabilityCoordinator owners = new ReachabilityCoordinator(SampleNets.unboundedProducerSplit(),
                EngineSettings.defaults().withDispatchPolicy(DispatchPolicy.OWNERS_ONLY));

        ReachabilityGraph allGraph = all.explore();
        ReachabilityGraph ownersGraph = owners.explore();

        Assert.assertEquals(markings(allGraph), markings(ownersGraph));
        Assert.assertEquals(allGraph.getEdgeCount(), ownersGraph.getEdgeCount());
        Assert.assertEquals(5, owners.getDispatchedCount());
        Assert.assertEquals(0, owners.getEventLogger()
                .getEventCount(ExplorationEventLogger.NON_OWNER_REPLY_DISCARDED));
    }

    @Test(timeout = 60000)
    public void repeatedRunsAgree() throws Exception {
        EngineSettings settings = EngineSettings.defaults();
        String reference = settings.newDotWriter().write(new ReachabilityCoordinator(SampleNets.mutexSplit(),
                settings).explore());
        for (int run = 0; run < 20; run++) {
            String dot = settings.newDotWriter().write(new ReachabilityCoordinator(SampleNets.mutexSplit(),
                    settings).explore());
            Assert.assertTrue("run " + run, DotGraphComparator.sameNodeMarkings(reference, dot));
        }
    }

    @Test(timeout = 30000)
    public void workerFailureStopsTheRun() throws Exception {
        SubnetFiring failing = (subnet, marking, t) -> {
            if (subnet.getId() == 1) {
                throw new IllegalStateException("boom");
            }
            return FiringEvaluator.fireLocal(subnet, marking, t);
        };
        ReachabilityCoordinator coordinator = new ReachabilityCoordinator(SampleNets.mutexSplit(),
                EngineSettings.defaults(), failing);
        try {
            coordinator.explore();
            Assert.fail("failure not reported");
        } catch (ExplorationException e) {
            Assert.assertEquals("subnet-worker-1", e.getSubject());
            Assert.assertEquals("boom", e.getCause().getMessage());
        }
        Assert.assertEquals(CoordinatorState.FAILED, coordinator.getState());
        Assert.assertTrue(coordinator.getState().isTerminal());
        Assert.assertEquals(1, coordinator.getEventLogger().getEventCount(ExplorationEventLogger.WORKER_ERROR));
        Assert.assertEquals(1, coordinator.getEventLogger().getEventCount(ExplorationEventLogger.RUN_FAILED));
    }

    @Test(timeout = 30000)
    public void tokenOverflowFailsTheRun() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(
                SubnetDecomposition.singleSubnet(SampleNets.saturatedCounter()));
        try {
            coordinator.explore();
            Assert.fail("overflow not reported");
        } catch (ExplorationException e) {
            Assert.assertEquals("subnet-worker-0", e.getSubject());
            Assert.assertTrue(e.getCause() instanceof ArithmeticException);
        }
        Assert.assertEquals(CoordinatorState.FAILED, coordinator.getState());
        Assert.assertEquals(1, coordinator.getEventLogger().getEventCount(ExplorationEventLogger.RUN_FAILED));
        // only the root was created
        Assert.assertEquals(1, coordinator.getEventLogger().getEventCount(ExplorationEventLogger.NODE_CREATED));
    }

    @Test(timeout = 30000)
    public void coordinatorRunsOnlyOnce() throws Exception {
        ReachabilityCoordinator coordinator = coordinator(SampleNets.twoCycleSplit());
        coordinator.explore();
        try {
            coordinator.explore();
            Assert.fail("second run allowed");
        } catch (IllegalStateException e) {
            Assert.assertTrue(e.getMessage().contains("DRAINED"));
        }
    }

    @Test(timeout = 30000)
    public void customNodePrefixIsUsed() throws Exception {
        EngineSettings settings = EngineSettings.fromXml(
                "<ReachabilitySettings><EngineSettings><nodePrefix>s</nodePrefix></EngineSettings></ReachabilitySettings>");
        ReachabilityGraph graph = new ReachabilityCoordinator(SampleNets.twoCycleSplit(), settings).explore();
        Assert.assertEquals("s0", graph.getRoot().getName());
        Assert.assertEquals("s1", graph.getNode(Marking.of(0, 1)).getName());
    }
}
