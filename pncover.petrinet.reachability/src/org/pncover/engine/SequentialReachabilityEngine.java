package org.pncover.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

import org.pncover.analysis.EnablementEvaluator;
import org.pncover.analysis.FiringEvaluator;
import org.pncover.analysis.OmegaWidening;
import org.pncover.exceptions.ExplorationException;
import org.pncover.graph.ReachabilityGraph;
import org.pncover.graph.ReachabilityNode;
import org.pncover.logger.ExplorationEventLogger;
import org.pncover.model.Marking;
import org.pncover.model.PetriNet;

/**
 * Breadth-first exploration of the whole net on the calling thread, without
 * subnet decomposition. Same enablement, firing and widening rules as the
 * coordinator; serves as the reference the concurrent engine is checked against.
 */
public class SequentialReachabilityEngine implements ReachabilityEngine {

    private final PetriNet net;
    private final EngineSettings settings;
    private final ExplorationEventLogger eventLogger;
    private boolean used;

    public SequentialReachabilityEngine(PetriNet net, EngineSettings settings) {
        this.net = net;
        this.settings = settings;
        this.eventLogger = new ExplorationEventLogger(UUID.randomUUID().toString().substring(0, 8),
                settings.isRecordEventHistory());
    }

    @Override
    public String getName() {
        return "sequential";
    }

    @Override
    public ReachabilityGraph explore() throws ExplorationException {
        if (used) {
            throw new IllegalStateException("Sequential engine already ran");
        }
        used = true;
        long start = System.currentTimeMillis();
        String omega = settings.getOmegaSymbol();
        Marking initial = net.getInitialMarking();
        eventLogger.logRunStarted(getName(), net.getPlaceCount(), net.getTransitionCount(), 1, initial.render(omega));

        ReachabilityGraph graph = new ReachabilityGraph(settings.getNodePrefix());
        List<Marking> history = new ArrayList<>();
        Deque<ReachabilityNode> frontier = new ArrayDeque<>();

        ReachabilityNode root = graph.addRoot(initial);
        history.add(initial);
        frontier.add(root);
        long fired = 0;

        while (!frontier.isEmpty()) {
            ReachabilityNode current = frontier.poll();
            for (int t : EnablementEvaluator.enabled(current.getMarking(), net)) {
                fired++;
                Marking candidate;
                try {
                    candidate = FiringEvaluator.fire(net, current.getMarking(), t);
                } catch (ArithmeticException e) {
                    String reason = "Token count overflow firing " + settings.getTransitionPrefix() + t + " at "
                            + current.getName() + " " + current.getMarking().render(omega);
                    eventLogger.logRunFailed(reason, e);
                    throw new ExplorationException(reason, null, e);
                }
                Marking canonical = OmegaWidening.widen(candidate, history);
                if (!canonical.equals(candidate)) {
                    eventLogger.logMarkingWidened(candidate.render(omega), canonical.render(omega));
                }
                ReachabilityNode existing = graph.getNode(canonical);
                if (existing != null) {
                    graph.addRevisitEdge(current, existing, t);
                    eventLogger.logDuplicateDiscarded(existing.getName(), canonical.render(omega),
                            settings.getTransitionPrefix() + t);
                    continue;
                }
                ReachabilityNode node = graph.addNode(canonical, current, t);
                history.add(canonical);
                eventLogger.logNodeCreated(node.getName(), canonical.render(omega), current.getName(),
                        settings.getTransitionPrefix() + t);
                frontier.add(node);
            }
        }

        eventLogger.logRunDrained(graph.getNodeCount(), graph.getEdgeCount(), fired,
                System.currentTimeMillis() - start);
        return graph;
    }

    public ExplorationEventLogger getEventLogger() {
        return eventLogger;
    }
}
