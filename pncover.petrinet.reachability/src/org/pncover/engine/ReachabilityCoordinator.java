package org.pncover.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;
import org.pncover.analysis.EnablementEvaluator;
import org.pncover.analysis.FiringEvaluator;
import org.pncover.analysis.OmegaWidening;
import org.pncover.constants.ReachabilityConstants;
import org.pncover.exceptions.ExplorationException;
import org.pncover.graph.ReachabilityGraph;
import org.pncover.graph.ReachabilityNode;
import org.pncover.logger.ExplorationEventLogger;
import org.pncover.model.Marking;
import org.pncover.model.PetriNet;
import org.pncover.model.SubnetDecomposition;
import org.pncover.model.TransitionOwnership;

/**
 * Concurrent coverability engine: one worker thread per subnet plus this
 * coordinator, running on the caller's thread.
 *
 * The coordinator is the single writer of the graph, the marking history, the
 * pending merges and the in-flight counter. Workers only see immutable
 * requests and answer on the shared result queue. All queues are unbounded, so
 * dispatching never blocks; the coordinator blocks only on the result queue.
 *
 * The run is over when the in-flight counter, incremented once per request
 * sent and decremented once per reply processed, returns to zero.
 */
public class ReachabilityCoordinator implements ReachabilityEngine {

    private static final Logger logger = Logger.getLogger(ReachabilityCoordinator.class);

    private final SubnetDecomposition decomposition;
    private final PetriNet net;
    private final TransitionOwnership ownership;
    private final EngineSettings settings;
    private final SubnetFiring firing;
    private final ExplorationEventLogger eventLogger;

    private final List<BlockingQueue<FiringRequest>> inboxes = new ArrayList<>();
    private final BlockingQueue<FiringReply> results = new LinkedBlockingQueue<>();
    private final List<Thread> workerThreads = new ArrayList<>();

    private final AtomicInteger inFlight = new AtomicInteger();
    private final Map<MergeKey, PendingMerge> pending = new HashMap<>();
    private final List<Marking> history = new ArrayList<>();
    private final int[][] consumption;
    private ReachabilityGraph graph;

    private volatile CoordinatorState state = CoordinatorState.NEW;
    private long dispatched;
    private long processed;
    private long merges;
    private int drainCount;

    public ReachabilityCoordinator(SubnetDecomposition decomposition, EngineSettings settings) {
        this(decomposition, settings, FiringEvaluator::fireLocal);
    }

    ReachabilityCoordinator(SubnetDecomposition decomposition, EngineSettings settings, SubnetFiring firing) {
        this.decomposition = decomposition;
        this.net = decomposition.getNet();
        this.ownership = decomposition.getOwnership();
        this.settings = settings;
        this.firing = firing;
        this.consumption = net.getConsumption();
        this.eventLogger = new ExplorationEventLogger(UUID.randomUUID().toString().substring(0, 8),
                settings.isRecordEventHistory());
    }

    @Override
    public String getName() {
        return "concurrent";
    }

    @Override
    public ReachabilityGraph explore() throws ExplorationException {
        if (state != CoordinatorState.NEW) {
            throw new IllegalStateException("Coordinator already ran (state " + state + ")");
        }
        long start = System.currentTimeMillis();
        eventLogger.logRunStarted(getName(), net.getPlaceCount(), net.getTransitionCount(),
                decomposition.getSubnetCount(), render(net.getInitialMarking()));

        startWorkers();
        try {
            seed();
            while (inFlight.get() > 0) {
                FiringReply reply = results.take();
                state = CoordinatorState.MERGING;
                processReply(reply);
                processed++;
                if (inFlight.decrementAndGet() == 0) {
                    drainCount++;
                }
            }
            if (!pending.isEmpty()) {
                throw new ExplorationException("Run drained with " + pending.size()
                        + " unmerged firings: " + pending.keySet());
            }
            state = CoordinatorState.DRAINED;
            eventLogger.logRunDrained(graph.getNodeCount(), graph.getEdgeCount(), dispatched,
                    System.currentTimeMillis() - start);
            return graph;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state = CoordinatorState.FAILED;
            eventLogger.logRunFailed("coordinator interrupted", e);
            throw new ExplorationException("Coordinator interrupted while waiting for replies", null, e);
        } catch (ExplorationException e) {
            state = CoordinatorState.FAILED;
            eventLogger.logRunFailed(e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            state = CoordinatorState.FAILED;
            eventLogger.logRunFailed("coordinator error: " + e, e);
            throw e;
        } finally {
            stopWorkers();
        }
    }

    private void startWorkers() {
        for (int id = 0; id < decomposition.getSubnetCount(); id++) {
            BlockingQueue<FiringRequest> inbox = new LinkedBlockingQueue<>();
            inboxes.add(inbox);
            SubnetWorker worker = new SubnetWorker(decomposition.getSubnet(id), inbox, results, firing);
            Thread thread = new Thread(worker, ReachabilityConstants.WORKER_THREAD_PREFIX + id);
            thread.setDaemon(true);
            workerThreads.add(thread);
        }
        for (Thread thread : workerThreads) {
            thread.start();
        }
        logger.debug("Started " + workerThreads.size() + " subnet workers");
    }

    private void stopWorkers() {
        for (BlockingQueue<FiringRequest> inbox : inboxes) {
            // after a failure there may still be queued work nobody will merge
            inbox.clear();
            inbox.add(FiringRequest.shutdown());
        }
        boolean interrupted = false;
        for (Thread thread : workerThreads) {
            while (thread.isAlive()) {
                try {
                    thread.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.debug("All " + workerThreads.size() + " subnet workers stopped");
    }

    private void seed() {
        state = CoordinatorState.SEEDING;
        graph = new ReachabilityGraph(settings.getNodePrefix());
        Marking initial = net.getInitialMarking();
        ReachabilityNode root = graph.addRoot(initial);
        history.add(initial);
        eventLogger.logNodeCreated(root.getName(), render(initial), null, null);
        dispatchEnabled(initial);
    }

    private void dispatchEnabled(Marking marking) {
        state = CoordinatorState.DISPATCHING;
        for (int t : EnablementEvaluator.enabled(marking, consumption)) {
            dispatch(marking, t);
        }
    }

    private void dispatch(Marking marking, int transition) {
        FiringRequest request = new FiringRequest(marking, transition);
        if (settings.getDispatchPolicy() == DispatchPolicy.OWNERS_ONLY) {
            for (int id : ownership.ownersOf(transition)) {
                send(id, request);
            }
        } else {
            for (int id = 0; id < inboxes.size(); id++) {
                send(id, request);
            }
        }
    }

    private void send(int subnetId, FiringRequest request) {
        inFlight.incrementAndGet();
        dispatched++;
        inboxes.get(subnetId).add(request);
    }

    private void processReply(FiringReply reply) throws ExplorationException {
        String worker = ReachabilityConstants.WORKER_THREAD_PREFIX + reply.subnetId;
        if (reply.isFailure()) {
            eventLogger.logWorkerError(worker, render(reply.origin), transitionLabel(reply.transition),
                    reply.failure);
            throw new ExplorationException("Subnet worker " + reply.subnetId + " failed firing "
                    + transitionLabel(reply.transition) + " at " + render(reply.origin), worker, reply.failure);
        }

        // non-owners only echo; recording them could open a merge that never completes
        if (!ownership.isOwner(reply.transition, reply.subnetId)) {
            eventLogger.logNonOwnerReplyDiscarded(reply.subnetId, transitionLabel(reply.transition));
            return;
        }

        MergeKey key = reply.key();
        PendingMerge merge = pending.computeIfAbsent(key, k -> new PendingMerge());
        if (!merge.record(reply.subnetId, reply.localMarking)) {
            logger.warn("Duplicate reply from subnet " + reply.subnetId + " for " + key + " ignored");
        }
        if (merge.replyCount() == ownership.ownerCount(reply.transition)) {
            pending.remove(key);
            completeMerge(key, merge);
        }
    }

    private void completeMerge(MergeKey key, PendingMerge merge) {
        merges++;
        Marking candidate = merge.mergeInto(key.origin, decomposition);
        Marking canonical = OmegaWidening.widen(candidate, history);
        if (!canonical.equals(candidate)) {
            eventLogger.logMarkingWidened(render(candidate), render(canonical));
        }

        ReachabilityNode origin = graph.getNode(key.origin);
        ReachabilityNode existing = graph.getNode(canonical);
        if (existing != null) {
            graph.addRevisitEdge(origin, existing, key.transition);
            eventLogger.logDuplicateDiscarded(existing.getName(), render(canonical), transitionLabel(key.transition));
            return;
        }

        ReachabilityNode node = graph.addNode(canonical, origin, key.transition);
        history.add(canonical);
        eventLogger.logNodeCreated(node.getName(), render(canonical), origin.getName(),
                transitionLabel(key.transition));
        dispatchEnabled(canonical);
    }

    private String render(Marking marking) {
        return marking.render(settings.getOmegaSymbol());
    }

    private String transitionLabel(int transition) {
        return settings.getTransitionPrefix() + transition;
    }

    // ========== Run statistics ==========

    public CoordinatorState getState() {
        return state;
    }

    /** Requests sent to workers. */
    public long getDispatchedCount() {
        return dispatched;
    }

    /** Replies taken off the result queue. */
    public long getProcessedCount() {
        return processed;
    }

    /** Firings whose owners all replied. */
    public long getMergeCount() {
        return merges;
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    public int getPendingMergeCount() {
        return pending.size();
    }

    /** How many times the in-flight counter reached zero after a decrement. */
    public int getDrainCount() {
        return drainCount;
    }

    public ExplorationEventLogger getEventLogger() {
        return eventLogger;
    }
}
