package org.pncover.logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;

/**
 * Exploration Event Logger
 *
 * Logs the events of one coverability run:
 * - Run lifecycle (start, drained, failed)
 * - Node creation and duplicate discards
 * - Omega widening of candidate markings
 * - Worker errors
 *
 * Each run owns its own instance so that concurrent runs (and tests) do not
 * mix their histories. Event counts are always kept; the full event history
 * only when enabled.
 */
public class ExplorationEventLogger {

    private static final Logger logger = Logger.getLogger(ExplorationEventLogger.class);

    public static final String RUN_STARTED = "RUN_STARTED";
    public static final String NODE_CREATED = "NODE_CREATED";
    public static final String MARKING_WIDENED = "MARKING_WIDENED";
    public static final String DUPLICATE_DISCARDED = "DUPLICATE_DISCARDED";
    public static final String NON_OWNER_REPLY_DISCARDED = "NON_OWNER_REPLY_DISCARDED";
    public static final String WORKER_ERROR = "WORKER_ERROR";
    public static final String RUN_DRAINED = "RUN_DRAINED";
    public static final String RUN_FAILED = "RUN_FAILED";

    private final String runId;
    private final List<ExplorationEvent> eventHistory = Collections.synchronizedList(new ArrayList<>());
    private final ConcurrentHashMap<String, AtomicInteger> eventCounts = new ConcurrentHashMap<>();

    private final boolean enableEventStorage;
    private volatile boolean enableLogging = true;

    public ExplorationEventLogger(String runId, boolean enableEventStorage) {
        this.runId = runId;
        this.enableEventStorage = enableEventStorage;
    }

    // ========== Run Lifecycle Events ==========

    public void logRunStarted(String engine, int places, int transitions, int subnets, String initialMarking) {
        String message = String.format(
            "RUN_STARTED: run=%s, engine=%s, places=%d, transitions=%d, subnets=%d, M0=%s",
            runId, engine, places, transitions, subnets, initialMarking
        );
        log(message);
        storeEvent(new ExplorationEvent(RUN_STARTED, null, message));
    }

    public void logRunDrained(int nodes, int edges, long dispatched, long elapsedMillis) {
        String message = String.format(
            "RUN_DRAINED: run=%s, nodes=%d, edges=%d, dispatched=%d, elapsed=%dms",
            runId, nodes, edges, dispatched, elapsedMillis
        );
        log(message);
        storeEvent(new ExplorationEvent(RUN_DRAINED, null, message));
    }

    public void logRunFailed(String reason, Exception e) {
        String message = String.format("RUN_FAILED: run=%s, reason=%s", runId, reason);
        logError(message, e);
        storeEvent(new ExplorationEvent(RUN_FAILED, null, message));
    }

    // ========== Exploration Events ==========

    public void logNodeCreated(String nodeName, String marking, String parentName, String transition) {
        String message = String.format(
            "NODE_CREATED: run=%s, node=%s, M=%s, parent=%s, via=%s",
            runId, nodeName, marking, parentName, transition
        );
        logDebug(message);
        storeEvent(new ExplorationEvent(NODE_CREATED, nodeName, message));
    }

    public void logMarkingWidened(String candidate, String canonical) {
        String message = String.format(
            "MARKING_WIDENED: run=%s, candidate=%s, canonical=%s",
            runId, candidate, canonical
        );
        logDebug(message);
        storeEvent(new ExplorationEvent(MARKING_WIDENED, null, message));
    }

    public void logDuplicateDiscarded(String existingNode, String marking, String transition) {
        String message = String.format(
            "DUPLICATE_DISCARDED: run=%s, existing=%s, M=%s, via=%s",
            runId, existingNode, marking, transition
        );
        logDebug(message);
        storeEvent(new ExplorationEvent(DUPLICATE_DISCARDED, existingNode, message));
    }

    public void logNonOwnerReplyDiscarded(int subnetId, String transition) {
        String message = String.format(
            "NON_OWNER_REPLY_DISCARDED: run=%s, subnet=%d, via=%s",
            runId, subnetId, transition
        );
        logTrace(message);
        storeEvent(new ExplorationEvent(NON_OWNER_REPLY_DISCARDED, null, message));
    }

    public void logWorkerError(String worker, String marking, String transition, Throwable e) {
        String message = String.format(
            "WORKER_ERROR: run=%s, worker=%s, M=%s, via=%s, error=%s",
            runId, worker, marking, transition, e.getMessage()
        );
        logError(message, e);
        storeEvent(new ExplorationEvent(WORKER_ERROR, worker, message));
    }

    // ========== Helper Methods ==========

    private void log(String message) {
        if (enableLogging) {
            logger.info(message);
        }
    }

    private void logDebug(String message) {
        if (enableLogging && logger.isDebugEnabled()) {
            logger.debug(message);
        }
    }

    private void logTrace(String message) {
        if (enableLogging && logger.isTraceEnabled()) {
            logger.trace(message);
        }
    }

    private void logError(String message, Throwable e) {
        if (enableLogging) {
            logger.error(message, e);
        }
    }

    private void storeEvent(ExplorationEvent event) {
        eventCounts.computeIfAbsent(event.getEventType(), k -> new AtomicInteger()).incrementAndGet();
        if (enableEventStorage) {
            eventHistory.add(event);
        }
    }

    // ========== Query Methods ==========

    public String getRunId() {
        return runId;
    }

    public List<ExplorationEvent> getEventHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    public List<ExplorationEvent> getEventsOfType(String eventType) {
        List<ExplorationEvent> matching = new ArrayList<>();
        for (ExplorationEvent event : getEventHistory()) {
            if (event.getEventType().equals(eventType)) {
                matching.add(event);
            }
        }
        return matching;
    }

    public int getEventCount(String eventType) {
        AtomicInteger count = eventCounts.get(eventType);
        return count == null ? 0 : count.get();
    }

    public Map<String, Integer> getEventCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        for (Map.Entry<String, AtomicInteger> entry : eventCounts.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().get());
        }
        return counts;
    }

    public void setEnableLogging(boolean enable) {
        this.enableLogging = enable;
    }

    // ========== Inner Classes ==========

    public static class ExplorationEvent {
        private final String eventType;
        private final String nodeName;
        private final String message;
        private final long timestamp;

        public ExplorationEvent(String eventType, String nodeName, String message) {
            this.eventType = eventType;
            this.nodeName = nodeName;
            this.message = message;
            this.timestamp = System.currentTimeMillis();
        }

        public String getEventType() { return eventType; }
        public String getNodeName() { return nodeName; }
        public String getMessage() { return message; }
        public long getTimestamp() { return timestamp; }

        @Override
        public String toString() {
            return String.format("[%d] %s: %s", timestamp, eventType, message);
        }
    }
}
