package org.pncover.engine;

import java.util.Arrays;
import java.util.concurrent.BlockingQueue;

import org.apache.log4j.Logger;
import org.pncover.model.Subnet;

/**
 * Fires requested transitions on one subnet and posts the local result to the
 * shared result queue. Holds no exploration state; blocks only on its inbox.
 *
 * A failure while firing is sent back as an error reply so the coordinator can
 * stop the run instead of waiting forever for the missing reply.
 */
final class SubnetWorker implements Runnable {

    private static final Logger logger = Logger.getLogger(SubnetWorker.class);

    private final Subnet subnet;
    private final BlockingQueue<FiringRequest> inbox;
    private final BlockingQueue<FiringReply> results;
    private final SubnetFiring firing;

    private long processed;

    SubnetWorker(Subnet subnet, BlockingQueue<FiringRequest> inbox, BlockingQueue<FiringReply> results,
            SubnetFiring firing) {
        this.subnet = subnet;
        this.inbox = inbox;
        this.results = results;
        this.firing = firing;
    }

    @Override
    public void run() {
        logger.debug("Worker for subnet " + subnet.getId() + " started");
        try {
            while (true) {
                FiringRequest request = inbox.take();
                if (request.isShutdown()) {
                    break;
                }
                results.put(handle(request));
                processed++;
            }
        } catch (InterruptedException e) {
            logger.warn("Worker for subnet " + subnet.getId() + " interrupted, exiting");
            Thread.currentThread().interrupt();
        }
        logger.debug("Worker for subnet " + subnet.getId() + " stopped after " + processed + " requests");
    }

    private FiringReply handle(FiringRequest request) {
        try {
            int[] local = firing.fire(subnet, request.origin, request.transition);
            if (logger.isTraceEnabled()) {
                logger.trace("subnet " + subnet.getId() + " fired " + request + " -> "
                        + Arrays.toString(local));
            }
            return FiringReply.success(request, subnet.getId(), local);
        } catch (RuntimeException e) {
            return FiringReply.failure(request, subnet.getId(), e);
        }
    }

    int getSubnetId() {
        return subnet.getId();
    }
}
