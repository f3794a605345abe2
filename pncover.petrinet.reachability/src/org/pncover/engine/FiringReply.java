package org.pncover.engine;

import org.pncover.model.Marking;

/**
 * Worker to coordinator: the new local marking of one subnet for a
 * (origin, transition) request, or the failure that prevented computing it.
 */
final class FiringReply {
    final Marking origin;
    final int transition;
    final int subnetId;
    final int[] localMarking;
    final Throwable failure;

    private FiringReply(Marking origin, int transition, int subnetId, int[] localMarking, Throwable failure) {
        this.origin = origin;
        this.transition = transition;
        this.subnetId = subnetId;
        this.localMarking = localMarking;
        this.failure = failure;
    }

    static FiringReply success(FiringRequest request, int subnetId, int[] localMarking) {
        return new FiringReply(request.origin, request.transition, subnetId, localMarking, null);
    }

    static FiringReply failure(FiringRequest request, int subnetId, Throwable failure) {
        return new FiringReply(request.origin, request.transition, subnetId, null, failure);
    }

    boolean isFailure() {
        return failure != null;
    }

    MergeKey key() {
        return new MergeKey(origin, transition);
    }
}
