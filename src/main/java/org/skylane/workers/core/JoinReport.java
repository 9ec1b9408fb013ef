package org.skylane.workers.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of joining every replica of a {@link WorkerManager}.
 *
 * @param replicas The status of every replica, in spawn order.
 */
public record JoinReport(List<ReplicaStatus> replicas) {

    public JoinReport {
        replicas = List.copyOf(replicas);
    }

    /**
     * Returns whether every replica terminated after exit had been requested.
     *
     * @return {@code true} if the shutdown was clean
     */
    public boolean isClean() {
        return replicas.stream().allMatch(ReplicaStatus::isClean);
    }

    /**
     * Returns the replicas that hung, crashed or exited before exit was requested.
     *
     * @return The failed replicas, in spawn order.
     */
    public List<ReplicaStatus> failures() {
        return replicas.stream().filter(r -> !r.isClean()).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        if (isClean()) {
            return "JoinReport[all " + replicas.size() + " replicas stopped cleanly]";
        }
        return "JoinReport[" + failures().size() + " of " + replicas.size() + " replicas failed: " + failures() + "]";
    }
}
