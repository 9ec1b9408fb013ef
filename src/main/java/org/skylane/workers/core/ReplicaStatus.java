package org.skylane.workers.core;

/**
 * A snapshot of one replica's state.
 *
 * @param workerName   The name of the worker specification.
 * @param replicaIndex The index of the replica within its specification.
 * @param state        The state at the time of the snapshot.
 * @param detail       Why the replica is not cleanly stopped, or {@code null} if it is.
 */
public record ReplicaStatus(String workerName, int replicaIndex, ReplicaState state, String detail) {

    public String replicaName() {
        return workerName + "-" + replicaIndex;
    }

    public boolean isClean() {
        return state == ReplicaState.STOPPED;
    }

    @Override
    public String toString() {
        return detail == null ? replicaName() + " " + state : replicaName() + " " + state + ": " + detail;
    }
}
