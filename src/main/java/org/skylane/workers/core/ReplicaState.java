package org.skylane.workers.core;

/**
 * The lifecycle state of a single worker replica.
 */
public enum ReplicaState {
    /**
     * The replica has been allocated but not started.
     */
    NEW,
    /**
     * The replica thread is running its body.
     */
    RUNNING,
    /**
     * The body returned after exit was requested. This is the only clean outcome.
     */
    STOPPED,
    /**
     * The body returned before exit was requested, e.g. because its setup failed.
     */
    EXITED_EARLY,
    /**
     * The body terminated with an exception.
     */
    FAILED
}
