package org.skylane.workers.api.workers;

/**
 * The domain-specific logic run by one worker replica.
 * <p>
 * A body performs its own setup, then loops until its controller requests exit. On every
 * iteration it must call {@code checkPause()} on the controller and use only non-blocking or
 * timeout-bounded channel operations, so that an exit request is observed within a bounded
 * number of poll intervals. A body that fails its setup returns immediately without entering the loop.
 * <p>
 * Returning normally ends the replica; throwing marks the replica as failed.
 */
@FunctionalInterface
public interface IWorkerBody {

    /**
     * Runs the worker until exit is requested.
     *
     * @param context The arguments, channels and controller bound to this replica.
     * @throws InterruptedException if the replica thread is interrupted.
     */
    void run(WorkerContext context) throws InterruptedException;
}
