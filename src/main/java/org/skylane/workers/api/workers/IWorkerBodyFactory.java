package org.skylane.workers.api.workers;

/**
 * Creates the body of a worker replica. Invoked once per replica, so state held in a body
 * is never shared between replicas.
 */
@FunctionalInterface
public interface IWorkerBodyFactory {
    IWorkerBody create();
}
