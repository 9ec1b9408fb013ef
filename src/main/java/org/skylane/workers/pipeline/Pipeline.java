package org.skylane.workers.pipeline;

import org.skylane.workers.channels.BoundedChannel;
import org.skylane.workers.control.WorkerController;
import org.skylane.workers.core.WorkerManager;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * An assembled pipeline: its channels, the controller shared by its workers and the manager
 * owning the replicas.
 *
 * @param channels       Every channel by name, in declaration order.
 * @param sinks          The channels the orchestrator reads while the pipeline runs.
 * @param controller     The controller every worker of the pipeline is bound to.
 * @param workerManager  The manager owning all replicas.
 * @param joinTimeout    The per-replica join timeout used at shutdown.
 * @param runDuration    How long the orchestrator lets the workers run.
 */
public record Pipeline(
    Map<String, BoundedChannel<Object>> channels,
    List<BoundedChannel<Object>> sinks,
    WorkerController controller,
    WorkerManager workerManager,
    Duration joinTimeout,
    Duration runDuration
) {

    public BoundedChannel<Object> channel(String name) {
        BoundedChannel<Object> channel = channels.get(name);
        if (channel == null) {
            throw new IllegalArgumentException("Unknown channel '" + name + "'");
        }
        return channel;
    }
}
