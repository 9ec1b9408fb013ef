package org.skylane.workers.core;

import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.monitoring.IMonitorable;
import org.skylane.workers.api.monitoring.OperationalError;
import org.skylane.workers.control.WorkerController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Owns the lifecycle of every replica of every {@link WorkerProperties} in a pipeline.
 * <p>
 * Lifecycle: {@link #create} allocates {@code count} not-yet-started replicas per specification,
 * {@link #startWorkers()} spawns them, {@link #requestExitAll()} signals every bound controller,
 * {@link #joinAll(Duration)} waits a bounded time for each replica and reports the ones that did
 * not terminate cleanly, and {@link #resetControllers()} makes the controllers reusable.
 * <p>
 * Shutdown must happen in this order: request exit, drain the channels, join, reset.
 * {@link #stopAll(Collection, Duration)} performs the first three steps.
 */
public final class WorkerManager implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(WorkerManager.class);

    /**
     * Per-replica join timeout used by {@link #joinAll()}.
     */
    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private static final Duration DRAIN_SLICE = Duration.ofMillis(50);

    private final List<WorkerProperties> properties;
    private final List<WorkerReplica> replicas;
    private final List<WorkerController> controllers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    // Replica name and state of every failure already recorded, so repeated joins report it once.
    private final Set<String> recordedFailures = ConcurrentHashMap.newKeySet();

    private WorkerManager(List<WorkerProperties> properties) {
        this.properties = List.copyOf(properties);
        List<WorkerReplica> allReplicas = new ArrayList<>();
        for (WorkerProperties p : this.properties) {
            for (int i = 0; i < p.getCount(); i++) {
                allReplicas.add(new WorkerReplica(p, i));
            }
        }
        this.replicas = Collections.unmodifiableList(allReplicas);

        // Controllers may be shared between specifications; keep each instance once.
        Set<WorkerController> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        List<WorkerController> ordered = new ArrayList<>();
        for (WorkerProperties p : this.properties) {
            if (distinct.add(p.getController())) {
                ordered.add(p.getController());
            }
        }
        this.controllers = Collections.unmodifiableList(ordered);
    }

    /**
     * Creates a manager for the given worker specifications.
     *
     * @param workerProperties The specifications, at least one, none {@code null}.
     * @return The manager, or {@link Optional#empty()} if the list is empty or contains an invalid entry.
     */
    public static Optional<WorkerManager> create(List<WorkerProperties> workerProperties) {
        if (workerProperties == null || workerProperties.isEmpty()) {
            log.error("Cannot create a worker manager without worker properties");
            return Optional.empty();
        }
        if (workerProperties.stream().anyMatch(Objects::isNull)) {
            log.error("Cannot create a worker manager: worker properties contain null");
            return Optional.empty();
        }
        WorkerManager manager = new WorkerManager(workerProperties);
        log.info("Worker manager created with {} worker types and {} replicas",
                manager.properties.size(), manager.replicas.size());
        return Optional.of(manager);
    }

    /**
     * Spawns every replica. Replicas of one specification start in index order.
     *
     * @throws IllegalStateException if the workers were already started.
     */
    public void startWorkers() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Workers have already been started");
        }
        for (WorkerReplica replica : replicas) {
            replica.start();
        }
        log.info("Started {} worker replicas", replicas.size());
    }

    /**
     * Requests exit on every distinct controller bound to any specification.
     */
    public void requestExitAll() {
        for (WorkerController controller : controllers) {
            controller.requestExit();
        }
        log.info("Requested exit on {} controller(s)", controllers.size());
    }

    /**
     * Joins every replica with the {@linkplain #DEFAULT_JOIN_TIMEOUT default timeout}.
     *
     * @return The outcome of every replica.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     * @see #joinAll(Duration)
     */
    public JoinReport joinAll() throws InterruptedException {
        return joinAll(DEFAULT_JOIN_TIMEOUT);
    }

    /**
     * Waits for every replica to terminate, at most {@code perReplicaTimeout} per replica.
     * <p>
     * Never blocks indefinitely: a replica that is still alive after its timeout is reported as
     * {@link ReplicaState#RUNNING}, a crashed one as {@link ReplicaState#FAILED} and one that
     * returned before exit was requested as {@link ReplicaState#EXITED_EARLY}.
     *
     * @param perReplicaTimeout The maximum time to wait for each replica.
     * @return The outcome of every replica.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public JoinReport joinAll(Duration perReplicaTimeout) throws InterruptedException {
        return join(perReplicaTimeout, List.of());
    }

    /**
     * Performs the shutdown sequence: requests exit, drains the given channels and joins every
     * replica. The channels are drained again while waiting, so a producer that puts one last
     * message after the first drain cannot stay blocked on a full channel.
     *
     * @param channelsToDrain   Every channel that feeds a worker or that workers write to.
     * @param perReplicaTimeout The maximum time to wait for each replica.
     * @return The outcome of every replica.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public JoinReport stopAll(Collection<? extends IInputChannel<?>> channelsToDrain, Duration perReplicaTimeout) throws InterruptedException {
        requestExitAll();
        int drained = drain(channelsToDrain);
        log.info("Drained {} message(s) from {} channel(s)", drained, channelsToDrain.size());
        return join(perReplicaTimeout, channelsToDrain);
    }

    private JoinReport join(Duration perReplicaTimeout, Collection<? extends IInputChannel<?>> channelsToDrain) throws InterruptedException {
        Objects.requireNonNull(perReplicaTimeout, "perReplicaTimeout cannot be null");
        List<ReplicaStatus> statuses = new ArrayList<>();
        for (WorkerReplica replica : replicas) {
            Instant deadline = Instant.now().plus(perReplicaTimeout);
            boolean terminated = false;
            while (!terminated) {
                Duration remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    terminated = !replica.isAlive();
                    break;
                }
                if (channelsToDrain.isEmpty()) {
                    terminated = replica.join(remaining);
                    break;
                }
                terminated = replica.join(remaining.compareTo(DRAIN_SLICE) < 0 ? remaining : DRAIN_SLICE);
                drain(channelsToDrain);
            }
            ReplicaStatus status = replica.status();
            if (!terminated && status.state() == ReplicaState.RUNNING) {
                status = new ReplicaStatus(status.workerName(), status.replicaIndex(), ReplicaState.RUNNING,
                        "did not terminate within " + perReplicaTimeout.toMillis() + " ms");
            }
            if (!status.isClean()) {
                log.warn("Replica '{}' did not exit cleanly: {} ({})", status.replicaName(), status.state(), status.detail());
                recordError(status);
            }
            statuses.add(status);
        }
        JoinReport report = new JoinReport(statuses);
        if (report.isClean()) {
            log.info("All {} worker replicas stopped", statuses.size());
        } else {
            log.warn("{} of {} worker replicas did not stop cleanly", report.failures().size(), statuses.size());
        }
        return report;
    }

    private static int drain(Collection<? extends IInputChannel<?>> channels) {
        int drained = 0;
        List<Object> sink = new ArrayList<>();
        for (IInputChannel<?> channel : channels) {
            drained += channel.drainTo(sink);
            sink.clear();
        }
        return drained;
    }

    private void recordError(ReplicaStatus status) {
        if (!recordedFailures.add(status.replicaName() + ":" + status.state())) {
            return;
        }
        String errorType = status.state() == ReplicaState.FAILED ? "REPLICA_FAILED" : "REPLICA_UNCLEAN_EXIT";
        errors.add(new OperationalError(Instant.now(), errorType,
                "Replica '" + status.replicaName() + "' ended in state " + status.state(), status.detail()));
    }

    /**
     * Resets every distinct bound controller so it can be reused.
     *
     * @throws IllegalStateException if any replica is still alive.
     */
    public void resetControllers() {
        List<String> alive = replicas.stream().filter(WorkerReplica::isAlive).map(WorkerReplica::name).collect(Collectors.toList());
        if (!alive.isEmpty()) {
            throw new IllegalStateException("Cannot reset controllers while replicas are running: " + alive);
        }
        controllers.forEach(WorkerController::reset);
        log.debug("Reset {} controller(s)", controllers.size());
    }

    /**
     * Returns whether any replica thread is still alive.
     *
     * @return {@code true} if at least one replica is running
     */
    public boolean isRunning() {
        return replicas.stream().anyMatch(WorkerReplica::isAlive);
    }

    /**
     * Returns a snapshot of every replica's state, in spawn order.
     *
     * @return The replica statuses.
     */
    public List<ReplicaStatus> getReplicaStatuses() {
        return replicas.stream().map(WorkerReplica::status).collect(Collectors.toList());
    }

    public List<WorkerProperties> getWorkerProperties() {
        return properties;
    }

    public List<WorkerController> getControllers() {
        return controllers;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("replicas_total", replicas.size());
        metrics.put("replicas_running", replicas.stream().filter(WorkerReplica::isAlive).count());
        metrics.put("replicas_failed", replicas.stream().filter(r -> r.state() == ReplicaState.FAILED).count());
        metrics.put("error_count", errors.size());
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty() && replicas.stream().noneMatch(r -> r.state() == ReplicaState.FAILED);
    }
}
