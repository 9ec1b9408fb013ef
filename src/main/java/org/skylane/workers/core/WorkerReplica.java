package org.skylane.workers.core;

import org.skylane.workers.api.workers.IWorkerBody;
import org.skylane.workers.api.workers.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One running instance of a {@link WorkerProperties}, executed on its own thread.
 * <p>
 * The replica creates a fresh body from the properties' factory, runs it, and classifies how
 * the body ended. It never forces the body to stop: termination is cooperative through the
 * bound controller.
 */
final class WorkerReplica {

    private static final Logger log = LoggerFactory.getLogger(WorkerReplica.class);

    private final WorkerProperties properties;
    private final int index;
    private final AtomicReference<ReplicaState> state = new AtomicReference<>(ReplicaState.NEW);
    private volatile String failureDetail;
    private volatile Thread thread;

    WorkerReplica(WorkerProperties properties, int index) {
        this.properties = properties;
        this.index = index;
    }

    String name() {
        return properties.getName() + "-" + index;
    }

    ReplicaState state() {
        return state.get();
    }

    void start() {
        if (!state.compareAndSet(ReplicaState.NEW, ReplicaState.RUNNING)) {
            throw new IllegalStateException("Replica '" + name() + "' cannot be started in state " + state.get());
        }
        Thread t = new Thread(this::runReplica, name());
        // Hung replicas must not keep the JVM alive after the orchestrator gave up on them.
        t.setDaemon(true);
        thread = t;
        t.start();
        log.debug("Started replica '{}'", name());
    }

    boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    /**
     * Waits at most {@code timeout} for the replica thread to terminate.
     *
     * @return {@code true} if the thread is no longer alive
     */
    boolean join(Duration timeout) throws InterruptedException {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1L, timeout.toMillis()));
        return !t.isAlive();
    }

    ReplicaStatus status() {
        ReplicaState current = state.get();
        String detail = switch (current) {
            case NEW -> "never started";
            case RUNNING -> "still running";
            case STOPPED -> null;
            case EXITED_EARLY -> "returned before exit was requested";
            case FAILED -> failureDetail;
        };
        return new ReplicaStatus(properties.getName(), index, current, detail);
    }

    private void runReplica() {
        WorkerContext context = new WorkerContext(
                properties.getName(),
                index,
                properties.getWorkArguments(),
                properties.getInputChannels(),
                properties.getOutputChannels(),
                properties.getController());
        try {
            IWorkerBody body = properties.getBodyFactory().create();
            if (body == null) {
                throw new IllegalStateException("Body factory of worker '" + properties.getName() + "' returned null");
            }
            body.run(context);
        } catch (InterruptedException e) {
            log.debug("Replica '{}' interrupted, shutting down.", name());
            Thread.currentThread().interrupt();
        } catch (Exception | Error e) {
            failureDetail = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Replica '{}' failed with {}", name(), failureDetail);
            log.debug("Exception details:", e);
            state.set(ReplicaState.FAILED);
        } finally {
            if (state.get() != ReplicaState.FAILED) {
                state.set(properties.getController().isExitRequested() ? ReplicaState.STOPPED : ReplicaState.EXITED_EARLY);
            }
            log.debug("Replica '{}' terminated in state {}", name(), state.get());
        }
    }
}
