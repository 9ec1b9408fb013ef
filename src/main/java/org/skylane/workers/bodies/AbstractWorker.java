package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.monitoring.IMonitorable;
import org.skylane.workers.api.monitoring.OperationalError;
import org.skylane.workers.api.workers.IWorkerBody;
import org.skylane.workers.api.workers.WorkerContext;
import org.skylane.workers.control.WorkerController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An abstract base class for worker bodies, implementing the cooperative loop every worker runs:
 * <pre>
 * setUp → while exit not requested { checkPause; iterate } → tearDown
 * </pre>
 * Subclasses implement {@link #iterate(WorkerContext)} and use {@link #receive(IInputChannel)},
 * {@link #send(IOutputChannel, Object)} and {@link #pace(Duration)}, which never block longer than the
 * controller's poll interval, so an exit request is always observed promptly.
 * <p>
 * One instance serves exactly one replica; fields of subclasses are replica-local state.
 */
public abstract class AbstractWorker implements IWorkerBody, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final Config options;

    private volatile WorkerController controller;
    private final AtomicLong iterations = new AtomicLong();

    /**
     * Collection of transient errors that did not stop the worker.
     * Limited to {@link #getMaxErrors()} entries.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected AbstractWorker() {
        this(ConfigFactory.empty());
    }

    /**
     * Constructs a worker body with its configuration.
     *
     * @param options The configuration for this worker.
     */
    protected AbstractWorker(Config options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public final void run(WorkerContext context) throws InterruptedException {
        this.controller = context.controller();
        boolean ready;
        try {
            ready = setUp(context);
        } catch (RuntimeException e) {
            log.error("{} setup failed: {}", context.replicaName(), e.getMessage());
            log.debug("Exception details:", e);
            ready = false;
        }
        if (!ready) {
            log.error("{} could not be set up, not entering the work loop", context.replicaName());
            return;
        }
        log.info("{} started", context.replicaName());
        try {
            while (!controller.isExitRequested()) {
                controller.checkPause();
                if (controller.isExitRequested()) {
                    break;
                }
                try {
                    iterate(context);
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    log.warn("{} iteration failed: {}", context.replicaName(), e.getMessage());
                    log.debug("Exception details:", e);
                    recordError("ITERATION_FAILED", "Worker iteration failed", e.getClass().getSimpleName() + ": " + e.getMessage());
                }
                iterations.incrementAndGet();
            }
        } finally {
            tearDown(context);
        }
        log.info("{} terminated", context.replicaName());
    }

    /**
     * Performs the worker's own setup, such as opening connections or validating its channels.
     * A worker that cannot be set up returns {@code false} and never enters its loop.
     *
     * @param context The replica's context.
     * @return {@code true} if the worker is ready to run.
     */
    protected boolean setUp(WorkerContext context) {
        return true;
    }

    /**
     * One pass of the work loop. Exceptions other than {@link InterruptedException} are treated as
     * transient: they are logged and recorded, and the loop continues.
     *
     * @param context The replica's context.
     * @throws Exception if this iteration failed.
     */
    protected abstract void iterate(WorkerContext context) throws Exception;

    /**
     * Releases what {@link #setUp(WorkerContext)} acquired. Called once after the loop ends.
     *
     * @param context The replica's context.
     */
    protected void tearDown(WorkerContext context) {
        // Default: nothing to release
    }

    /**
     * Waits at most one poll interval for a message.
     *
     * @param channel The channel to read from.
     * @param <T>     The message type.
     * @return The message, or {@link Optional#empty()} if none arrived in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    protected <T> Optional<T> receive(IInputChannel<T> channel) throws InterruptedException {
        return channel.get(true, pollInterval());
    }

    /**
     * Puts a message, waiting for space in slices of one poll interval for as long as the worker
     * is not asked to exit. A full channel therefore stalls this worker instead of losing the message.
     *
     * @param channel The channel to write to.
     * @param message The message.
     * @param <T>     The message type.
     * @return {@code true} if the message was sent, {@code false} if exit was requested first.
     * @throws InterruptedException if interrupted while waiting.
     */
    protected <T> boolean send(IOutputChannel<T> channel, T message) throws InterruptedException {
        while (!isExitRequested()) {
            if (channel.put(message, true, pollInterval())) {
                return true;
            }
            log.debug("Channel '{}' is full, waiting for space", channel.getName());
        }
        log.debug("Exit requested, message for channel '{}' not sent", channel.getName());
        return false;
    }

    /**
     * Sleeps for the given duration in slices of one poll interval, returning early on exit.
     *
     * @param duration The time to wait.
     * @throws InterruptedException if interrupted while waiting.
     */
    protected void pace(Duration duration) throws InterruptedException {
        Instant end = Instant.now().plus(duration);
        while (!isExitRequested()) {
            Duration remaining = Duration.between(Instant.now(), end);
            if (remaining.isNegative() || remaining.isZero()) {
                return;
            }
            Duration slice = remaining.compareTo(pollInterval()) < 0 ? remaining : pollInterval();
            Thread.sleep(Math.max(1L, slice.toMillis()));
        }
    }

    protected boolean isExitRequested() {
        WorkerController c = controller;
        return c != null && c.isExitRequested();
    }

    protected Duration pollInterval() {
        WorkerController c = controller;
        return c != null ? c.getPollInterval() : WorkerController.DEFAULT_POLL_INTERVAL;
    }

    /**
     * Records a transient error for monitoring. Use only for errors the worker survives.
     *
     * @param code    Error code for categorization (e.g., "SEND_ERROR")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
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
        return errors.isEmpty();
    }

    /**
     * Returns base metrics plus whatever {@link #addCustomMetrics(Map)} adds.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("iterations", iterations.get());
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add worker-specific metrics. Call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
