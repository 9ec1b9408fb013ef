package org.skylane.workers.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The shared control signal through which an orchestrator pauses, resumes and stops its workers.
 * <p>
 * Every replica bound to the same controller observes the same two flags, {@code paused} and
 * {@code exitRequested}. Cancellation is cooperative: a worker calls {@link #checkPause()} and
 * {@link #isExitRequested()} on every iteration of its loop. Once exit has been requested it stays
 * requested until {@link #reset()}, which must only be called after every bound worker has terminated.
 * <p>
 * This class is thread-safe.
 */
public class WorkerController {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    /**
     * Poll interval used when none is given explicitly.
     */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean exitRequested = new AtomicBoolean(false);
    private final Object pauseLock = new Object();
    private final Duration pollInterval;

    public WorkerController() {
        this(DEFAULT_POLL_INTERVAL);
    }

    /**
     * Creates a controller with a custom poll interval.
     *
     * @param pollInterval The upper bound between two checks of the flags while paused.
     *                     Workers also use it as their bounded receive timeout.
     * @throws IllegalArgumentException if the interval is not positive.
     */
    public WorkerController(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Requests all bound workers to suspend at their next {@link #checkPause()}.
     */
    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.debug("Workers paused");
        }
    }

    /**
     * Lets paused workers continue.
     */
    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.debug("Workers resumed");
        }
        wakeUp();
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Blocks the calling worker while the controller is paused.
     * <p>
     * Returns immediately if the controller is not paused. Otherwise it re-polls at most every
     * poll interval and returns as soon as the controller is resumed or exit is requested, so that
     * a worker paused at shutdown still terminates.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    public void checkPause() throws InterruptedException {
        if (!paused.get() || exitRequested.get()) {
            return;
        }
        long waitMillis = Math.max(1L, pollInterval.toMillis());
        synchronized (pauseLock) {
            while (paused.get() && !exitRequested.get()) {
                pauseLock.wait(waitMillis);
            }
        }
    }

    /**
     * Requests all bound workers to leave their loop. Idempotent.
     */
    public void requestExit() {
        if (exitRequested.compareAndSet(false, true)) {
            log.debug("Exit requested");
        }
        wakeUp();
    }

    public boolean isExitRequested() {
        return exitRequested.get();
    }

    /**
     * Restores both flags to {@code false} so the controller can be reused.
     * Only call this when no worker bound to the controller is running.
     */
    public void reset() {
        exitRequested.set(false);
        paused.set(false);
        wakeUp();
        log.debug("Controller reset");
    }

    private void wakeUp() {
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public String toString() {
        return "WorkerController[paused=" + paused.get() + ", exitRequested=" + exitRequested.get() + "]";
    }
}
