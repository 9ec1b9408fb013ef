package org.skylane.workers.pipeline;

import com.typesafe.config.Config;
import org.skylane.workers.bodies.ConnectionStatus;
import org.skylane.workers.channels.BoundedChannel;
import org.skylane.workers.core.JoinReport;
import org.skylane.workers.core.ReplicaState;
import org.skylane.workers.core.ReplicaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The top-level orchestration routine: assembles the pipeline, lets it run, and shuts it down in
 * the required order (request exit, drain, join, reset).
 * <p>
 * The run ends when its duration elapses, when no replica is running any more, or when a sink
 * reports a {@link ConnectionStatus} that is disconnected.
 * <p>
 * Exit codes: {@value #EXIT_SETUP_FAILED} if the pipeline could not be set up, {@value #EXIT_OK} after a
 * clean run and {@value #EXIT_UNCLEAN_SHUTDOWN} if a replica did not stop cleanly or the run was interrupted.
 */
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_SETUP_FAILED = -1;
    public static final int EXIT_UNCLEAN_SHUTDOWN = 1;

    private final Config config;

    public PipelineRunner(Config config) {
        this.config = config;
    }

    /**
     * Runs the configured pipeline for its configured duration.
     *
     * @return the exit code
     */
    public int run() {
        Optional<Pipeline> assembled = PipelineAssembler.assemble(config);
        if (assembled.isEmpty()) {
            log.error("Pipeline setup failed");
            return EXIT_SETUP_FAILED;
        }
        Pipeline pipeline = assembled.get();
        return run(pipeline, pipeline.runDuration());
    }

    /**
     * Runs an assembled pipeline for the given duration.
     *
     * @param pipeline    The pipeline to run.
     * @param runDuration How long the workers run before shutdown starts.
     * @return the exit code
     */
    public int run(Pipeline pipeline, Duration runDuration) {
        pipeline.workerManager().startWorkers();
        log.info("Started");

        try {
            Instant end = Instant.now().plus(runDuration);
            boolean disconnected = false;
            while (!disconnected && Instant.now().isBefore(end) && pipeline.workerManager().isRunning()) {
                disconnected = readSinks(pipeline);
                if (!disconnected) {
                    Thread.sleep(pipeline.controller().getPollInterval().toMillis());
                }
            }
            if (!disconnected) {
                readSinks(pipeline);
            }
            return shutDown(pipeline);
        } catch (InterruptedException e) {
            log.warn("Interrupted while running the pipeline, shutting down");
            return shutDownAfterInterrupt(pipeline);
        }
    }

    private int shutDown(Pipeline pipeline) throws InterruptedException {
        JoinReport report = pipeline.workerManager().stopAll(pipeline.channels().values(), pipeline.joinTimeout());
        log.info("Stopped: {}", report);
        if (!report.isClean()) {
            return EXIT_UNCLEAN_SHUTDOWN;
        }
        pipeline.workerManager().resetControllers();
        return EXIT_OK;
    }

    /**
     * Runs the regular shutdown sequence once more after an interrupt, whose flag was cleared when
     * {@link InterruptedException} was thrown, then restores the flag for the caller.
     */
    private int shutDownAfterInterrupt(Pipeline pipeline) {
        try {
            JoinReport report = pipeline.workerManager().stopAll(pipeline.channels().values(), pipeline.joinTimeout());
            log.info("Stopped after interrupt: {}", report);
        } catch (InterruptedException e) {
            pipeline.workerManager().requestExitAll();
            List<String> alive = pipeline.workerManager().getReplicaStatuses().stream()
                    .filter(s -> s.state() == ReplicaState.RUNNING)
                    .map(ReplicaStatus::replicaName)
                    .collect(Collectors.toList());
            log.warn("Interrupted again during shutdown, replicas still running: {}", alive);
        } finally {
            Thread.currentThread().interrupt();
        }
        return EXIT_UNCLEAN_SHUTDOWN;
    }

    /**
     * Logs every message waiting in a sink channel.
     *
     * @return {@code true} if a sink reported a lost connection
     */
    private boolean readSinks(Pipeline pipeline) {
        boolean disconnected = false;
        for (BoundedChannel<Object> sink : pipeline.sinks()) {
            Optional<Object> message = sink.tryGet();
            while (message.isPresent()) {
                log.info("Main received: {}", message.get());
                if (message.get() instanceof ConnectionStatus && !((ConnectionStatus) message.get()).connected()) {
                    log.warn("Connection lost, stopping the pipeline early");
                    disconnected = true;
                }
                message = sink.tryGet();
            }
        }
        return disconnected;
    }
}
