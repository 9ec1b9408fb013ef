package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.WorkerContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Emits a {@link Heartbeat} to its first output channel at a fixed interval.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>intervalMs</b>: Milliseconds between two heartbeats (default: 1000).</li>
 * </ul>
 */
public class HeartbeatWorker extends AbstractWorker {

    private final Duration interval;
    private IOutputChannel<Heartbeat> output;
    private long sequence;

    public HeartbeatWorker(Config options) {
        super(options);
        this.interval = Duration.ofMillis(options.hasPath("intervalMs") ? options.getLong("intervalMs") : 1000L);
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
    }

    @Override
    protected boolean setUp(WorkerContext context) {
        if (context.outputs().isEmpty()) {
            log.error("{} needs one output channel", context.replicaName());
            return false;
        }
        output = context.output(0);
        return true;
    }

    @Override
    protected void iterate(WorkerContext context) throws InterruptedException {
        if (send(output, new Heartbeat(context.replicaName(), sequence, Instant.now()))) {
            sequence++;
        }
        pace(interval);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("heartbeats_sent", sequence);
    }
}
