package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.WorkerContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Watches the heartbeats on its first input channel and reports the link state to its first
 * output channel.
 * <p>
 * Every heartbeat period that passes without a heartbeat counts as missed; a heartbeat resets the
 * count. The link is connected after the first heartbeat and disconnected once {@code maxMissed}
 * consecutive periods were missed. A {@link ConnectionStatus} is sent only when the state changes,
 * so the first status is either the first heartbeat or the first disconnect.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>intervalMs</b>: Expected milliseconds between two heartbeats (default: 1000).</li>
 *   <li><b>maxMissed</b>: Missed periods after which the link is disconnected (default: 3).</li>
 * </ul>
 */
public class HeartbeatMonitorWorker extends AbstractWorker {

    private final Duration interval;
    private final int maxMissed;

    private IInputChannel<Heartbeat> input;
    private IOutputChannel<ConnectionStatus> output;
    private Instant periodStart;
    private int missed;
    private Boolean reportedConnected;
    private long heartbeatsReceived;

    public HeartbeatMonitorWorker(Config options) {
        super(options);
        this.interval = Duration.ofMillis(options.hasPath("intervalMs") ? options.getLong("intervalMs") : 1000L);
        this.maxMissed = options.hasPath("maxMissed") ? options.getInt("maxMissed") : 3;
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        if (maxMissed < 1) {
            throw new IllegalArgumentException("maxMissed must be at least 1, got " + maxMissed);
        }
    }

    @Override
    protected boolean setUp(WorkerContext context) {
        if (context.inputs().isEmpty() || context.outputs().isEmpty()) {
            log.error("{} needs one input and one output channel", context.replicaName());
            return false;
        }
        input = context.input(0);
        output = context.output(0);
        periodStart = Instant.now();
        return true;
    }

    @Override
    protected void iterate(WorkerContext context) throws InterruptedException {
        Optional<Heartbeat> heartbeat = receive(input);
        Instant now = Instant.now();
        if (heartbeat.isPresent()) {
            heartbeatsReceived++;
            missed = 0;
            periodStart = now;
            report(context, true, now);
            return;
        }
        if (Duration.between(periodStart, now).compareTo(interval) >= 0) {
            missed++;
            periodStart = now;
            log.warn("{} missed a heartbeat. Count: {}", context.replicaName(), missed);
        }
        if (missed >= maxMissed) {
            report(context, false, now);
        }
    }

    private void report(WorkerContext context, boolean connected, Instant now) throws InterruptedException {
        if (reportedConnected != null && reportedConnected == connected) {
            return;
        }
        if (connected) {
            log.info("{} connection status: Connected", context.replicaName());
        } else {
            log.error("{} connection status: Disconnected after {} missed heartbeats", context.replicaName(), missed);
        }
        if (send(output, new ConnectionStatus(context.replicaName(), connected, missed, now))) {
            reportedConnected = connected;
        }
    }

    public boolean isConnected() {
        return Boolean.TRUE.equals(reportedConnected);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("heartbeats_received", heartbeatsReceived);
        metrics.put("missed_heartbeats", missed);
    }
}
