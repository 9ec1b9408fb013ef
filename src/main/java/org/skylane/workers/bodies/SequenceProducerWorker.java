package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.WorkerContext;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A source worker that writes consecutive integers to its first output channel.
 * After {@code maxMessages} messages, or once the next value would exceed {@link Integer#MAX_VALUE},
 * it keeps idling until exit is requested.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>start</b>: First value to emit (default: 1).</li>
 *   <li><b>maxMessages</b>: Number of values to emit, -1 for unlimited (default: -1). Smaller values are rejected.</li>
 *   <li><b>intervalMs</b>: Milliseconds between two values (default: 0).</li>
 * </ul>
 */
public class SequenceProducerWorker extends AbstractWorker {

    private final int start;
    private final long maxMessages;
    private final Duration interval;

    private IOutputChannel<Integer> output;
    private boolean exhausted;
    private final AtomicLong messagesSent = new AtomicLong();

    public SequenceProducerWorker(Config options) {
        super(options);
        this.start = options.hasPath("start") ? options.getInt("start") : 1;
        this.maxMessages = options.hasPath("maxMessages") ? options.getLong("maxMessages") : -1L;
        this.interval = Duration.ofMillis(options.hasPath("intervalMs") ? options.getLong("intervalMs") : 0L);
        if (maxMessages < -1) {
            throw new IllegalArgumentException("maxMessages must be -1 (unlimited) or at least 0, got " + maxMessages);
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
        long sent = messagesSent.get();
        long next = start + sent;
        if (next > Integer.MAX_VALUE && !exhausted) {
            exhausted = true;
            log.warn("{} reached Integer.MAX_VALUE after {} messages, no further values", context.replicaName(), sent);
        }
        if (exhausted || (maxMessages != -1 && sent >= maxMessages)) {
            pace(pollInterval());
            return;
        }
        int value = Math.toIntExact(next);
        if (send(output, value)) {
            messagesSent.incrementAndGet();
            log.debug("Sent {}", value);
            if (maxMessages != -1 && messagesSent.get() >= maxMessages) {
                log.info("{} reached its limit of {} messages", context.replicaName(), maxMessages);
            }
        }
        if (!interval.isZero()) {
            pace(interval);
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_sent", messagesSent.get());
    }
}
