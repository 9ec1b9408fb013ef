package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.workers.WorkerContext;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes every message from its first input channel and logs it.
 */
public class LoggingSinkWorker extends AbstractWorker {

    private IInputChannel<Object> input;
    private final AtomicLong messagesReceived = new AtomicLong();

    public LoggingSinkWorker(Config options) {
        super(options);
    }

    @Override
    protected boolean setUp(WorkerContext context) {
        if (context.inputs().isEmpty()) {
            log.error("{} needs one input channel", context.replicaName());
            return false;
        }
        input = context.input(0);
        return true;
    }

    @Override
    protected void iterate(WorkerContext context) throws InterruptedException {
        Optional<Object> message = receive(input);
        if (message.isPresent()) {
            messagesReceived.incrementAndGet();
            log.info("{} received: {}", context.replicaName(), message.get());
        }
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_received", messagesReceived.get());
    }
}
