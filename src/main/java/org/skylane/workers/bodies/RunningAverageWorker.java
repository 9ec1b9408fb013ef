package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.WorkerContext;

import java.util.Map;
import java.util.Optional;

/**
 * Reads numbers from its first input channel and writes the mean of every number this replica has
 * seen so far to its first output channel. The running sum is replica-local.
 */
public class RunningAverageWorker extends AbstractWorker {

    private IInputChannel<Number> input;
    private IOutputChannel<Double> output;
    private long count;
    private double sum;

    public RunningAverageWorker() {
        this(ConfigFactory.empty());
    }

    public RunningAverageWorker(Config options) {
        super(options);
    }

    @Override
    protected boolean setUp(WorkerContext context) {
        if (context.inputs().isEmpty() || context.outputs().isEmpty()) {
            log.error("{} needs one input and one output channel", context.replicaName());
            return false;
        }
        input = context.input(0);
        output = context.output(0);
        return true;
    }

    @Override
    protected void iterate(WorkerContext context) throws InterruptedException {
        Optional<Number> value = receive(input);
        if (value.isEmpty()) {
            return;
        }
        count++;
        sum += value.get().doubleValue();
        double average = sum / count;
        log.debug("Running average after {} values: {}", count, average);
        send(output, average);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("values_seen", count);
    }
}
