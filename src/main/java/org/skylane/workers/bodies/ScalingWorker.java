package org.skylane.workers.bodies;

import com.typesafe.config.Config;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.WorkerContext;

import java.util.Optional;

/**
 * Reads integers from its first input channel and writes {@code value * factor} to its first output channel.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>factor</b>: Multiplier applied to every value (default: 2).</li>
 * </ul>
 */
public class ScalingWorker extends AbstractWorker {

    private final int factor;
    private IInputChannel<Integer> input;
    private IOutputChannel<Integer> output;

    public ScalingWorker(Config options) {
        super(options);
        this.factor = options.hasPath("factor") ? options.getInt("factor") : 2;
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
        Optional<Integer> value = receive(input);
        if (value.isPresent()) {
            send(output, value.get() * factor);
        }
    }
}
