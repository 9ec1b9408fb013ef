package org.skylane.workers.api.workers;

import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.control.WorkerController;

import java.util.List;

/**
 * Everything bound to a single worker replica: its static arguments, its ordered input and
 * output channels and the controller it must observe.
 *
 * @param workerName   The name of the worker specification this replica belongs to.
 * @param replicaIndex The index of the replica within its specification, starting at 0.
 * @param arguments    The static arguments, in declaration order.
 * @param inputs       The input channels, in declaration order.
 * @param outputs      The output channels, in declaration order.
 * @param controller   The control signal shared with the orchestrator.
 */
public record WorkerContext(
    String workerName,
    int replicaIndex,
    List<Object> arguments,
    List<IInputChannel<?>> inputs,
    List<IOutputChannel<?>> outputs,
    WorkerController controller
) {

    /**
     * Gets a static argument, ensuring it matches the expected type.
     *
     * @param index        The position of the argument.
     * @param expectedType The class of the expected argument type.
     * @param <T>          The expected type of the argument.
     * @return The argument.
     * @throws IllegalStateException if there is no such argument or it is of the wrong type.
     */
    public <T> T argument(int index, Class<T> expectedType) {
        if (index < 0 || index >= arguments.size()) {
            throw new IllegalStateException("Worker '" + workerName + "' has " + arguments.size() + " arguments, no argument at index " + index + ".");
        }
        Object argument = arguments.get(index);
        if (!expectedType.isInstance(argument)) {
            throw new IllegalStateException("Argument " + index + " of worker '" + workerName + "' is of type " + argument.getClass().getName() + ", but expected type is " + expectedType.getName());
        }
        return expectedType.cast(argument);
    }

    /**
     * Gets an input channel. The message type is not checked at runtime.
     *
     * @param index The position of the input channel.
     * @param <T>   The message type the caller expects on the channel.
     * @return The input channel.
     * @throws IllegalStateException if there is no such channel.
     */
    @SuppressWarnings("unchecked")
    public <T> IInputChannel<T> input(int index) {
        if (index < 0 || index >= inputs.size()) {
            throw new IllegalStateException("Worker '" + workerName + "' has " + inputs.size() + " input channels, no input at index " + index + ".");
        }
        return (IInputChannel<T>) inputs.get(index);
    }

    /**
     * Gets an output channel. The message type is not checked at runtime.
     *
     * @param index The position of the output channel.
     * @param <T>   The message type the caller puts on the channel.
     * @return The output channel.
     * @throws IllegalStateException if there is no such channel.
     */
    @SuppressWarnings("unchecked")
    public <T> IOutputChannel<T> output(int index) {
        if (index < 0 || index >= outputs.size()) {
            throw new IllegalStateException("Worker '" + workerName + "' has " + outputs.size() + " output channels, no output at index " + index + ".");
        }
        return (IOutputChannel<T>) outputs.get(index);
    }

    /**
     * Returns a name identifying this replica in logs, e.g. {@code doubler-0}.
     *
     * @return The replica name.
     */
    public String replicaName() {
        return workerName + "-" + replicaIndex;
    }
}
