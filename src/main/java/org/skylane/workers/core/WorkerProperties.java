package org.skylane.workers.core;

import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.IWorkerBodyFactory;
import org.skylane.workers.control.WorkerController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one pipeline stage: which body to run, how many replicas to run it
 * in, and which arguments, channels and controller every replica is bound to.
 * <p>
 * Instances are only obtained through {@link #create}, which validates the description and
 * reports an invalid one as an empty result.
 */
public final class WorkerProperties {

    private static final Logger log = LoggerFactory.getLogger(WorkerProperties.class);

    private final String name;
    private final IWorkerBodyFactory bodyFactory;
    private final int count;
    private final List<Object> workArguments;
    private final List<IInputChannel<?>> inputChannels;
    private final List<IOutputChannel<?>> outputChannels;
    private final WorkerController controller;

    private WorkerProperties(String name,
                             IWorkerBodyFactory bodyFactory,
                             int count,
                             List<Object> workArguments,
                             List<IInputChannel<?>> inputChannels,
                             List<IOutputChannel<?>> outputChannels,
                             WorkerController controller) {
        this.name = name;
        this.bodyFactory = bodyFactory;
        this.count = count;
        this.workArguments = workArguments;
        this.inputChannels = inputChannels;
        this.outputChannels = outputChannels;
        this.controller = controller;
    }

    /**
     * Creates a worker specification.
     *
     * @param name           The name of the stage, used for replica thread names and logs.
     * @param bodyFactory    Creates one body per replica.
     * @param count          The number of replicas, at least 1.
     * @param workArguments  Static arguments handed to every replica.
     * @param inputChannels  The ordered input channels.
     * @param outputChannels The ordered output channels.
     * @param controller     The control signal the replicas observe.
     * @return The specification, or {@link Optional#empty()} if any argument is invalid.
     */
    public static Optional<WorkerProperties> create(String name,
                                                    IWorkerBodyFactory bodyFactory,
                                                    int count,
                                                    List<?> workArguments,
                                                    List<? extends IInputChannel<?>> inputChannels,
                                                    List<? extends IOutputChannel<?>> outputChannels,
                                                    WorkerController controller) {
        String problem = validate(name, bodyFactory, count, workArguments, inputChannels, outputChannels, controller);
        if (problem != null) {
            log.error("Invalid worker properties for '{}': {}", name, problem);
            return Optional.empty();
        }
        return Optional.of(new WorkerProperties(
                name,
                bodyFactory,
                count,
                List.copyOf(workArguments),
                List.copyOf(inputChannels),
                List.copyOf(outputChannels),
                controller));
    }

    private static String validate(String name,
                                   IWorkerBodyFactory bodyFactory,
                                   int count,
                                   List<?> workArguments,
                                   List<?> inputChannels,
                                   List<?> outputChannels,
                                   WorkerController controller) {
        if (name == null || name.isBlank()) {
            return "name must not be blank";
        }
        if (bodyFactory == null) {
            return "worker body is missing";
        }
        if (count < 1) {
            return "count must be at least 1, got " + count;
        }
        if (controller == null) {
            return "controller is missing";
        }
        if (workArguments == null || inputChannels == null || outputChannels == null) {
            return "argument and channel lists must not be null";
        }
        if (workArguments.stream().anyMatch(Objects::isNull)) {
            return "work arguments must not contain null";
        }
        if (inputChannels.stream().anyMatch(Objects::isNull) || outputChannels.stream().anyMatch(Objects::isNull)) {
            return "channel lists must not contain null";
        }
        return null;
    }

    public String getName() {
        return name;
    }

    public IWorkerBodyFactory getBodyFactory() {
        return bodyFactory;
    }

    public int getCount() {
        return count;
    }

    public List<Object> getWorkArguments() {
        return workArguments;
    }

    public List<IInputChannel<?>> getInputChannels() {
        return inputChannels;
    }

    public List<IOutputChannel<?>> getOutputChannels() {
        return outputChannels;
    }

    public WorkerController getController() {
        return controller;
    }

    @Override
    public String toString() {
        return "WorkerProperties[" + name + " x" + count + ", inputs=" + inputChannels.size() + ", outputs=" + outputChannels.size() + "]";
    }
}
