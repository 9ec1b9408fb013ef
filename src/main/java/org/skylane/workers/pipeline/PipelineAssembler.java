package org.skylane.workers.pipeline;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.skylane.workers.api.workers.IWorkerBody;
import org.skylane.workers.api.workers.IWorkerBodyFactory;
import org.skylane.workers.channels.BoundedChannel;
import org.skylane.workers.control.WorkerController;
import org.skylane.workers.core.WorkerManager;
import org.skylane.workers.core.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link Pipeline} from the {@code pipeline} section of the configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * pipeline {
 *   pollIntervalMs = 100
 *   joinTimeoutMs = 5000
 *   runDurationSeconds = 10
 *   channels {
 *     numbers { capacity = 10 }
 *   }
 *   workers {
 *     producer {
 *       className = "org.skylane.workers.bodies.SequenceProducerWorker"
 *       count = 1
 *       inputs = []
 *       outputs = ["numbers"]
 *       options { maxMessages = 5 }
 *     }
 *   }
 *   sinks = ["numbers"]
 * }
 * </pre>
 * Worker classes implement {@link IWorkerBody} and provide a public constructor taking a
 * {@link Config} (the worker's {@code options}) or a public no-arg constructor. A new body is
 * created for every replica.
 */
public final class PipelineAssembler {

    private static final Logger log = LoggerFactory.getLogger(PipelineAssembler.class);
    private static final String PIPELINE_CONFIG_PATH = "pipeline";

    private PipelineAssembler() {
        // Utility class
    }

    /**
     * Assembles the pipeline described by the configuration.
     *
     * @param rootConfig The resolved application configuration.
     * @return The pipeline, or {@link Optional#empty()} if the configuration is invalid.
     */
    public static Optional<Pipeline> assemble(Config rootConfig) {
        if (!rootConfig.hasPath(PIPELINE_CONFIG_PATH)) {
            log.error("Configuration must contain a '{}' section", PIPELINE_CONFIG_PATH);
            return Optional.empty();
        }
        try {
            return assemblePipeline(rootConfig.getConfig(PIPELINE_CONFIG_PATH));
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Invalid pipeline configuration: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Pipeline> assemblePipeline(Config pipelineConfig) {
        Config config = pipelineConfig.withFallback(ConfigFactory.parseMap(Map.of(
                "pollIntervalMs", WorkerController.DEFAULT_POLL_INTERVAL.toMillis(),
                "joinTimeoutMs", WorkerManager.DEFAULT_JOIN_TIMEOUT.toMillis(),
                "runDurationSeconds", 10
        )));
        Duration pollInterval = Duration.ofMillis(config.getLong("pollIntervalMs"));
        Duration joinTimeout = Duration.ofMillis(config.getLong("joinTimeoutMs"));
        Duration runDuration = Duration.ofSeconds(config.getLong("runDurationSeconds"));
        WorkerController controller = new WorkerController(pollInterval);

        Map<String, BoundedChannel<Object>> channels = instantiateChannels(config);

        List<WorkerProperties> workerProperties = new ArrayList<>();
        Config workersConfig = config.hasPath("workers") ? config.getConfig("workers") : ConfigFactory.empty();
        for (String workerName : workersConfig.root().keySet()) {
            Optional<WorkerProperties> properties = buildWorker(workerName, workersConfig.getConfig(workerName), channels, controller);
            if (properties.isEmpty()) {
                log.error("Failed to set up worker '{}'", workerName);
                return Optional.empty();
            }
            workerProperties.add(properties.get());
        }

        List<BoundedChannel<Object>> sinks = new ArrayList<>();
        if (config.hasPath("sinks")) {
            for (String sinkName : config.getStringList("sinks")) {
                sinks.add(lookup(channels, sinkName, "sinks"));
            }
        }

        Optional<WorkerManager> manager = WorkerManager.create(workerProperties);
        if (manager.isEmpty()) {
            return Optional.empty();
        }
        log.info("Assembled pipeline with {} channels and {} workers", channels.size(), workerProperties.size());
        return Optional.of(new Pipeline(
                Collections.unmodifiableMap(channels),
                List.copyOf(sinks),
                controller,
                manager.get(),
                joinTimeout,
                runDuration));
    }

    private static Map<String, BoundedChannel<Object>> instantiateChannels(Config config) {
        Map<String, BoundedChannel<Object>> channels = new LinkedHashMap<>();
        if (!config.hasPath("channels")) {
            log.debug("No channels configured.");
            return channels;
        }
        Config channelsConfig = config.getConfig("channels");
        for (String channelName : channelsConfig.root().keySet()) {
            channels.put(channelName, new BoundedChannel<>(channelName, channelsConfig.getConfig(channelName)));
            log.debug("Instantiated channel '{}'", channelName);
        }
        return channels;
    }

    private static Optional<WorkerProperties> buildWorker(String workerName,
                                                          Config definition,
                                                          Map<String, BoundedChannel<Object>> channels,
                                                          WorkerController controller) {
        String className = definition.getString("className");
        int count = definition.hasPath("count") ? definition.getInt("count") : 1;
        Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();

        List<BoundedChannel<Object>> inputs = new ArrayList<>();
        for (String name : definition.hasPath("inputs") ? definition.getStringList("inputs") : List.<String>of()) {
            inputs.add(lookup(channels, name, workerName));
        }
        List<BoundedChannel<Object>> outputs = new ArrayList<>();
        for (String name : definition.hasPath("outputs") ? definition.getStringList("outputs") : List.<String>of()) {
            outputs.add(lookup(channels, name, workerName));
        }

        Optional<IWorkerBodyFactory> factory = bodyFactory(className, options);
        if (factory.isEmpty()) {
            return Optional.empty();
        }
        log.info("Built worker '{}' of type {} with {} replica(s)", workerName, className, count);
        return WorkerProperties.create(workerName, factory.get(), count, List.of(), inputs, outputs, controller);
    }

    private static BoundedChannel<Object> lookup(Map<String, BoundedChannel<Object>> channels, String name, String referrer) {
        BoundedChannel<Object> channel = channels.get(name);
        if (channel == null) {
            throw new IllegalArgumentException(String.format("'%s' references unknown channel '%s'", referrer, name));
        }
        return channel;
    }

    private static Optional<IWorkerBodyFactory> bodyFactory(String className, Config options) {
        Class<?> bodyClass;
        try {
            bodyClass = Class.forName(className);
        } catch (ClassNotFoundException e) {
            log.error("Worker class '{}' not found", className);
            return Optional.empty();
        }
        if (!IWorkerBody.class.isAssignableFrom(bodyClass)) {
            log.error("Worker class '{}' does not implement {}", className, IWorkerBody.class.getSimpleName());
            return Optional.empty();
        }
        Constructor<?> withOptions = findConstructor(bodyClass, Config.class);
        Constructor<?> noArgs = findConstructor(bodyClass);
        if (withOptions == null && noArgs == null) {
            log.error("Worker class '{}' needs a public (Config) or no-arg constructor", className);
            return Optional.empty();
        }
        return Optional.of(() -> {
            try {
                return (IWorkerBody) (withOptions != null ? withOptions.newInstance(options) : noArgs.newInstance());
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Failed to create an instance of worker '" + className + "'", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to create an instance of worker '" + className + "'", e);
            }
        });
    }

    private static Constructor<?> findConstructor(Class<?> type, Class<?>... parameterTypes) {
        try {
            return type.getConstructor(parameterTypes);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
