package org.skylane.workers.channels;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.monitoring.IMonitorable;
import org.skylane.workers.api.monitoring.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread-safe, in-memory FIFO channel shared between pipeline stages.
 * <p>
 * A positive capacity bounds the channel with an {@link ArrayBlockingQueue}: a producer
 * putting into a full channel stalls until a consumer frees space or its timeout elapses,
 * which propagates backpressure upstream. A capacity of zero or less makes the channel
 * unbounded.
 * <p>
 * FIFO order holds per channel only; nothing is implied across distinct channels.
 *
 * @param <T> The type of message carried by the channel.
 */
public class BoundedChannel<T> implements IInputChannel<T>, IOutputChannel<T>, IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(BoundedChannel.class);

    /**
     * Capacity used when the configuration does not set one.
     */
    public static final int DEFAULT_CAPACITY = 10;

    private final String name;
    private final int capacity;
    private final BlockingQueue<T> queue;

    private final AtomicLong messagesPut = new AtomicLong();
    private final AtomicLong messagesTaken = new AtomicLong();
    private final AtomicLong putRejections = new AtomicLong();

    /**
     * Creates a channel with an explicit capacity.
     *
     * @param name     The name of the channel.
     * @param capacity The maximum number of queued messages, or {@code <= 0} for unbounded.
     */
    public BoundedChannel(String name, int capacity) {
        this(name, ConfigFactory.parseMap(Map.of("capacity", capacity)));
    }

    /**
     * Creates a channel from its HOCON options.
     *
     * @param name    The name of the channel.
     * @param options The channel options; {@code capacity} defaults to {@value #DEFAULT_CAPACITY}.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public BoundedChannel(String name, Config options) {
        this.name = Objects.requireNonNull(name, "Channel name cannot be null");
        Config finalConfig = Objects.requireNonNull(options, "Channel options cannot be null")
                .withFallback(ConfigFactory.parseMap(Map.of("capacity", DEFAULT_CAPACITY)));
        try {
            this.capacity = finalConfig.getInt("capacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for channel '" + name + "'", e);
        }
        this.queue = capacity > 0 ? new ArrayBlockingQueue<>(capacity) : new LinkedBlockingQueue<>();
        log.debug("Created channel '{}' with capacity {}", name, isBounded() ? capacity : "unbounded");
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Returns the configured capacity.
     *
     * @return the capacity, or a value {@code <= 0} if the channel is unbounded
     */
    public int capacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity > 0;
    }

    public int size() {
        return queue.size();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean put(T message, boolean block, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(message, "Channel messages cannot be null");
        boolean added;
        if (!block) {
            added = queue.offer(message);
        } else if (timeout == null) {
            queue.put(message);
            added = true;
        } else {
            added = queue.offer(message, timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        recordPut(added);
        return added;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Channel messages cannot be null");
        boolean added = queue.offer(message);
        recordPut(added);
        return added;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<T> get(boolean block, Duration timeout) throws InterruptedException {
        T message;
        if (!block) {
            message = queue.poll();
        } else if (timeout == null) {
            message = queue.take();
        } else {
            message = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        return taken(message);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<T> tryGet() {
        return taken(queue.poll());
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int drainTo(Collection<? super T> collection) {
        int count = queue.drainTo(collection);
        messagesTaken.addAndGet(count);
        return count;
    }

    /**
     * Removes every queued message.
     *
     * @return the removed messages in FIFO order
     */
    public List<T> drain() {
        List<T> drained = new ArrayList<>();
        drainTo(drained);
        return drained;
    }

    private void recordPut(boolean added) {
        if (added) {
            messagesPut.incrementAndGet();
        } else {
            putRejections.incrementAndGet();
        }
    }

    private Optional<T> taken(T message) {
        if (message == null) {
            return Optional.empty();
        }
        messagesTaken.incrementAndGet();
        return Optional.of(message);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("capacity", capacity);
        metrics.put("current_size", queue.size());
        metrics.put("messages_put", messagesPut.get());
        metrics.put("messages_taken", messagesTaken.get());
        metrics.put("put_rejections", putRejections.get());
        return metrics;
    }

    /**
     * {@inheritDoc}
     * A full or empty channel is a normal condition, so channels never report errors.
     */
    @Override
    public List<OperationalError> getErrors() {
        return List.of();
    }

    @Override
    public void clearErrors() {
        // Nothing to clear.
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    public String toString() {
        return "BoundedChannel[" + name + ", " + queue.size() + "/" + (isBounded() ? capacity : "unbounded") + "]";
    }
}
