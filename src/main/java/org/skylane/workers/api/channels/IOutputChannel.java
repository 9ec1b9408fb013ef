package org.skylane.workers.api.channels;

import java.time.Duration;

/**
 * The sending side of a channel connecting two pipeline stages.
 * <p>
 * A full channel stalls its producer; a rejected put is reported through the return
 * value rather than an exception so that producers can re-check their controller.
 *
 * @param <T> The type of message this channel accepts.
 */
public interface IOutputChannel<T> {

    /**
     * Returns the name of the channel, used in logs and metrics.
     *
     * @return The channel name.
     */
    String getName();

    /**
     * Inserts a message at the tail of the channel.
     *
     * @param message the message to add, must not be {@code null}
     * @param block   {@code false} to fail immediately when full, {@code true} to wait for space
     * @param timeout the maximum time to wait when blocking, or {@code null} to wait indefinitely
     * @return {@code true} if the message was added, {@code false} if the channel stayed full
     * @throws InterruptedException if interrupted while waiting
     */
    boolean put(T message, boolean block, Duration timeout) throws InterruptedException;

    /**
     * Inserts a message if space is available right now.
     *
     * @param message the message to add, must not be {@code null}
     * @return {@code true} if the message was added, {@code false} if the channel is full
     */
    boolean offer(T message);
}
