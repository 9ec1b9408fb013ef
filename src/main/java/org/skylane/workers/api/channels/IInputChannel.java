package org.skylane.workers.api.channels;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * The receiving side of a channel connecting two pipeline stages.
 * <p>
 * An empty result is a normal polling signal, not an error: workers call
 * {@link #get(boolean, Duration)} with a bounded timeout and re-check the exit
 * flag of their controller between attempts.
 *
 * @param <T> The type of message this channel delivers.
 */
public interface IInputChannel<T> {

    /**
     * Returns the name of the channel, used in logs and metrics.
     *
     * @return The channel name.
     */
    String getName();

    /**
     * Retrieves and removes the head of the channel.
     *
     * @param block   {@code false} to return immediately, {@code true} to wait for a message
     * @param timeout the maximum time to wait when blocking, or {@code null} to wait indefinitely
     * @return the head of the channel, or {@link Optional#empty()} if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> get(boolean block, Duration timeout) throws InterruptedException;

    /**
     * Retrieves and removes the head of the channel without waiting.
     *
     * @return the head of the channel, or {@link Optional#empty()} if the channel is empty
     */
    Optional<T> tryGet();

    /**
     * Returns whether the channel currently holds no messages.
     *
     * @return {@code true} if the channel is empty
     */
    boolean isEmpty();

    /**
     * Removes all currently available messages and adds them to the given collection in FIFO order.
     *
     * @param collection the collection to drain messages into
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection);
}
