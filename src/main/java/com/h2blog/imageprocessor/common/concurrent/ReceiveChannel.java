package com.h2blog.imageprocessor.common.concurrent;

import java.time.Duration;
import java.util.Optional;

/**
 * The consuming side of a {@link BoundedChannel}. Handed out to readers that must not
 * send into or close the channel.
 *
 * @param <T> the element type
 */
public interface ReceiveChannel<T> {

    /**
     * Blocks until an element is available or the channel is closed and drained.
     *
     * @return the next element, or empty once the channel is closed and drained
     */
    Optional<T> receive() throws InterruptedException;

    /**
     * Like {@link #receive()} but gives up after {@code timeout}.
     *
     * @return the next element, or empty on timeout or when closed and drained
     */
    Optional<T> receive(Duration timeout) throws InterruptedException;

    /**
     * Takes the next element if one is buffered, without waiting.
     */
    Optional<T> tryReceive();

    boolean isClosed();

    int size();
}
