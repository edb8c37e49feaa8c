package com.h2blog.imageprocessor.common.concurrent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * A fixed-capacity FIFO queue that can be closed.
 * <p>
 * Senders choose between a non-blocking {@link #trySend(Object)} and a waiting {@link #send(Object, Duration)}.
 * Closing wakes every waiting thread: blocked senders fail with {@link ChannelClosedException},
 * receivers drain what is left and then observe an empty result. A channel can be closed only once.
 *
 * @param <T> the element type
 */
public class BoundedChannel<T> implements ReceiveChannel<T> {

    private final String name;
    private final int capacity;
    private final ArrayDeque<T> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public BoundedChannel(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive, got " + capacity);
        }
        this.name = requireNonNull(name);
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Buffers {@code item} if there is room.
     *
     * @return {@code false} if the channel is full or closed
     */
    public boolean trySend(T item) {
        requireNonNull(item);
        lock.lock();
        try {
            if (closed || buffer.size() == capacity) {
                return false;
            }
            buffer.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buffers {@code item}, waiting up to {@code timeout} for room if the channel is full.
     *
     * @return {@code false} if there was still no room when the timeout elapsed
     * @throws ChannelClosedException if the channel is closed before the item could be buffered
     */
    public boolean send(T item, Duration timeout) throws InterruptedException {
        requireNonNull(item);
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() == capacity) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            if (closed) {
                throw new ChannelClosedException(name);
            }
            buffer.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every buffered element matching {@code filter}, keeping the order of the rest.
     *
     * @return the number of elements dropped
     */
    public int removeIf(Predicate<? super T> filter) {
        lock.lock();
        try {
            int before = buffer.size();
            buffer.removeIf(filter);
            int removed = before - buffer.size();
            if (removed > 0) {
                notFull.signalAll();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> receive(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> tryReceive() {
        lock.lock();
        try {
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel. Buffered elements stay receivable.
     *
     * @throws IllegalStateException if the channel was already closed
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Channel '" + name + "' was already closed.");
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    // caller holds the lock
    private Optional<T> dequeue() {
        T item = buffer.pollFirst();
        if (item != null) {
            notFull.signal();
        }
        return Optional.ofNullable(item);
    }

    @Override
    public String toString() {
        return "BoundedChannel[" + name + ", capacity=" + capacity + "]";
    }
}
