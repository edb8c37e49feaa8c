package com.h2blog.imageprocessor.service.progress;

import com.h2blog.imageprocessor.common.concurrent.BoundedChannel;
import com.h2blog.imageprocessor.common.concurrent.ReceiveChannel;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fans out per-item progress to registered observers and keeps batch counters.
 * <p>
 * Publishing never blocks: an observer whose queue is full or closed is dropped.
 * Structural changes to the registry take the write lock, publishing takes the read lock.
 */
@Slf4j
@Component
public class ProgressTracker {

    private final int observerQueueCapacity;
    private final Map<String, BoundedChannel<ProgressEvent>> observers = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong success = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    @Autowired
    public ProgressTracker(ImageProcessingConfig config) {
        this(config.getProgress().getObserverQueueCapacity());
    }

    public ProgressTracker(int observerQueueCapacity) {
        this.observerQueueCapacity = observerQueueCapacity;
    }

    /**
     * Registers an observer. An existing registration under the same id is replaced and its queue closed.
     */
    public ReceiveChannel<ProgressEvent> subscribe(String observerId) {
        BoundedChannel<ProgressEvent> queue = new BoundedChannel<>("progress-" + observerId, observerQueueCapacity);
        BoundedChannel<ProgressEvent> previous;
        lock.writeLock().lock();
        try {
            previous = observers.put(observerId, queue);
            if (previous != null) {
                previous.close();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            log.info("Observer '{}' re-subscribed. Previous queue closed.", observerId);
        } else {
            log.debug("Observer '{}' subscribed.", observerId);
        }
        return queue;
    }

    public void unsubscribe(String observerId) {
        lock.writeLock().lock();
        try {
            BoundedChannel<ProgressEvent> queue = observers.remove(observerId);
            if (queue != null) {
                queue.close();
                log.debug("Observer '{}' unsubscribed.", observerId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the observer only if it is still registered with {@code queue}, so a stale reader cannot
     * drop a newer subscription under the same id.
     */
    void unsubscribe(String observerId, ReceiveChannel<ProgressEvent> queue) {
        lock.writeLock().lock();
        try {
            if (observers.get(observerId) == queue) {
                observers.remove(observerId).close();
                log.debug("Observer '{}' unsubscribed.", observerId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void updateProgress(ProgressEvent event, boolean succeeded) {
        if (succeeded) {
            success.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }

        List<Map.Entry<String, BoundedChannel<ProgressEvent>>> dead = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Map.Entry<String, BoundedChannel<ProgressEvent>> entry : observers.entrySet()) {
                if (!entry.getValue().trySend(event)) {
                    dead.add(Map.entry(entry.getKey(), entry.getValue()));
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (dead.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, BoundedChannel<ProgressEvent>> entry : dead) {
                // it may have been replaced or removed since the read pass
                if (observers.get(entry.getKey()) == entry.getValue()) {
                    observers.remove(entry.getKey());
                    entry.getValue().close();
                    log.warn("Dropped observer '{}': its queue is full or closed.", entry.getKey());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProgressSnapshot getProgress() {
        return new ProgressSnapshot(total.get(), success.get(), failed.get());
    }

    /**
     * Starts counting a new batch. Observers stay registered.
     */
    public void reset(long batchTotal) {
        total.set(batchTotal);
        success.set(0);
        failed.set(0);
    }

    public int observerCount() {
        lock.readLock().lock();
        try {
            return observers.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
