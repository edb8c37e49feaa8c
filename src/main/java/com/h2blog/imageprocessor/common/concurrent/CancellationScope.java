package com.h2blog.imageprocessor.common.concurrent;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A cancellable unit of work with an optional deadline.
 * <p>
 * Scopes form a tree: cancelling a scope cancels every scope derived from it, and a derived
 * scope never outlives its parent's deadline. Deadlines are checked lazily, no timer thread
 * is involved. Closing a scope cancels it and detaches it from its parent.
 */
public final class CancellationScope implements AutoCloseable {

    private static final String CLOSED_REASON = "scope closed";

    private final CancellationScope parent;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final Set<CancellationScope> children = ConcurrentHashMap.newKeySet();
    private volatile String cancelReason;

    private CancellationScope(CancellationScope parent, boolean hasDeadline, long deadlineNanos) {
        this.parent = parent;
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * A root scope with no deadline that is only cancelled explicitly.
     */
    public static CancellationScope create() {
        return new CancellationScope(null, false, 0L);
    }

    /**
     * A child scope that additionally expires after {@code timeout}. The effective deadline
     * is the earlier of this scope's deadline and now plus {@code timeout}.
     */
    public CancellationScope withTimeout(Duration timeout) {
        long candidate = System.nanoTime() + timeout.toNanos();
        long deadline = hasDeadline && deadlineNanos - candidate < 0 ? deadlineNanos : candidate;
        return register(new CancellationScope(this, true, deadline));
    }

    private CancellationScope register(CancellationScope child) {
        children.add(child);
        String reason = cancelReason;
        if (reason != null) {
            child.cancel(reason);
        }
        return child;
    }

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String reason) {
        if (cancelReason != null) {
            return;
        }
        synchronized (this) {
            if (cancelReason != null) {
                return;
            }
            cancelReason = reason;
        }
        for (CancellationScope child : children) {
            child.cancel(reason);
        }
        children.clear();
    }

    public boolean isCancelled() {
        return reason().isPresent();
    }

    /**
     * Why this scope is no longer live, if it is not.
     */
    public Optional<String> reason() {
        String reason = cancelReason;
        if (reason != null) {
            return Optional.of(reason);
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            return Optional.of("deadline exceeded");
        }
        if (parent != null) {
            return parent.reason();
        }
        return Optional.empty();
    }

    /**
     * @throws CancellationException if the scope was cancelled or its deadline has passed
     */
    public void throwIfCancelled() {
        Optional<String> reason = reason();
        if (reason.isPresent()) {
            throw new CancellationException(reason.get());
        }
    }

    /**
     * Time left until the deadline, or empty if the scope has none.
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(left > 0 ? Duration.ofNanos(left) : Duration.ZERO);
    }

    @Override
    public void close() {
        cancel(CLOSED_REASON);
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    int childCount() {
        return children.size();
    }
}
