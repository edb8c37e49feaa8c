package com.h2blog.imageprocessor.service.progress;

/**
 * Counters of the current batch. The fields are read independently, so a snapshot taken during
 * an update may be off by one between fields.
 */
public record ProgressSnapshot(long total, long success, long failed) {

    public long completed() {
        return success + failed;
    }

    public boolean isDone() {
        return total > 0 && completed() >= total;
    }
}
