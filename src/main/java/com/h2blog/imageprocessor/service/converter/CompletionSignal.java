package com.h2blog.imageprocessor.service.converter;

import java.time.Instant;

/**
 * Emitted once per batch when its last task has been accounted for. Says nothing about
 * how many tasks failed.
 */
public record CompletionSignal(long batchId, boolean success, String message, Instant timestamp) {
}
