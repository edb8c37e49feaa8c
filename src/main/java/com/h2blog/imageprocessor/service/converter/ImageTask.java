package com.h2blog.imageprocessor.service.converter;

import com.h2blog.imageprocessor.common.concurrent.CancellationScope;
import com.h2blog.imageprocessor.model.ImageDescriptor;

/**
 * One image queued for conversion. Consumed by exactly one worker.
 *
 * @param batchId the batch the task belongs to
 * @param scope   the submitter's scope; cancelling it aborts the task at the next stage boundary
 * @param image   the image to convert
 */
public record ImageTask(long batchId, CancellationScope scope, ImageDescriptor image) {
}
