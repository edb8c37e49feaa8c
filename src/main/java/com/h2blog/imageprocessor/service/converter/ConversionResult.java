package com.h2blog.imageprocessor.service.converter;

import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageDescriptor;

/**
 * The outcome of one task. Exactly one result is published per task.
 *
 * @param batchId      the batch the task belonged to
 * @param image        the image as submitted
 * @param converted    the image after conversion, {@code null} on failure
 * @param success      whether every stage completed
 * @param errorKind    the failed stage, {@code null} on success
 * @param errorMessage a description of the failure, {@code null} on success
 */
public record ConversionResult(long batchId,
                               ImageDescriptor image,
                               ImageDescriptor converted,
                               boolean success,
                               ConversionErrorKind errorKind,
                               String errorMessage) {

    public static ConversionResult success(long batchId, ImageDescriptor image, ImageDescriptor converted) {
        return new ConversionResult(batchId, image, converted, true, null, null);
    }

    public static ConversionResult failure(long batchId, ImageDescriptor image, ConversionErrorKind kind,
                                           String message) {
        return new ConversionResult(batchId, image, null, false, kind, message);
    }
}
