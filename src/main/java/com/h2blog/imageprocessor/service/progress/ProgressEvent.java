package com.h2blog.imageprocessor.service.progress;

import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.service.converter.ConversionResult;

import java.time.Instant;

/**
 * One finished item, as seen by progress observers.
 */
public record ProgressEvent(ImageDescriptor image, boolean success, ConversionErrorKind errorKind, String message,
                            Instant timestamp) {

    public static ProgressEvent of(ConversionResult result) {
        return new ProgressEvent(result.image(), result.success(), result.errorKind(), result.errorMessage(),
                Instant.now());
    }
}
