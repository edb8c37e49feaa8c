package com.h2blog.imageprocessor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classifies why a single image failed to convert. The code is stable and exposed to clients.
 */
@Getter
@RequiredArgsConstructor
public enum ConversionErrorKind {
    /** The original could not be fetched. Nothing changed in storage. */
    DOWNLOAD_ERROR(0, true, false),
    /** The encoder failed. The original is intact and the task can be retried. */
    CONVERT_ERROR(1, true, false),
    /** The WebP output could not be stored. The original is intact. */
    UPLOAD_ERROR(2, true, false),
    /** The WebP output was stored but the original could not be removed. Both objects exist. */
    DELETE_ERROR(3, false, true),
    /** No quality level produced an output under the size limit. The original is intact. */
    SIZE_LIMIT_EXCEEDED(4, true, false),
    /** The worker failed unexpectedly. Storage state is unknown. */
    WORKER_CRASHED(5, false, true);

    private final int code;
    private final boolean originalIntact;
    private final boolean reconciliationNeeded;

    /**
     * Whether the failed image should still be recorded under its original format.
     * Download failures are excluded because nothing is known about the object.
     */
    public boolean keepsOriginalRecord() {
        return originalIntact && this != DOWNLOAD_ERROR;
    }
}
