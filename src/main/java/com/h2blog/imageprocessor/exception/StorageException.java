package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * Wraps failures reported by the object store.
 */
public class StorageException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = 2875021774391204437L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
