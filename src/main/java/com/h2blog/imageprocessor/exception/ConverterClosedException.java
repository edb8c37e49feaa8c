package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a batch is submitted to a converter that has been shut down.
 */
public class ConverterClosedException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = -3310597642271953018L;

    public ConverterClosedException(String message) {
        super(message);
    }

    public ConverterClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
