package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when the converter's input queue cannot take another task without blocking.
 */
public class QueueFullException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = -1049322871560338872L;

    public QueueFullException(String message) {
        super(message);
    }

    public QueueFullException(String message, Throwable cause) {
        super(message, cause);
    }
}
