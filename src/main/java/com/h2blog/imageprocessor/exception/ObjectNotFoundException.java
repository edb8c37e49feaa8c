package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a requested object does not exist in the object store.
 */
public class ObjectNotFoundException extends StorageException {
    @Serial
    private static final long serialVersionUID = 6408110532915744120L;

    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
