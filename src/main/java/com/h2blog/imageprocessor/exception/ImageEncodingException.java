package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when the external encoder fails to produce an image.
 */
public class ImageEncodingException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = -6628813051794212373L;

    public ImageEncodingException(String message) {
        super(message);
    }

    public ImageEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
