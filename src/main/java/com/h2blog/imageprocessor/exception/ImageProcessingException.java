package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the image processing back end.
 */
public class ImageProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7215394120938451106L;

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
