package com.h2blog.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a batch is submitted while another batch is still in flight.
 */
public class ConverterBusyException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = 5862130447091355721L;

    public ConverterBusyException(String message) {
        super(message);
    }

    public ConverterBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
