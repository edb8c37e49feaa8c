package com.h2blog.imageprocessor.exception;

import com.h2blog.imageprocessor.model.ConversionErrorKind;
import lombok.Getter;

import java.io.Serial;

/**
 * A failure of one stage of a single image's conversion, tagged with the stage that failed.
 */
@Getter
public class ImageConversionException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = -8830166172553407419L;

    private final ConversionErrorKind kind;

    public ImageConversionException(ConversionErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ImageConversionException(ConversionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
