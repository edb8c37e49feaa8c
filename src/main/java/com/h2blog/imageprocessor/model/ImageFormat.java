package com.h2blog.imageprocessor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Image formats the blog accepts. Each format maps to the file extension used in object keys.
 */
@Getter
@RequiredArgsConstructor
public enum ImageFormat {
    JPG("jpg"),
    JPEG("jpeg"),
    PNG("png"),
    WEBP("webp");

    private final String extension;

    /**
     * Resolves a format from a file extension, ignoring case and a leading dot.
     */
    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        String lower = normalized.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.extension.equals(lower)).findFirst();
    }

    /**
     * Whether images in this format are candidates for WebP conversion.
     */
    public boolean isConvertible() {
        return this != WEBP;
    }
}
