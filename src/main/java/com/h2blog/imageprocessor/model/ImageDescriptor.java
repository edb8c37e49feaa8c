package com.h2blog.imageprocessor.model;

import static java.util.Objects.requireNonNull;

/**
 * Identifies an image in object storage by its base name and current format.
 *
 * @param name   the base name, without extension
 * @param format the current format
 */
public record ImageDescriptor(String name, ImageFormat format) {

    public ImageDescriptor {
        requireNonNull(name, "name");
        requireNonNull(format, "format");
    }

    public String fileName() {
        return name + "." + format.getExtension();
    }

    public ImageDescriptor withFormat(ImageFormat newFormat) {
        return new ImageDescriptor(name, newFormat);
    }

    @Override
    public String toString() {
        return fileName();
    }
}
