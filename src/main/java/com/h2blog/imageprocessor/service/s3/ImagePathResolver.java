package com.h2blog.imageprocessor.service.s3;

import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.model.ImageFormat;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps images to object keys of the form {@code <prefix><name>.<extension>}.
 */
@Component
public class ImagePathResolver {

    private final String imagePrefix;

    @Autowired
    public ImagePathResolver(ImageProcessingConfig config) {
        this(config.getStorage().getImagePrefix());
    }

    public ImagePathResolver(String imagePrefix) {
        this.imagePrefix = imagePrefix == null ? "" : imagePrefix;
    }

    public String getImagePrefix() {
        return imagePrefix;
    }

    public String pathOf(ImageDescriptor image) {
        return imagePrefix + image.fileName();
    }

    /**
     * The inverse of {@link #pathOf(ImageDescriptor)}. Keys outside the prefix, nested keys and keys
     * with an unknown extension resolve to empty.
     */
    public Optional<ImageDescriptor> parse(String path) {
        if (path == null || !path.startsWith(imagePrefix)) {
            return Optional.empty();
        }
        String fileName = path.substring(imagePrefix.length());
        if (fileName.isEmpty() || fileName.contains("/")) {
            return Optional.empty();
        }
        String baseName = FilenameUtils.getBaseName(fileName);
        if (baseName.isEmpty()) {
            return Optional.empty();
        }
        return ImageFormat.fromExtension(FilenameUtils.getExtension(fileName))
                .map(format -> new ImageDescriptor(baseName, format));
    }
}
