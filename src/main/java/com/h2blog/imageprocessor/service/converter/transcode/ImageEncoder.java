package com.h2blog.imageprocessor.service.converter.transcode;

import com.h2blog.imageprocessor.exception.ImageEncodingException;
import com.h2blog.imageprocessor.model.ImageFormat;

/**
 * Encodes raster images to WebP.
 */
public interface ImageEncoder {

    /**
     * @param source       the encoded source image
     * @param sourceFormat the format of {@code source}
     * @param quality      WebP quality, 0 to 100
     * @param contextInfo  a label for log lines, usually the image name
     * @return the WebP bytes
     * @throws ImageEncodingException if the encoder cannot produce an image
     */
    byte[] encode(byte[] source, ImageFormat sourceFormat, int quality, String contextInfo);
}
