package com.h2blog.imageprocessor.service.converter.transcode;

import com.h2blog.imageprocessor.common.concurrent.CancellationScope;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.exception.ImageConversionException;
import com.h2blog.imageprocessor.exception.ImageEncodingException;
import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;

/**
 * Converts an image to WebP, lowering the quality until the output fits the size limit.
 * <p>
 * The search is bounded: at most {@code max-attempts} encodes, never below {@code min-quality}.
 * The scope is checked before every re-encode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageTranscoder {

    private final ImageEncoder encoder;
    private final ImageProcessingConfig config;

    /**
     * @throws ImageConversionException with {@link ConversionErrorKind#CONVERT_ERROR} if the encoder fails, or
     *                                  {@link ConversionErrorKind#SIZE_LIMIT_EXCEEDED} if no attempt fits the limit.
     *                                  A scope cancelled between attempts also yields {@code CONVERT_ERROR}.
     */
    public byte[] transcode(ImageDescriptor image, byte[] source, CancellationScope scope) {
        ImageProcessingConfig.Webp webp = config.getWebp();
        long maxBytes = webp.getMaxSize().toBytes();
        int minQuality = Math.max(0, webp.getMinQuality());
        int step = Math.max(1, webp.getQualityStep());
        int attempts = Math.max(1, webp.getMaxAttempts());
        int quality = clamp(webp.getQuality(), minQuality);

        int lastSize = -1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                checkScope(scope, image, attempt);
            }
            byte[] encoded;
            try {
                encoded = encoder.encode(source, image.format(), quality, image.fileName());
            } catch (ImageEncodingException e) {
                throw new ImageConversionException(ConversionErrorKind.CONVERT_ERROR,
                        "Failed to encode '" + image.fileName() + "' at quality " + quality, e);
            }
            if (encoded.length <= maxBytes) {
                if (attempt > 1) {
                    log.info("[{}] Fitted under {} bytes at quality {} after {} attempts.", image, maxBytes, quality,
                            attempt);
                }
                return encoded;
            }
            lastSize = encoded.length;
            log.debug("[{}] Attempt {} at quality {} produced {} bytes, limit is {}.", image, attempt, quality,
                    encoded.length, maxBytes);
            if (quality == minQuality) {
                break;
            }
            quality = Math.max(minQuality, quality - step);
        }
        throw new ImageConversionException(ConversionErrorKind.SIZE_LIMIT_EXCEEDED, String.format(
                "'%s' is still %d bytes at quality %d, limit is %d bytes", image.fileName(), lastSize, quality,
                maxBytes));
    }

    private static void checkScope(CancellationScope scope, ImageDescriptor image, int attempt) {
        try {
            scope.throwIfCancelled();
        } catch (CancellationException e) {
            throw new ImageConversionException(ConversionErrorKind.CONVERT_ERROR,
                    "Aborted before attempt " + attempt + " for '" + image.fileName() + "': " + e.getMessage(), e);
        }
    }

    private static int clamp(int quality, int minQuality) {
        return Math.min(100, Math.max(minQuality, quality));
    }
}
