package com.h2blog.imageprocessor.service.converter;

import com.h2blog.imageprocessor.common.concurrent.CancellationScope;
import com.h2blog.imageprocessor.exception.ImageConversionException;
import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.model.ImageFormat;
import com.h2blog.imageprocessor.service.converter.transcode.ImageTranscoder;
import com.h2blog.imageprocessor.service.s3.ImagePathResolver;
import com.h2blog.imageprocessor.service.s3.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;

/**
 * The four stages that turn a stored image into a stored WebP image:
 * download, transcode, upload, delete the original.
 * <p>
 * The scope is checked before every stage. A stage that has started runs to completion.
 * A failed delete leaves both the original and the WebP object in storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageConversionPipeline {

    private final ObjectStorage storage;
    private final ImageTranscoder transcoder;
    private final ImagePathResolver pathResolver;

    /**
     * @return the converted image
     * @throws ImageConversionException tagged with the stage that failed or was about to run
     */
    public ImageDescriptor convert(ImageDescriptor image, CancellationScope scope) {
        if (!image.format().isConvertible()) {
            log.debug("[{}] Already WebP, nothing to convert.", image);
            return image;
        }
        ImageDescriptor target = image.withFormat(ImageFormat.WEBP);
        String sourcePath = pathResolver.pathOf(image);
        String targetPath = pathResolver.pathOf(target);

        checkpoint(scope, image, ConversionErrorKind.DOWNLOAD_ERROR);
        byte[] source;
        try {
            source = storage.getObject(sourcePath);
        } catch (RuntimeException e) {
            throw new ImageConversionException(ConversionErrorKind.DOWNLOAD_ERROR,
                    "Failed to download '" + sourcePath + "'", e);
        }

        checkpoint(scope, image, ConversionErrorKind.CONVERT_ERROR);
        byte[] webp = transcoder.transcode(image, source, scope);

        checkpoint(scope, image, ConversionErrorKind.UPLOAD_ERROR);
        try {
            storage.putObject(targetPath, webp);
        } catch (RuntimeException e) {
            throw new ImageConversionException(ConversionErrorKind.UPLOAD_ERROR,
                    "Failed to upload '" + targetPath + "'", e);
        }

        checkpoint(scope, image, ConversionErrorKind.DELETE_ERROR);
        try {
            storage.deleteObject(sourcePath);
        } catch (RuntimeException e) {
            throw new ImageConversionException(ConversionErrorKind.DELETE_ERROR,
                    "Uploaded '" + targetPath + "' but failed to delete '" + sourcePath + "'", e);
        }

        log.info("[{}] Converted to WebP ({} -> {} bytes).", image, source.length, webp.length);
        return target;
    }

    private static void checkpoint(CancellationScope scope, ImageDescriptor image, ConversionErrorKind nextStage) {
        try {
            scope.throwIfCancelled();
        } catch (CancellationException e) {
            throw new ImageConversionException(nextStage,
                    "Aborted before " + nextStage + " for '" + image.fileName() + "': " + e.getMessage(), e);
        }
    }
}
