package com.h2blog.imageprocessor.scheduler;

import com.h2blog.imageprocessor.exception.StorageException;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.model.ImageFormat;
import com.h2blog.imageprocessor.service.converter.WebpConverter;
import com.h2blog.imageprocessor.service.s3.ImagePathResolver;
import com.h2blog.imageprocessor.service.s3.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes originals that already have a WebP sibling in storage.
 * <p>
 * A conversion whose final delete failed leaves both objects behind. This job finishes that delete.
 * It skips runs while a batch is in flight, since a running task legitimately has both objects for a moment.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuplicateOriginalCleanupScheduler {

    private final ObjectStorage storage;
    private final ImagePathResolver pathResolver;
    private final WebpConverter converter;

    @Scheduled(cron = "${app.scheduler.duplicate-cleanup}")
    public void scheduledCleanup() {
        removeDuplicatedOriginals();
    }

    /**
     * @return the number of originals deleted
     */
    public int removeDuplicatedOriginals() {
        if (!converter.isEmpty()) {
            log.info("Skipping duplicate original cleanup: a conversion batch is in flight.");
            return 0;
        }
        log.info("Running duplicate original cleanup under prefix '{}'.", pathResolver.getImagePrefix());

        List<ImageDescriptor> images = storage.listObjects(pathResolver.getImagePrefix()).stream()
                .map(pathResolver::parse)
                .flatMap(Optional::stream)
                .toList();
        Set<String> webpNames = images.stream()
                .filter(image -> image.format() == ImageFormat.WEBP)
                .map(ImageDescriptor::name)
                .collect(Collectors.toSet());
        List<ImageDescriptor> duplicates = images.stream()
                .filter(image -> image.format().isConvertible() && webpNames.contains(image.name()))
                .toList();

        if (duplicates.isEmpty()) {
            log.info("No duplicated originals found.");
            return 0;
        }

        log.warn("Found {} originals with a WebP sibling.", duplicates.size());
        int deleted = 0;
        for (ImageDescriptor duplicate : duplicates) {
            String path = pathResolver.pathOf(duplicate);
            try {
                storage.deleteObject(path);
                deleted++;
            } catch (StorageException e) {
                log.warn("Failed to delete duplicated original '{}': {}", path, e.getMessage());
            }
        }
        log.info("Finished duplicate original cleanup. Deleted {} of {} originals.", deleted, duplicates.size());
        return deleted;
    }
}
