package com.h2blog.imageprocessor.service;

import com.h2blog.imageprocessor.model.ImageRecord;
import com.h2blog.imageprocessor.repository.ImageRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Persists image metadata produced by conversion batches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageMetadataService {

    private final ImageRecordRepository imageRecordRepository;

    /**
     * Upserts the records by image id. Existing rows keep their creation time.
     *
     * @return the saved records
     */
    @Transactional
    @Retryable(retryFor = {TransientDataAccessException.class},
            maxAttemptsExpression = "#{${app.processing.metadata.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.metadata.retry.delay-ms}}"),
            listeners = {"imageMetadataRetryListener"})
    public List<ImageRecord> saveAll(Collection<ImageRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        // the last record for a name wins, matching the order results arrived in
        Map<String, ImageRecord> byId = records.stream()
                .collect(Collectors.toMap(ImageRecord::getImageId, Function.identity(), (first, second) -> second,
                        LinkedHashMap::new));
        Map<String, ImageRecord> existing = imageRecordRepository.findAllById(byId.keySet()).stream()
                .collect(Collectors.toMap(ImageRecord::getImageId, Function.identity()));

        List<ImageRecord> toSave = new ArrayList<>(byId.size());
        for (ImageRecord record : byId.values()) {
            ImageRecord current = existing.get(record.getImageId());
            if (current != null) {
                current.setImageFormat(record.getImageFormat());
                toSave.add(current);
            } else {
                toSave.add(record);
            }
        }
        List<ImageRecord> saved = imageRecordRepository.saveAll(toSave);
        log.info("Saved metadata for {} images ({} updated, {} new).", saved.size(), existing.size(),
                saved.size() - existing.size());
        return saved;
    }

    @Recover
    public List<ImageRecord> recover(TransientDataAccessException e, Collection<ImageRecord> records) {
        log.error("Saving metadata for {} images failed after all retry attempts.", records.size(), e);
        throw e;
    }
}
