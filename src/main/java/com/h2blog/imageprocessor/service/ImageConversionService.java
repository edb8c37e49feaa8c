package com.h2blog.imageprocessor.service;

import com.h2blog.imageprocessor.common.concurrent.CancellationScope;
import com.h2blog.imageprocessor.common.concurrent.ReceiveChannel;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.dto.conversion.response.ConverterStatusResponse;
import com.h2blog.imageprocessor.dto.conversion.response.ImageConversionReport;
import com.h2blog.imageprocessor.dto.conversion.response.ImageOutcome;
import com.h2blog.imageprocessor.exception.QueueFullException;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.model.ImageRecord;
import com.h2blog.imageprocessor.service.converter.CompletionSignal;
import com.h2blog.imageprocessor.service.converter.ConversionResult;
import com.h2blog.imageprocessor.service.converter.WebpConverter;
import com.h2blog.imageprocessor.service.progress.ProgressEvent;
import com.h2blog.imageprocessor.service.progress.ProgressTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts a batch of stored images to WebP and records the outcome.
 * <p>
 * Submits the batch to the {@link WebpConverter}, drains its results, feeds the {@link ProgressTracker}
 * and persists one {@link ImageRecord} per image whose stored format is known afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageConversionService {

    private static final Duration RESULT_POLL_INTERVAL = Duration.ofMillis(200);

    private final WebpConverter converter;
    private final ProgressTracker progressTracker;
    private final ImageMetadataService metadataService;
    private final ImageProcessingConfig config;

    public ImageConversionReport convertAndStore(List<ImageDescriptor> images) throws InterruptedException {
        return convertAndStore(images, CancellationScope.create());
    }

    /**
     * Runs one batch to completion, or until {@code scope} is cancelled, in which case the report covers
     * only the results received so far and the rest of the batch is abandoned.
     *
     * @throws QueueFullException if the batch is larger than the converter's input queue
     */
    public ImageConversionReport convertAndStore(List<ImageDescriptor> images, CancellationScope scope)
            throws InterruptedException {
        if (images.isEmpty()) {
            return ImageConversionReport.empty();
        }
        if (!config.getWebp().isEnabled()) {
            log.info("WebP conversion is disabled. Recording {} images in their original format.", images.size());
            metadataService.saveAll(images.stream().map(ImageRecord::of).toList());
            return ImageConversionReport.builder()
                    .success(images.stream().map(ImageConversionService::unconverted).toList())
                    .build();
        }

        int queueCapacity = config.getConverter().getQueueCapacity();
        if (images.size() > queueCapacity) {
            throw new QueueFullException(String.format(
                    "A batch holds at most %d images, got %d.", queueCapacity, images.size()));
        }

        progressTracker.reset(images.size());
        long batchId = converter.addBatchTasks(images, scope);
        List<ConversionResult> results = collectResults(batchId, images.size(), scope);

        List<ImageRecord> records = new ArrayList<>(results.size());
        List<ImageOutcome> success = new ArrayList<>();
        List<ImageOutcome> failure = new ArrayList<>();
        for (ConversionResult result : results) {
            if (result.success()) {
                records.add(ImageRecord.of(result.converted()));
                success.add(ImageOutcome.from(result));
            } else {
                if (result.errorKind().keepsOriginalRecord()) {
                    records.add(ImageRecord.of(result.image()));
                }
                failure.add(ImageOutcome.from(result));
            }
        }
        metadataService.saveAll(records);

        log.info("Batch {} finished: {} converted, {} failed, {} without a result.", batchId, success.size(),
                failure.size(), images.size() - results.size());
        return ImageConversionReport.builder().success(success).failure(failure).build();
    }

    public ConverterStatusResponse getStatus() {
        return ConverterStatusResponse.builder()
                .state(converter.getState())
                .idle(converter.isEmpty())
                .outstandingTasks(converter.getOutstandingTasks())
                .workerCount(converter.getWorkerCount())
                .webpEnabled(config.getWebp().isEnabled())
                .build();
    }

    private List<ConversionResult> collectResults(long batchId, int expected, CancellationScope scope)
            throws InterruptedException {
        ReceiveChannel<ConversionResult> output = converter.getOutputChannel();
        ReceiveChannel<CompletionSignal> completion = converter.getCompletionStatus();
        List<ConversionResult> results = new ArrayList<>(expected);
        boolean completed = false;

        try {
            while (results.size() < expected) {
                if (scope.isCancelled()) {
                    log.warn("Batch {} cancelled after {} of {} results.", batchId, results.size(), expected);
                    break;
                }
                Optional<ConversionResult> next = output.receive(RESULT_POLL_INTERVAL);
                if (next.isPresent()) {
                    accept(batchId, next.get(), results);
                    continue;
                }
                if (output.isClosed()) {
                    log.warn("Output closed after {} of {} results of batch {}.", results.size(), expected, batchId);
                    break;
                }
                Optional<CompletionSignal> signal = completion.tryReceive();
                if (signal.isPresent() && signal.get().batchId() == batchId) {
                    // every result is published before the batch completes
                    while ((next = output.tryReceive()).isPresent()) {
                        accept(batchId, next.get(), results);
                    }
                    log.debug("Batch {} completion received: {}", batchId, signal.get().message());
                    completed = true;
                    break;
                }
            }
            completed = completed || results.size() == expected;
        } finally {
            if (!completed) {
                // nobody reads the rest, so the workers must not wait on the output for it
                converter.abandonBatch(batchId);
            }
        }
        return results;
    }

    private void accept(long batchId, ConversionResult result, List<ConversionResult> results) {
        if (result.batchId() != batchId) {
            log.debug("[{}] Skipping leftover result of batch {}.", result.image(), result.batchId());
            return;
        }
        progressTracker.updateProgress(ProgressEvent.of(result), result.success());
        results.add(result);
    }

    private static ImageOutcome unconverted(ImageDescriptor image) {
        return ImageOutcome.builder()
                .name(image.name())
                .originalFormat(image.format())
                .format(image.format())
                .build();
    }
}
