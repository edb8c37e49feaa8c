package com.h2blog.imageprocessor.service.progress;

import com.h2blog.imageprocessor.common.concurrent.ReceiveChannel;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.dto.progress.ProgressResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams a client's progress events as Server-Sent Events.
 * <p>
 * Each stream subscribes the client to the {@link ProgressTracker} and drains its queue on the
 * application task executor until the client goes away or the tracker drops the queue.
 */
@Slf4j
@Service
public class ProgressStreamService {

    static final String PROGRESS_EVENT = "progress";

    private final ProgressTracker progressTracker;
    private final AsyncTaskExecutor taskExecutor;
    private final Duration streamTimeout;
    private final Duration pollInterval;

    public ProgressStreamService(ProgressTracker progressTracker,
                                 @Qualifier("applicationTaskExecutor") AsyncTaskExecutor taskExecutor,
                                 ImageProcessingConfig config) {
        this.progressTracker = progressTracker;
        this.taskExecutor = taskExecutor;
        this.streamTimeout = config.getProgress().getStreamTimeout();
        this.pollInterval = config.getProgress().getPollInterval();
    }

    public SseEmitter stream(String clientId) {
        SseEmitter emitter = new SseEmitter(streamTimeout.toMillis());
        ReceiveChannel<ProgressEvent> queue = progressTracker.subscribe(clientId);
        AtomicBoolean active = new AtomicBoolean(true);

        Runnable detach = () -> {
            active.set(false);
            progressTracker.unsubscribe(clientId, queue);
        };
        emitter.onCompletion(detach);
        emitter.onTimeout(detach);
        emitter.onError(e -> detach.run());

        taskExecutor.execute(() -> drain(clientId, queue, emitter, active));
        log.info("Opened progress stream for client '{}'.", clientId);
        return emitter;
    }

    void drain(String clientId, ReceiveChannel<ProgressEvent> queue, SseEmitter emitter, AtomicBoolean active) {
        try {
            emitter.send(SseEmitter.event().name(PROGRESS_EVENT)
                    .data(ProgressResponse.from(progressTracker.getProgress())));
            while (active.get()) {
                Optional<ProgressEvent> event = queue.receive(pollInterval);
                if (event.isPresent()) {
                    emitter.send(SseEmitter.event().name(PROGRESS_EVENT)
                            .data(ProgressResponse.from(progressTracker.getProgress(), event.get())));
                } else if (queue.isClosed()) {
                    log.info("Progress queue for client '{}' was closed. Ending stream.", clientId);
                    emitter.complete();
                    return;
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Client '{}' disconnected from progress stream: {}", clientId, e.getMessage());
            progressTracker.unsubscribe(clientId, queue);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            progressTracker.unsubscribe(clientId, queue);
            emitter.complete();
        }
    }
}
