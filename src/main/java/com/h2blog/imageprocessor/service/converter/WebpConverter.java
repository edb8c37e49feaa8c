package com.h2blog.imageprocessor.service.converter;

import com.h2blog.imageprocessor.common.concurrent.BoundedChannel;
import com.h2blog.imageprocessor.common.concurrent.CancellationScope;
import com.h2blog.imageprocessor.common.concurrent.ChannelClosedException;
import com.h2blog.imageprocessor.common.concurrent.ReceiveChannel;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.exception.ConverterBusyException;
import com.h2blog.imageprocessor.exception.ConverterClosedException;
import com.h2blog.imageprocessor.exception.ImageConversionException;
import com.h2blog.imageprocessor.exception.QueueFullException;
import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A fixed pool of workers that converts batches of images to WebP.
 * <p>
 * One batch is in flight at a time. {@link #addBatchTasks(List, CancellationScope)} queues the batch
 * without blocking; workers run each task through the {@link ImageConversionPipeline}, publish exactly
 * one {@link ConversionResult} per task on {@link #getOutputChannel()} and, once the last task of the
 * batch is accounted for, publish one {@link CompletionSignal} on {@link #getCompletionStatus()}.
 * <p>
 * Results and signals carry the batch id so a reader can skip leftovers of a batch it did not submit.
 * A batch nobody is going to read can be {@linkplain #abandonBatch(long) abandoned}: its tasks still run,
 * but their results are dropped instead of being published, so the batch completes without a reader.
 */
@Slf4j
public class WebpConverter {

    private static final Duration PUBLISH_RECHECK_INTERVAL = Duration.ofMillis(100);

    private final ImageConversionPipeline pipeline;
    private final Duration taskTimeout;
    private final Duration shutdownTimeout;
    private final int workerCount;

    private final BoundedChannel<ImageTask> input;
    private final BoundedChannel<ConversionResult> output;
    private final BoundedChannel<CompletionSignal> completion;

    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong batchSequence = new AtomicLong();
    private final AtomicLong abandonedUpTo = new AtomicLong();
    private final AtomicInteger workerRestarts = new AtomicInteger();
    private final ExecutorService workerPool;
    private volatile ConverterState state = ConverterState.RUNNING;

    private WebpConverter(ImageConversionPipeline pipeline, ImageProcessingConfig.Converter settings) {
        this.pipeline = pipeline;
        this.taskTimeout = settings.getTaskTimeout();
        this.shutdownTimeout = settings.getShutdownTimeout();
        this.workerCount = settings.resolveWorkerCount();
        this.input = new BoundedChannel<>("webp-input", settings.getQueueCapacity());
        this.output = new BoundedChannel<>("webp-output", settings.getQueueCapacity());
        this.completion = new BoundedChannel<>("webp-completion", 1);
        this.workerPool = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
    }

    /**
     * Creates a converter and starts its workers.
     */
    public static WebpConverter start(ImageConversionPipeline pipeline, ImageProcessingConfig.Converter settings) {
        WebpConverter converter = new WebpConverter(pipeline, settings);
        for (int i = 0; i < converter.workerCount; i++) {
            converter.workerPool.execute(converter::runWorker);
        }
        log.info("WebpConverter started with {} workers, queue capacity {} and task timeout {}.",
                converter.workerCount, settings.getQueueCapacity(), converter.taskTimeout);
        return converter;
    }

    /**
     * Queues a batch. Never blocks.
     * <p>
     * If the queue fills up or the scope is cancelled part way through, the tasks already queued are
     * still processed, the batch is abandoned since the caller never learns its id, and it completes
     * once those tasks finish.
     *
     * @return the batch id, or {@code 0} for an empty batch
     * @throws ConverterClosedException if the converter has been shut down
     * @throws ConverterBusyException    if the previous batch has not completed
     * @throws QueueFullException        if the input queue filled up before the whole batch was queued
     * @throws CancellationException     if the scope was cancelled before the whole batch was queued
     */
    public long addBatchTasks(List<ImageDescriptor> images, CancellationScope scope) {
        if (closed.get()) {
            throw new ConverterClosedException("WebpConverter has been shut down.");
        }
        if (images.isEmpty()) {
            return 0L;
        }
        int batchSize = images.size();
        if (!outstanding.compareAndSet(0, batchSize)) {
            throw new ConverterBusyException(String.format(
                    "A batch is already in flight with %d outstanding tasks.", outstanding.get()));
        }
        long batchId = batchSequence.incrementAndGet();
        // a signal left over from the previous batch is never read by this one
        completion.tryReceive();

        int enqueued = 0;
        try {
            for (ImageDescriptor image : images) {
                scope.throwIfCancelled();
                if (!input.trySend(new ImageTask(batchId, scope, image))) {
                    if (input.isClosed()) {
                        throw new ConverterClosedException("WebpConverter was shut down while queuing batch " + batchId);
                    }
                    throw new QueueFullException(String.format(
                            "Input queue is full (capacity %d); queued %d of %d images of batch %d.",
                            input.capacity(), enqueued, batchSize, batchId));
                }
                enqueued++;
            }
        } catch (RuntimeException e) {
            log.warn("Batch {} partially queued ({} of {}): {}", batchId, enqueued, batchSize, e.getMessage());
            abandonBatch(batchId);
            release(batchId, batchSize - enqueued);
            throw e;
        }
        log.info("Queued batch {} with {} images.", batchId, batchSize);
        return batchId;
    }

    /**
     * Stops publishing results of {@code batchId} and of every earlier batch, and drops the ones already
     * buffered. Tasks of the batch keep running and are still counted, so the converter becomes idle
     * once they finish even if nobody reads the output.
     */
    public void abandonBatch(long batchId) {
        if (batchId <= 0) {
            return;
        }
        abandonedUpTo.accumulateAndGet(batchId, Math::max);
        int dropped = output.removeIf(result -> result.batchId() <= batchId);
        log.warn("Batch {} abandoned. Dropped {} buffered results.", batchId, dropped);
    }

    private boolean isAbandoned(long batchId) {
        return batchId <= abandonedUpTo.get();
    }

    public ReceiveChannel<ConversionResult> getOutputChannel() {
        return output;
    }

    public ReceiveChannel<CompletionSignal> getCompletionStatus() {
        return completion;
    }

    public boolean isEmpty() {
        return outstanding.get() == 0;
    }

    public int getOutstandingTasks() {
        return outstanding.get();
    }

    public ConverterState getState() {
        return state;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    int getWorkerRestarts() {
        return workerRestarts.get();
    }

    /**
     * Stops accepting work, closes every channel and waits for the workers to exit.
     * Tasks still queued are discarded. Calling this more than once has no effect.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            log.debug("WebpConverter shutdown already requested.");
            return;
        }
        state = ConverterState.SHUTTING_DOWN;
        log.info("Shutting down WebpConverter with {} outstanding tasks.", outstanding.get());

        input.close();
        int discarded = 0;
        Optional<ImageTask> pending;
        while ((pending = input.tryReceive()).isPresent()) {
            discarded++;
            release(pending.get().batchId(), 1);
        }
        if (discarded > 0) {
            log.warn("Discarded {} queued tasks on shutdown.", discarded);
        }
        output.close();
        completion.close();

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {}. Interrupting them.", shutdownTimeout);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        state = ConverterState.CLOSED;
        log.info("WebpConverter shut down.");
    }

    private void runWorker() {
        try {
            Optional<ImageTask> next;
            while ((next = input.receive()).isPresent()) {
                process(next.get());
            }
            log.debug("Input closed, worker {} exiting.", Thread.currentThread().getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker {} interrupted, exiting.", Thread.currentThread().getName());
        } catch (Throwable t) {
            log.error("Worker {} died unexpectedly.", Thread.currentThread().getName(), t);
            respawnWorker();
        }
    }

    private void respawnWorker() {
        if (closed.get()) {
            return;
        }
        try {
            workerPool.execute(this::runWorker);
            workerRestarts.incrementAndGet();
            log.warn("Started a replacement worker.");
        } catch (RejectedExecutionException e) {
            log.warn("Could not start a replacement worker, pool is shutting down.", e);
        }
    }

    private void process(ImageTask task) {
        ImageDescriptor image = task.image();
        ConversionResult result = null;
        try (CancellationScope taskScope = task.scope().withTimeout(taskTimeout)) {
            ImageDescriptor converted = pipeline.convert(image, taskScope);
            result = ConversionResult.success(task.batchId(), image, converted);
        } catch (ImageConversionException e) {
            log.warn("[{}] Conversion failed: {}", image, e.getMessage());
            result = ConversionResult.failure(task.batchId(), image, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Worker crashed while converting.", image, e);
            result = ConversionResult.failure(task.batchId(), image, ConversionErrorKind.WORKER_CRASHED,
                    "Worker crashed: " + e);
        } finally {
            if (result == null) {
                // an Error is on its way out; account for the task before the worker dies
                result = ConversionResult.failure(task.batchId(), image, ConversionErrorKind.WORKER_CRASHED,
                        "Worker terminated abnormally");
            }
            publish(result);
            release(task.batchId(), 1);
        }
    }

    private void publish(ConversionResult result) {
        try {
            // recheck periodically so a worker waiting on an unread output notices abandonment
            while (!isAbandoned(result.batchId())) {
                if (output.send(result, PUBLISH_RECHECK_INTERVAL)) {
                    return;
                }
            }
            log.debug("[{}] Batch {} was abandoned, dropping result.", result.image(), result.batchId());
        } catch (ChannelClosedException e) {
            log.warn("[{}] Output closed, dropping result.", result.image());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while publishing result, dropping it.", result.image());
        }
    }

    /**
     * Accounts for {@code count} tasks of the batch and signals completion when none remain.
     */
    private void release(long batchId, int count) {
        if (count <= 0) {
            return;
        }
        int left = outstanding.addAndGet(-count);
        if (left < 0) {
            log.error("Outstanding task counter went negative ({}) for batch {}. Resetting.", left, batchId);
            outstanding.compareAndSet(left, 0);
            return;
        }
        if (left == 0) {
            signalCompletion(batchId);
        }
    }

    private void signalCompletion(long batchId) {
        CompletionSignal signal = new CompletionSignal(batchId, true, "Batch " + batchId + " completed.",
                Instant.now());
        completion.tryReceive();
        if (completion.trySend(signal)) {
            log.info("Batch {} completed.", batchId);
        } else {
            log.debug("Completion channel closed, batch {} completion not published.", batchId);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "webp-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
