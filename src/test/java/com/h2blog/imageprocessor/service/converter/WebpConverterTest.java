package com.h2blog.imageprocessor.service.converter;

import com.h2blog.imageprocessor.common.concurrent.CancellationScope;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.exception.ConverterBusyException;
import com.h2blog.imageprocessor.exception.ConverterClosedException;
import com.h2blog.imageprocessor.exception.QueueFullException;
import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.model.ImageFormat;
import com.h2blog.imageprocessor.service.converter.transcode.ImageTranscoder;
import com.h2blog.imageprocessor.service.s3.ImagePathResolver;
import com.h2blog.imageprocessor.testutils.FakeImageEncoder;
import com.h2blog.imageprocessor.testutils.InMemoryObjectStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.h2blog.imageprocessor.testutils.TestDataFactory.PREFIX;
import static com.h2blog.imageprocessor.testutils.TestDataFactory.config;
import static com.h2blog.imageprocessor.testutils.TestDataFactory.jpg;
import static com.h2blog.imageprocessor.testutils.TestDataFactory.path;
import static com.h2blog.imageprocessor.testutils.TestDataFactory.png;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebpConverterTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private WebpConverter converter;

    @AfterEach
    void tearDown() {
        if (converter != null) {
            converter.shutdown();
        }
    }

    @Test
    @DisplayName("should publish one result per image and signal completion once")
    void should_publish_one_result_per_image_and_signal_completion_once() throws InterruptedException {
        // given
        var storage = new InMemoryObjectStorage()
                .with(path("A.jpg"), 2048)
                .with(path("C.jpg"), 2048);
        converter = WebpConverter.start(realPipeline(storage), config().getConverter());
        var images = List.of(jpg("A"), png("B"), jpg("C"));

        // when
        var batchId = converter.addBatchTasks(images, CancellationScope.create());
        var results = receive(3);

        // then
        assertThat(results).extracting(ConversionResult::batchId).containsOnly(batchId);
        assertThat(results).filteredOn(ConversionResult::success)
                .extracting(r -> r.image().name())
                .containsExactlyInAnyOrder("A", "C");
        assertThat(results).filteredOn(r -> !r.success())
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.image()).isEqualTo(png("B"));
                    assertThat(r.errorKind()).isEqualTo(ConversionErrorKind.DOWNLOAD_ERROR);
                });
        assertThat(storage.contains(path("A.webp"))).isTrue();
        assertThat(storage.contains(path("C.webp"))).isTrue();
        assertThat(storage.contains(path("A.jpg"))).isFalse();

        var signal = converter.getCompletionStatus().receive(WAIT);
        assertThat(signal).hasValueSatisfying(s -> {
            assertThat(s.success()).isTrue();
            assertThat(s.batchId()).isEqualTo(batchId);
        });
        assertThat(converter.getCompletionStatus().receive(Duration.ofMillis(100))).isEmpty();
        assertThat(converter.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should account for every task of a large batch")
    void should_account_for_every_task_of_a_large_batch() throws InterruptedException {
        // given
        var storage = new InMemoryObjectStorage();
        var images = IntStream.range(0, 25).mapToObj(i -> jpg("img-" + i)).toList();
        images.stream().filter(i -> i.name().hashCode() % 3 != 0)
                .forEach(i -> storage.with(path(i.fileName()), 64));
        converter = WebpConverter.start(realPipeline(storage), config().getConverter());

        // when
        converter.addBatchTasks(images, CancellationScope.create());
        var results = receive(25);

        // then
        var succeeded = results.stream().filter(ConversionResult::success).count();
        var failed = results.stream().filter(r -> !r.success()).count();
        assertThat(succeeded + failed).isEqualTo(25);
        assertThat(results).extracting(ConversionResult::image).containsExactlyInAnyOrderElementsOf(images);
        await().atMost(WAIT).until(converter::isEmpty);
    }

    @Test
    @DisplayName("should refuse a second batch while the first is in flight")
    void should_refuse_a_second_batch_while_the_first_is_in_flight() throws InterruptedException {
        // given
        var release = new CountDownLatch(1);
        var pipeline = mock(ImageConversionPipeline.class);
        when(pipeline.convert(any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return invocation.<ImageDescriptor>getArgument(0).withFormat(ImageFormat.WEBP);
        });
        converter = WebpConverter.start(pipeline, config().getConverter());
        converter.addBatchTasks(List.of(jpg("a"), jpg("b"), jpg("c")), CancellationScope.create());

        // when / then
        assertThatThrownBy(() -> converter.addBatchTasks(List.of(jpg("d")), CancellationScope.create()))
                .isInstanceOf(ConverterBusyException.class);
        assertThat(converter.getOutstandingTasks()).isEqualTo(3);

        release.countDown();
        assertThat(receive(3)).hasSize(3);
        await().atMost(WAIT).until(converter::isEmpty);
        assertThatCode(() -> converter.addBatchTasks(List.of(jpg("d")), CancellationScope.create()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should fail with queue full and still run the queued part of the batch")
    void should_fail_with_queue_full_and_still_run_the_queued_part_of_the_batch() throws InterruptedException {
        // given
        var release = new CountDownLatch(1);
        var pipeline = mock(ImageConversionPipeline.class);
        when(pipeline.convert(any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return invocation.<ImageDescriptor>getArgument(0).withFormat(ImageFormat.WEBP);
        });
        var settings = config().getConverter();
        settings.setQueueCapacity(2);
        settings.setWorkerCount(1);
        converter = WebpConverter.start(pipeline, settings);
        var images = IntStream.range(0, 6).mapToObj(i -> jpg("img-" + i)).toList();

        // when
        assertThatThrownBy(() -> converter.addBatchTasks(images, CancellationScope.create()))
                .isInstanceOf(QueueFullException.class);
        var queued = converter.getOutstandingTasks();
        release.countDown();

        // then
        assertThat(queued).isBetween(2, 3);
        assertThat(converter.getCompletionStatus().receive(WAIT)).isPresent();
        assertThat(converter.isEmpty()).isTrue();
        verify(pipeline, times(queued)).convert(any(), any());
        assertThat(converter.getOutputChannel().size()).isZero();
    }

    @Test
    @DisplayName("should become idle after a rejected oversized batch even when nobody reads the output")
    void should_become_idle_after_a_rejected_oversized_batch_even_when_nobody_reads_the_output()
            throws InterruptedException {
        // given
        var settings = config().getConverter();
        settings.setQueueCapacity(2);
        settings.setWorkerCount(2);
        converter = WebpConverter.start(realPipeline(new InMemoryObjectStorage()), settings);
        var images = IntStream.range(0, 40).mapToObj(i -> jpg("img-" + i)).toList();

        // when
        assertThatThrownBy(() -> converter.addBatchTasks(images, CancellationScope.create()))
                .isInstanceOf(QueueFullException.class);

        // then
        await().atMost(WAIT).until(converter::isEmpty);
        var next = converter.addBatchTasks(List.of(jpg("late")), CancellationScope.create());
        await().atMost(WAIT).untilAsserted(() -> assertThat(converter.getOutputChannel().tryReceive())
                .hasValueSatisfying(result -> assertThat(result.batchId()).isEqualTo(next)));
    }

    @Test
    @DisplayName("should release workers waiting on a full output once their batch is abandoned")
    void should_release_workers_waiting_on_a_full_output_once_their_batch_is_abandoned()
            throws InterruptedException {
        // given
        var settings = config().getConverter();
        settings.setQueueCapacity(2);
        settings.setWorkerCount(2);
        converter = WebpConverter.start(realPipeline(new InMemoryObjectStorage()), settings);
        converter.addBatchTasks(List.of(jpg("a"), jpg("b")), CancellationScope.create());
        await().atMost(WAIT).until(converter::isEmpty);
        var blocked = converter.addBatchTasks(List.of(jpg("c"), jpg("d")), CancellationScope.create());
        Thread.sleep(200);
        assertThat(converter.isEmpty()).isFalse();

        // when
        converter.abandonBatch(blocked);

        // then
        await().atMost(WAIT).until(converter::isEmpty);
        assertThat(converter.getCompletionStatus().receive(WAIT))
                .hasValueSatisfying(signal -> assertThat(signal.batchId()).isEqualTo(blocked));
    }

    @Test
    @DisplayName("should fail with cancellation when the scope is already cancelled")
    void should_fail_with_cancellation_when_the_scope_is_already_cancelled() {
        // given
        converter = WebpConverter.start(mock(ImageConversionPipeline.class), config().getConverter());
        var scope = CancellationScope.create();
        scope.cancel();

        // when / then
        assertThatThrownBy(() -> converter.addBatchTasks(List.of(jpg("a")), scope))
                .isInstanceOf(CancellationException.class);
        assertThat(converter.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should ignore an empty batch")
    void should_ignore_an_empty_batch() {
        // given
        converter = WebpConverter.start(mock(ImageConversionPipeline.class), config().getConverter());

        // when
        var batchId = converter.addBatchTasks(List.of(), CancellationScope.create());

        // then
        assertThat(batchId).isZero();
        assertThat(converter.isEmpty()).isTrue();
        assertThat(converter.getCompletionStatus().size()).isZero();
    }

    @Test
    @DisplayName("should turn an unexpected exception into a worker crash result")
    void should_turn_an_unexpected_exception_into_a_worker_crash_result() throws InterruptedException {
        // given
        var pipeline = mock(ImageConversionPipeline.class);
        when(pipeline.convert(eq(jpg("ok")), any())).thenReturn(new ImageDescriptor("ok", ImageFormat.WEBP));
        when(pipeline.convert(eq(jpg("bad")), any())).thenThrow(new NullPointerException("boom"));
        converter = WebpConverter.start(pipeline, config().getConverter());

        // when
        converter.addBatchTasks(List.of(jpg("ok"), jpg("bad")), CancellationScope.create());
        var results = receive(2);

        // then
        assertThat(results).filteredOn(r -> !r.success()).singleElement().satisfies(r -> {
            assertThat(r.image()).isEqualTo(jpg("bad"));
            assertThat(r.errorKind()).isEqualTo(ConversionErrorKind.WORKER_CRASHED);
            assertThat(r.errorMessage()).contains("boom");
        });
        assertThat(converter.getCompletionStatus().receive(WAIT)).isPresent();
    }

    @Test
    @DisplayName("should replace a worker killed by an error and keep the pool working")
    void should_replace_a_worker_killed_by_an_error_and_keep_the_pool_working() throws InterruptedException {
        // given
        var pipeline = mock(ImageConversionPipeline.class);
        when(pipeline.convert(eq(jpg("fatal")), any())).thenThrow(new AssertionError("fatal"));
        when(pipeline.convert(eq(jpg("next")), any())).thenReturn(new ImageDescriptor("next", ImageFormat.WEBP));
        var settings = config().getConverter();
        settings.setWorkerCount(1);
        converter = WebpConverter.start(pipeline, settings);

        // when
        converter.addBatchTasks(List.of(jpg("fatal")), CancellationScope.create());
        var crashed = receive(1);
        await().atMost(WAIT).until(converter::isEmpty);
        converter.addBatchTasks(List.of(jpg("next")), CancellationScope.create());
        var next = receive(1);

        // then
        assertThat(crashed.get(0).errorKind()).isEqualTo(ConversionErrorKind.WORKER_CRASHED);
        assertThat(next.get(0).success()).isTrue();
        await().atMost(WAIT).until(() -> converter.getWorkerRestarts() == 1);
    }

    @Test
    @DisplayName("should run each task under a deadline derived from the task timeout")
    void should_run_each_task_under_a_deadline_derived_from_the_task_timeout() throws InterruptedException {
        // given
        var pipeline = mock(ImageConversionPipeline.class);
        var remaining = new ArrayList<Duration>();
        when(pipeline.convert(any(), any())).thenAnswer(invocation -> {
            CancellationScope scope = invocation.getArgument(1);
            remaining.add(scope.remaining().orElseThrow());
            return invocation.<ImageDescriptor>getArgument(0).withFormat(ImageFormat.WEBP);
        });
        converter = WebpConverter.start(pipeline, config().getConverter());

        // when
        converter.addBatchTasks(List.of(jpg("a")), CancellationScope.create());
        receive(1);

        // then
        assertThat(remaining).singleElement().satisfies(left ->
                assertThat(left).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(10)));
    }

    @Test
    @DisplayName("should reject batches after shutdown and tolerate a second shutdown")
    void should_reject_batches_after_shutdown_and_tolerate_a_second_shutdown() {
        // given
        converter = WebpConverter.start(mock(ImageConversionPipeline.class), config().getConverter());

        // when
        converter.shutdown();

        // then
        assertThatCode(converter::shutdown).doesNotThrowAnyException();
        assertThat(converter.getState()).isEqualTo(ConverterState.CLOSED);
        assertThat(converter.getOutputChannel().isClosed()).isTrue();
        assertThat(converter.getCompletionStatus().isClosed()).isTrue();
        assertThatThrownBy(() -> converter.addBatchTasks(List.of(jpg("a")), CancellationScope.create()))
                .isInstanceOf(ConverterClosedException.class);
    }

    @Test
    @DisplayName("should size the pool from the configured worker count")
    void should_size_the_pool_from_the_configured_worker_count() {
        // given
        var settings = new ImageProcessingConfig.Converter();
        settings.setWorkerCount(3);

        // when
        converter = WebpConverter.start(mock(ImageConversionPipeline.class), settings);

        // then
        assertThat(converter.getWorkerCount()).isEqualTo(3);
        assertThat(converter.getState()).isEqualTo(ConverterState.RUNNING);
    }

    private List<ConversionResult> receive(int count) throws InterruptedException {
        var results = new ArrayList<ConversionResult>();
        for (int i = 0; i < count; i++) {
            var result = converter.getOutputChannel().receive(WAIT);
            assertThat(result).as("result %d of %d", i + 1, count).isPresent();
            results.add(result.get());
        }
        return results;
    }

    private static ImageConversionPipeline realPipeline(InMemoryObjectStorage storage) {
        return new ImageConversionPipeline(storage, new ImageTranscoder(FakeImageEncoder.fixedSize(100), config()),
                new ImagePathResolver(PREFIX));
    }
}
