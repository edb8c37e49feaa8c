package com.h2blog.imageprocessor.service.progress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;
import java.time.Instant;

import static com.h2blog.imageprocessor.testutils.TestDataFactory.config;
import static com.h2blog.imageprocessor.testutils.TestDataFactory.jpg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ProgressStreamServiceTest {

    @Test
    @DisplayName("should subscribe the client when a stream is opened")
    void should_subscribe_the_client_when_a_stream_is_opened() {
        // given
        var tracker = new ProgressTracker(10);
        var service = new ProgressStreamService(tracker, new SimpleAsyncTaskExecutor("sse-test-"), config());

        // when
        var emitter = service.stream("dashboard");

        // then
        assertThat(emitter).isNotNull();
        assertThat(tracker.observerCount()).isEqualTo(1);
        tracker.unsubscribe("dashboard");
    }

    @Test
    @DisplayName("should end a replaced stream without dropping the new subscription")
    void should_end_a_replaced_stream_without_dropping_the_new_subscription() throws InterruptedException {
        // given
        var tracker = new ProgressTracker(10);
        var service = new ProgressStreamService(tracker, new SimpleAsyncTaskExecutor("sse-test-"), config());
        service.stream("dashboard");

        // when
        var current = tracker.subscribe("dashboard");
        Thread.sleep(100);
        tracker.updateProgress(new ProgressEvent(jpg("a"), true, null, null, Instant.now()), true);

        // then
        await().atMost(Duration.ofSeconds(1)).until(() -> current.size() == 1);
        assertThat(tracker.observerCount()).isEqualTo(1);
        assertThat(current.isClosed()).isFalse();
    }
}
