package com.h2blog.imageprocessor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.List;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object covering the converter pool, WebP encoding and storage layout.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class ImageProcessingConfig {

    private Converter converter = new Converter();
    private Webp webp = new Webp();
    private Storage storage = new Storage();
    private Progress progress = new Progress();
    private Metadata metadata = new Metadata();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Converter {
        private int queueCapacity = 30;

        /**
         * Number of workers. Zero or less means half the available processors, at least one.
         */
        private int workerCount;
        private Duration taskTimeout = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int resolveWorkerCount() {
            if (workerCount > 0) {
                return workerCount;
            }
            return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        }
    }

    @Data
    public static class Webp {
        private boolean enabled = true;
        private int quality = 75;
        private DataSize maxSize = DataSize.ofMegabytes(1);
        private int maxAttempts = 5;
        private int qualityStep = 10;
        private int minQuality = 10;
        private String cwebpPath = "cwebp";
        private Duration encodeTimeout = Duration.ofMinutes(1);
        private List<String> extraOptions = List.of("-mt");
    }

    @Data
    public static class Storage {
        private String imagePrefix = "images/";
    }

    @Data
    public static class Progress {
        private int observerQueueCapacity = 10;
        private Duration streamTimeout = Duration.ofMinutes(30);
        private Duration pollInterval = Duration.ofMillis(500);
    }

    @Data
    public static class Metadata {
        private RetryConfig retry = new RetryConfig();
    }
}
