package com.h2blog.imageprocessor;

import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Image Processor Spring Boot application.
 * <p>
 * Enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds "app.processing" to {@link ImageProcessingConfig}.</li>
 *     <li>{@link EnableScheduling}: the duplicate original cleanup job.</li>
 *     <li>{@link EnableRetry}: retries of metadata writes.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = ImageProcessingConfig.class)
@EnableRetry
public class ImageProcessorApplication {

    public static void main(final String[] args) {
        log.info("Starting ImageProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ImageProcessorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "ImageProcessor"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
