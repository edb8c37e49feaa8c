package com.h2blog.imageprocessor.config;

import com.h2blog.imageprocessor.service.converter.ImageConversionPipeline;
import com.h2blog.imageprocessor.service.converter.WebpConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Owns the lifecycle of the single {@link WebpConverter}: started with the context, shut down with it.
 */
@Configuration
public class ConverterConfig {

    @Bean(destroyMethod = "shutdown")
    public WebpConverter webpConverter(ImageConversionPipeline pipeline, ImageProcessingConfig config) {
        return WebpConverter.start(pipeline, config.getConverter());
    }
}
