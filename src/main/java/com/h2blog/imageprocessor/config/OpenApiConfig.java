package com.h2blog.imageprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Image Processor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Converts the blog's stored images to WebP.
                                
                                * **Batch conversion:** one batch at a time is converted by a fixed worker pool.
                                  Each image is downloaded, re-encoded under a size limit, uploaded and its original removed.
                                * **Per-image outcomes:** failures are reported per image with the stage that failed.
                                * **Progress:** a snapshot endpoint and a Server-Sent Events stream.
                                """));
    }
}
