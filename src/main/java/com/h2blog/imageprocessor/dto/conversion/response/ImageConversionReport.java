package com.h2blog.imageprocessor.dto.conversion.response;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Per-image outcomes of a conversion batch, split into successes and failures.
 */
@Getter
@Builder
public class ImageConversionReport {

    @Builder.Default
    private final List<ImageOutcome> success = List.of();

    @Builder.Default
    private final List<ImageOutcome> failure = List.of();

    public static ImageConversionReport empty() {
        return ImageConversionReport.builder().build();
    }

    public int total() {
        return success.size() + failure.size();
    }
}
