package com.h2blog.imageprocessor.dto.conversion.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.h2blog.imageprocessor.model.ConversionErrorKind;
import com.h2blog.imageprocessor.model.ImageFormat;
import com.h2blog.imageprocessor.service.converter.ConversionResult;
import lombok.Builder;
import lombok.Getter;

/**
 * What happened to one image of a batch.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageOutcome {
    private final String name;
    private final ImageFormat originalFormat;

    /**
     * The format the image is stored in now, if known.
     */
    private final ImageFormat format;
    private final ConversionErrorKind errorKind;
    private final Integer errorCode;
    private final String errorMessage;

    public static ImageOutcome from(ConversionResult result) {
        ImageOutcomeBuilder builder = ImageOutcome.builder()
                .name(result.image().name())
                .originalFormat(result.image().format());
        if (result.success()) {
            return builder.format(result.converted().format()).build();
        }
        ConversionErrorKind kind = result.errorKind();
        return builder
                .format(kind.keepsOriginalRecord() ? result.image().format() : null)
                .errorKind(kind)
                .errorCode(kind.getCode())
                .errorMessage(result.errorMessage())
                .build();
    }
}
