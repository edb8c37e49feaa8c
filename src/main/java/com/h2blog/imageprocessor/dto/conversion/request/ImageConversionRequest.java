package com.h2blog.imageprocessor.dto.conversion.request;

import com.h2blog.imageprocessor.model.ImageDescriptor;
import com.h2blog.imageprocessor.model.ImageFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageConversionRequest {

    @NotEmpty(message = "At least one image is required.")
    private List<@Valid @NotNull ImageItem> images;

    public List<ImageDescriptor> toDescriptors() {
        return images.stream().map(item -> new ImageDescriptor(item.getName(), item.getFormat())).toList();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageItem {

        /**
         * Base name of the stored image, without prefix or extension.
         */
        @NotBlank(message = "Image name cannot be empty.")
        @Pattern(regexp = "[^/\\\\]+", message = "Image name must not contain path separators.")
        private String name;

        @NotNull(message = "Image format is required.")
        private ImageFormat format;
    }
}
