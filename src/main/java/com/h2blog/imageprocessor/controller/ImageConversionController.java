package com.h2blog.imageprocessor.controller;

import com.h2blog.imageprocessor.dto.common.ApiResponse;
import com.h2blog.imageprocessor.dto.conversion.request.ImageConversionRequest;
import com.h2blog.imageprocessor.dto.conversion.response.ConverterStatusResponse;
import com.h2blog.imageprocessor.dto.conversion.response.ImageConversionReport;
import com.h2blog.imageprocessor.dto.progress.ProgressResponse;
import com.h2blog.imageprocessor.service.ImageConversionService;
import com.h2blog.imageprocessor.service.progress.ProgressStreamService;
import com.h2blog.imageprocessor.service.progress.ProgressTracker;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST controller for WebP conversion batches and their progress.
 * All JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/images")
@RequiredArgsConstructor
@Validated
public class ImageConversionController implements ImageConversionApi {

    private final ImageConversionService imageConversionService;
    private final ProgressTracker progressTracker;
    private final ProgressStreamService progressStreamService;

    @Override
    @PostMapping("/v1/conversions")
    public ResponseEntity<ApiResponse<ImageConversionReport>> convertImages(
            @Valid @RequestBody final ImageConversionRequest request) throws InterruptedException {
        log.info("Received conversion request for {} images.", request.getImages().size());

        ImageConversionReport report = imageConversionService.convertAndStore(request.toDescriptors());

        String message = String.format("Converted %d of %d images.", report.getSuccess().size(),
                request.getImages().size());
        return ResponseEntity.ok(ApiResponse.success(report, message));
    }

    @Override
    @GetMapping("/v1/conversions/status")
    public ResponseEntity<ApiResponse<ConverterStatusResponse>> getConverterStatus() {
        ApiResponse<ConverterStatusResponse> response = ApiResponse.<ConverterStatusResponse>builder()
                .response(imageConversionService.getStatus())
                .displayMessage("Converter status retrieved successfully.")
                .showMessage(false)
                .statusCode(200)
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/conversions/progress")
    public ResponseEntity<ApiResponse<ProgressResponse>> getProgress() {
        ApiResponse<ProgressResponse> response = ApiResponse.<ProgressResponse>builder()
                .response(ProgressResponse.from(progressTracker.getProgress()))
                .displayMessage("Progress retrieved successfully.")
                .showMessage(false)
                .statusCode(200)
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping(value = "/v1/conversions/progress/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamProgress(
            @RequestParam("clientId")
            @NotBlank(message = "The 'clientId' parameter cannot be empty.")
            @Size(max = 64, message = "The 'clientId' must be at most 64 characters.") final String clientId) {
        return progressStreamService.stream(clientId);
    }
}
