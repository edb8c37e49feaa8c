package com.h2blog.imageprocessor.controller;

import com.h2blog.imageprocessor.dto.common.ApiResponse;
import com.h2blog.imageprocessor.dto.conversion.request.ImageConversionRequest;
import com.h2blog.imageprocessor.dto.conversion.response.ConverterStatusResponse;
import com.h2blog.imageprocessor.dto.conversion.response.ImageConversionReport;
import com.h2blog.imageprocessor.dto.progress.ProgressResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(name = "Image Conversion", description = "Endpoints for converting stored images to WebP and following the progress.")
public interface ImageConversionApi {

    @Operation(summary = "Convert Images to WebP",
            description = "Converts a batch of stored images to WebP and records their metadata. Blocks until every image of the batch has an outcome. Only one batch runs at a time.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Batch processed. Individual images may still have failed.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Converted 1 of 2 images.",
                                        "response": {
                                            "success": [ { "name": "cover", "originalFormat": "JPG", "format": "WEBP" } ],
                                            "failure": [ { "name": "banner", "originalFormat": "PNG", "errorKind": "DOWNLOAD_ERROR", "errorCode": 0,
                                                           "errorMessage": "DOWNLOAD_ERROR: Failed to download 'images/banner.png'" } ]
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Empty or invalid image list.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - Another batch is in progress.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too Many Requests - The batch does not fit in the queue.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service Unavailable - The converter is shutting down.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ImageConversionReport>> convertImages(@Valid @RequestBody ImageConversionRequest request)
            throws InterruptedException;

    @Operation(summary = "Get Converter Status", description = "Returns the converter's lifecycle state and how many tasks are outstanding.")
    ResponseEntity<ApiResponse<ConverterStatusResponse>> getConverterStatus();

    @Operation(summary = "Get Batch Progress", description = "Returns the success and failure counters of the current batch.")
    ResponseEntity<ApiResponse<ProgressResponse>> getProgress();

    @Operation(summary = "Stream Batch Progress",
            description = "Opens a Server-Sent Events stream with one 'progress' event per finished image. Reconnecting with the same clientId replaces the previous stream.")
    SseEmitter streamProgress(
            @Parameter(description = "An opaque id identifying the client.", required = true, example = "dashboard-1")
            @RequestParam("clientId") String clientId);
}
