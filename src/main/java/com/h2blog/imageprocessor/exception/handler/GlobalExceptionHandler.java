package com.h2blog.imageprocessor.exception.handler;

import com.h2blog.imageprocessor.dto.common.ApiResponse;
import com.h2blog.imageprocessor.exception.ConverterBusyException;
import com.h2blog.imageprocessor.exception.ConverterClosedException;
import com.h2blog.imageprocessor.exception.ImageProcessingException;
import com.h2blog.imageprocessor.exception.ObjectNotFoundException;
import com.h2blog.imageprocessor.exception.QueueFullException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Converts exceptions thrown from controllers into the standard {@link ApiResponse} format
 * with the matching HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body.",
                "The request body is missing or could not be parsed.");
    }

    /**
     * Handles missing required request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(
            MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(),
                ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Required parameter is missing.", errorMessage);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    /**
     * Handles validation errors on request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> String.format("'%s': %s", violation.getPropertyPath(), violation.getMessage()))
                .collect(Collectors.joining(", "));
        log.warn("Handling constraint violation: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", "Validation failed: " + errors);
    }

    @ExceptionHandler(ObjectNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleObjectNotFound(ObjectNotFoundException ex) {
        log.warn("Object Not Found Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(HttpStatus.NOT_FOUND, ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNullElse(ex.getSupportedMethods(),
                new String[0]));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed.", errorMessage);
    }

    /**
     * The submitter gave up or its deadline passed while the batch was being queued. (408 Request Timeout)
     */
    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ApiResponse<Object>> handleCancellation(CancellationException ex) {
        log.warn("Request cancelled: {}", ex.getMessage());
        return respond(HttpStatus.REQUEST_TIMEOUT, "The request was cancelled before it completed.", ex.getMessage());
    }

    /**
     * Another batch is still being converted. (409 Conflict)
     */
    @ExceptionHandler(ConverterBusyException.class)
    public ResponseEntity<ApiResponse<Object>> handleConverterBusy(ConverterBusyException ex) {
        log.warn("Converter Busy Exception: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Another conversion batch is in progress. Try again later.",
                ex.getMessage());
    }

    /**
     * The batch did not fit in the converter's queue. (429 Too Many Requests)
     */
    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<ApiResponse<Object>> handleQueueFull(QueueFullException ex) {
        log.warn("Queue Full Exception: {}", ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, "Too many images submitted at once.", ex.getMessage());
    }

    // --- 5xx Server Error Handlers ---

    /**
     * The converter is shutting down with the application. (503 Service Unavailable)
     */
    @ExceptionHandler(ConverterClosedException.class)
    public ResponseEntity<ApiResponse<Object>> handleConverterClosed(ConverterClosedException ex) {
        log.error("Converter Closed Exception: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Image conversion is unavailable.", ex.getMessage());
    }

    @ExceptionHandler(ImageProcessingException.class)
    public ResponseEntity<ApiResponse<Object>> handleImageProcessing(ImageProcessingException ex) {
        log.error("Image Processing Exception: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Image processing failed.", ex.getMessage());
    }

    /**
     * A catch-all handler for any other unhandled exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected internal server error occurred.", null);
    }

    private static ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, String displayMessage,
                                                               String detail) {
        return new ResponseEntity<>(ApiResponse.error(status, displayMessage, detail), status);
    }
}
