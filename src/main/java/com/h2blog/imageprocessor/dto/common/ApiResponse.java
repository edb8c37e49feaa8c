package com.h2blog.imageprocessor.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A standardized, generic wrapper for all API responses.
 * It gives successful and failed responses the same shape, so clients handle them uniformly.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Technical detail of a failure, omitted on success.
     */
    private final String errorDetail;

    public static <T> ApiResponse<T> success(T response, String displayMessage) {
        return ApiResponse.<T>builder()
                .response(response)
                .displayMessage(displayMessage)
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
    }

    public static <T> ApiResponse<T> error(HttpStatus status, String displayMessage) {
        return error(status, displayMessage, null);
    }

    public static <T> ApiResponse<T> error(HttpStatus status, String displayMessage, String errorDetail) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .errorDetail(errorDetail)
                .showMessage(true)
                .statusCode(status.value())
                .build();
    }
}
