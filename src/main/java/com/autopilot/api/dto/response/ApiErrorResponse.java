package com.autopilot.api.dto.response;

import com.autopilot.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope returned by {@link com.autopilot.exception.GlobalExceptionHandler}.
 *
 * <p>{@code retryable} is only present for upstream adapter failures: true when the same request may
 * succeed once the adapter recovers.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Boolean retryable) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus().value())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .retryable(retryable)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final Boolean retryable;
        private final Instant timestamp;
        private final String path;
    }
}
