package com.autopilot.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope applied to every control-surface response by ApiResponseAdvice. Carries the
 * request path so success and error bodies can be correlated the same way in operator logs.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String path;
    private final Instant timestamp;

    private ApiResponse(T data, String path) {
        this.data = data;
        this.path = path;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data, String path) {
        return new ApiResponse<>(data, path);
    }
}
