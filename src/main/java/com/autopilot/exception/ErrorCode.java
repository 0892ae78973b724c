package com.autopilot.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes of the control surface. Adapter codes map upstream failures to gateway statuses so an
 * operator can tell a broker outage from a bug in the autopilot itself.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", HttpStatus.BAD_REQUEST),
    BAD_REQUEST("BAD_REQUEST", HttpStatus.BAD_REQUEST),
    NOT_FOUND("NOT_FOUND", HttpStatus.NOT_FOUND),
    CONFLICT("CONFLICT", HttpStatus.CONFLICT),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR("INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR),
    ADAPTER_ERROR("ADAPTER_ERROR", HttpStatus.BAD_GATEWAY),
    ADAPTER_TIMEOUT("ADAPTER_TIMEOUT", HttpStatus.GATEWAY_TIMEOUT);

    private final String code;
    private final HttpStatus httpStatus;

    public boolean isServerError() {
        return httpStatus.is5xxServerError();
    }
}
