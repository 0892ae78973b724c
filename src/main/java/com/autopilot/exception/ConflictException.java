package com.autopilot.exception;

import java.util.Map;

/**
 * Request that conflicts with the current state of the system (e.g. resetting after an emergency stop).
 * The blocking state travels in the details so a client can decide whether to retry.
 */
public class ConflictException extends BaseException {

    public ConflictException(String message, String currentState) {
        super(ErrorCode.CONFLICT, message, Map.of("currentState", currentState));
    }
}
