package com.autopilot.exception;

/** Control-surface request that is well-formed JSON but not acceptable (e.g. missing confirmation). */
public class InvalidRequestException extends BaseException {

    public InvalidRequestException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }
}
