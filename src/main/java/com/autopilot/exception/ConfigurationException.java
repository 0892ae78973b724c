package com.autopilot.exception;

/**
 * Fatal startup error: malformed configuration or missing credentials.
 * Thrown before the scheduling loop starts so the process never runs half-configured.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
