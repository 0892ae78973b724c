package com.autopilot.exception;

import com.autopilot.domain.enums.AdapterName;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Raised when a call into an external adapter (broker, market data, persistence,
 * candidate source, notification) fails.
 *
 * <p>{@code transientFailure} marks errors worth retrying with backoff (timeouts,
 * rate limits, connection resets). Adapter implementations throw it with
 * {@code transientFailure=false} for permanent rejections such as invalid symbols
 * or insufficient buying power.
 */
public class AdapterException extends BaseException {

    private final AdapterName adapter;
    private final boolean transientFailure;

    public AdapterException(AdapterName adapter, String message, boolean transientFailure) {
        super(ErrorCode.ADAPTER_ERROR, message, Map.of("adapter", adapter.name()));
        this.adapter = adapter;
        this.transientFailure = transientFailure;
    }

    public AdapterException(AdapterName adapter, String message, boolean transientFailure, Throwable cause) {
        super(cause instanceof TimeoutException ? ErrorCode.ADAPTER_TIMEOUT : ErrorCode.ADAPTER_ERROR, message, cause);
        this.adapter = adapter;
        this.transientFailure = transientFailure;
    }

    public boolean isTimeout() {
        return getCause() instanceof TimeoutException;
    }

    public static AdapterException transientFailure(AdapterName adapter, String message) {
        return new AdapterException(adapter, message, true);
    }

    public static AdapterException permanentFailure(AdapterName adapter, String message) {
        return new AdapterException(adapter, message, false);
    }

    public AdapterName getAdapter() {
        return adapter;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
