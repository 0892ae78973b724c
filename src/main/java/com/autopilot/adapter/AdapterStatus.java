package com.autopilot.adapter;

import com.autopilot.domain.enums.AdapterName;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Outcome of the most recent call (or probe) against one adapter. */
@Value
@Builder(toBuilder = true)
public class AdapterStatus {

    AdapterName adapter;
    boolean connected;
    Instant lastCheckedAt;
    String lastError;
    int consecutiveFailures;

    static AdapterStatus unknown(AdapterName adapter) {
        return AdapterStatus.builder().adapter(adapter).connected(false).build();
    }
}
