package com.autopilot.api.dto.response;

import lombok.Builder;
import lombok.Getter;

/** A queued manual circuit-breaker reset; it is applied before the next cycle. */
@Getter
@Builder
public class ResetResponse {

    private final String accountId;
    private final boolean queued;
    private final String requestedBy;
}
