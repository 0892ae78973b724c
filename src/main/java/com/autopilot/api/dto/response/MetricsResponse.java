package com.autopilot.api.dto.response;

import com.autopilot.observability.AccountSnapshot;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Returned by GET /metrics. Every account entry and the cycle list come from the same published
 * snapshot, tagged with {@code cycleSequence}.
 */
@Getter
@Builder
public class MetricsResponse {

    private final long cycleSequence;
    private final String mode;
    private final Instant capturedAt;
    private final Instant lastCycleAt;
    private final int haltedAccounts;
    private final List<AccountSnapshot> accounts;
    private final List<CycleSummaryResponse> recentCycles;
}
