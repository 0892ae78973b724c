package com.autopilot.api.dto.response;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CycleSummaryResponse {

    private final long sequence;
    private final String mode;
    private final Instant startedAt;
    private final long durationMs;
    private final int accountsProcessed;
    private final int ordersAttempted;
    private final int ordersFilled;
    private final int ordersRejected;
    private final int errorCount;
    private final boolean cancelled;
    private final String bestBacktestStrategy;
    private final BigDecimal bestBacktestReturn;
}
