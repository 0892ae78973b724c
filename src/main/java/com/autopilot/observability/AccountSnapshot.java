package com.autopilot.observability;

import com.autopilot.domain.enums.CircuitBreakerStatus;
import com.autopilot.domain.enums.HaltReason;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of one account as of the end of cycle {@code cycleSequence}. Every field is
 * captured in the same pass over the account, so position count and exposure always agree.
 */
@Value
@Builder
public class AccountSnapshot {

    String accountId;
    long cycleSequence;
    BigDecimal equity;
    BigDecimal cash;
    BigDecimal sessionStartEquity;
    BigDecimal dailyPnl;
    BigDecimal dailyPnlPct;
    BigDecimal dailyRealizedPnl;
    int openPositions;
    BigDecimal grossExposure;
    BigDecimal exposurePct;
    int tradesToday;
    int dayTradesToday;
    int consecutiveLosses;
    CircuitBreakerStatus circuitBreaker;
    HaltReason haltReason;
    PerformanceStats performance;
    List<PositionSnapshot> positions;
}
