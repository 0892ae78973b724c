package com.autopilot.observability;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionSnapshot {

    String symbol;
    int quantity;
    BigDecimal entryPrice;
    BigDecimal currentPrice;
    BigDecimal marketValue;
    BigDecimal unrealizedPnl;
    BigDecimal unrealizedPnlPct;
    Instant openedAt;
}
