package com.autopilot.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Summary returned by a backtest runner for one strategy over a symbol set. */
@Value
@Builder
public class BacktestResult {

    String strategy;
    List<String> symbols;

    /** Total return as a fraction (0.05 = 5%). */
    BigDecimal totalReturn;

    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;
    int trades;
    Instant completedAt;
}
