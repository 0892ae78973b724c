package com.autopilot.observability;

import lombok.Builder;
import lombok.Value;

/**
 * Rolling risk-adjusted performance for one account. Ratio fields are null until the account has
 * {@code performance-min-samples} returns.
 */
@Value
@Builder
public class PerformanceStats {

    static final PerformanceStats EMPTY = PerformanceStats.builder().sampleCount(0).build();

    int sampleCount;
    Double sharpeRatio;
    Double sortinoRatio;

    /** 5th-percentile return, in percent. */
    Double valueAtRisk95;

    /** Largest peak-to-trough decline of the equity curve, in percent (positive). */
    Double maxDrawdownPct;
}
