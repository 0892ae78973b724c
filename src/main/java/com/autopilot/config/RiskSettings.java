package com.autopilot.config;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskSettings {

    /** Default daily-loss fraction for accounts without their own limit. */
    BigDecimal maxDailyLoss;

    boolean kellyEnabled;
    int maxConsecutiveLosses;

    /** Gates loss-based trips only; systemic-failure and emergency halts always apply. */
    boolean circuitBreakerEnabled;

    int failedCyclesBeforeHalt;
    int performanceMinSamples;
    int performanceWindow;
}
