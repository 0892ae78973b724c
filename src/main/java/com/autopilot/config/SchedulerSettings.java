package com.autopilot.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SchedulerSettings {

    Duration tradingInterval;
    Duration backtestInterval;
    Duration pollInterval;
    Duration healthCheckInterval;
    int cycleHistorySize;
    boolean parallelAccounts;
    int backtestSymbolLimit;
    Duration shutdownTimeout;
    boolean liquidateOnEmergencyStop;
}
