package com.autopilot.config;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BacktestSettings {

    List<String> strategies;

    /** Best total return above which the backtest summary is notified. */
    BigDecimal notifyReturnThreshold;
}
