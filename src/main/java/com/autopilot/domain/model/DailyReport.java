package com.autopilot.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** End-of-session report for one account. */
@Value
@Builder
public class DailyReport {

    String accountId;
    LocalDate tradingDate;
    BigDecimal startEquity;
    BigDecimal endEquity;

    /** Daily P&L as a percentage of session-start equity (1.5 = 1.5%). */
    BigDecimal dailyPnlPct;

    BigDecimal exposurePct;
    int trades;
    int errors;
    boolean criticalError;
    int openPositions;
    String grade;
}
