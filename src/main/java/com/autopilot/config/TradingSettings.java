package com.autopilot.config;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Global order-level limits shared by every account. Fractions are of account equity. */
@Value
@Builder
public class TradingSettings {

    BigDecimal maxTotalExposure;

    /** Unrealized loss fraction at which an open position is closed as STOP_LOSS. */
    BigDecimal stopLossPct;

    /** Unrealized gain fraction at which an open position is closed as TAKE_PROFIT. */
    BigDecimal takeProfitPct;

    int maxDayTrades;
    int maxEntriesPerCycle;

    /** Opening notional never exceeds this fraction of available cash. */
    BigDecimal maxCashFraction;

    /** Fills at or above this notional are announced on the notification channel. */
    BigDecimal significantTradeValue;
}
