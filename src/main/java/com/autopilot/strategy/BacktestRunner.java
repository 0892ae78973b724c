package com.autopilot.strategy;

import com.autopilot.domain.model.BacktestResult;
import java.util.List;

/**
 * Runs one named strategy over historical data for a symbol set. The numerics live entirely in the
 * implementation; the scheduler only picks the symbols, bounds the call and compares results.
 */
public interface BacktestRunner {

    /** Strategy name matched against {@code autopilot.backtest.strategies}. */
    String strategyName();

    BacktestResult run(List<String> symbols);
}
