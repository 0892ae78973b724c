package com.autopilot.observability;

import java.util.Arrays;
import java.util.List;

/**
 * Sharpe, Sortino, VaR and drawdown over an equity curve.
 *
 * <ul>
 *   <li>Returns are simple returns between consecutive equity samples.</li>
 *   <li>Sharpe = mean / population std x sqrt(252), risk-free rate 0.</li>
 *   <li>Sortino uses the std of negative returns, falling back to the full std when there are
 *       none.</li>
 *   <li>VaR95 is the linearly interpolated 5th percentile of returns x 100.</li>
 * </ul>
 */
public final class PerformanceCalculator {

    private static final double ANNUALIZATION = Math.sqrt(252);

    private PerformanceCalculator() {}

    public static PerformanceStats calculate(List<Double> equityCurve, int minSamples) {
        if (equityCurve.size() < 2) {
            return PerformanceStats.EMPTY;
        }
        double[] returns = returns(equityCurve);
        double maxDrawdown = maxDrawdownPct(equityCurve);
        if (returns.length < minSamples) {
            return PerformanceStats.builder()
                    .sampleCount(returns.length)
                    .maxDrawdownPct(maxDrawdown)
                    .build();
        }

        double mean = mean(returns);
        double std = std(returns);
        double[] downside = Arrays.stream(returns).filter(r -> r < 0).toArray();
        double downsideStd = downside.length > 0 ? std(downside) : std;

        return PerformanceStats.builder()
                .sampleCount(returns.length)
                .sharpeRatio(std > 0 ? mean / std * ANNUALIZATION : 0.0)
                .sortinoRatio(downsideStd > 0 ? mean / downsideStd * ANNUALIZATION : 0.0)
                .valueAtRisk95(percentile(returns, 5.0) * 100)
                .maxDrawdownPct(maxDrawdown)
                .build();
    }

    static double[] returns(List<Double> equityCurve) {
        double[] returns = new double[equityCurve.size() - 1];
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1);
            returns[i - 1] = previous == 0 ? 0 : (equityCurve.get(i) - previous) / previous;
        }
        return returns;
    }

    static double maxDrawdownPct(List<Double> equityCurve) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0;
        for (double value : equityCurve) {
            peak = Math.max(peak, value);
            if (peak > 0) {
                worst = Math.min(worst, (value - peak) / peak);
            }
        }
        return Math.abs(worst) * 100;
    }

    static double percentile(double[] values, double percentile) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0);
    }

    private static double std(double[] values) {
        double mean = mean(values);
        double sumSquares = 0;
        for (double value : values) {
            sumSquares += (value - mean) * (value - mean);
        }
        return Math.sqrt(sumSquares / values.length);
    }
}
