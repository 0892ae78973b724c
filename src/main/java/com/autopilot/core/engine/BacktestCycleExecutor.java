package com.autopilot.core.engine;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.audit.BufferedAuditWriter;
import com.autopilot.candidate.CandidateCache;
import com.autopilot.config.BacktestSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.AlertSeverity;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.model.BacktestResult;
import com.autopilot.domain.model.Candidate;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.exception.AdapterException;
import com.autopilot.notification.NotificationService;
import com.autopilot.strategy.BacktestRunner;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Runs one BACKTESTING cycle: the top candidates are handed to every configured strategy's
 * {@link BacktestRunner}, and the best result by total return is kept on the {@link CycleResult}.
 *
 * <p>Runners are discovered as beans and matched by {@link BacktestRunner#strategyName()}. A
 * configured strategy without a runner is skipped. Accounts are not touched.
 */
@Component
public class BacktestCycleExecutor {

    private static final Logger log = LoggerFactory.getLogger(BacktestCycleExecutor.class);

    private final CandidateCache candidateCache;
    private final AdapterCallGuard adapterCallGuard;
    private final BufferedAuditWriter bufferedAuditWriter;
    private final NotificationService notificationService;
    private final BacktestSettings backtestSettings;
    private final SchedulerSettings schedulerSettings;
    private final Clock clock;
    private final Map<String, BacktestRunner> runners = new LinkedHashMap<>();

    public BacktestCycleExecutor(
            CandidateCache candidateCache,
            AdapterCallGuard adapterCallGuard,
            BufferedAuditWriter bufferedAuditWriter,
            NotificationService notificationService,
            BacktestSettings backtestSettings,
            SchedulerSettings schedulerSettings,
            ObjectProvider<BacktestRunner> backtestRunners,
            Clock clock) {
        this.candidateCache = candidateCache;
        this.adapterCallGuard = adapterCallGuard;
        this.bufferedAuditWriter = bufferedAuditWriter;
        this.notificationService = notificationService;
        this.backtestSettings = backtestSettings;
        this.schedulerSettings = schedulerSettings;
        this.clock = clock;
        backtestRunners.orderedStream().forEach(runner -> runners.put(runner.strategyName(), runner));
        for (String strategy : backtestSettings.getStrategies()) {
            if (!runners.containsKey(strategy)) {
                log.warn("No BacktestRunner registered for strategy {}; it will be skipped", strategy);
            }
        }
    }

    public CycleResult execute(long sequence, BooleanSupplier stopRequested) {
        Instant startedAt = clock.instant();
        CycleResult.CycleResultBuilder result =
                CycleResult.builder().sequence(sequence).mode(OperatingMode.BACKTESTING).startedAt(startedAt);

        List<String> symbols;
        try {
            symbols = candidateCache.forCycle(sequence).stream()
                    .limit(schedulerSettings.getBacktestSymbolLimit())
                    .map(Candidate::getSymbol)
                    .toList();
        } catch (AdapterException e) {
            log.warn("Candidate source unavailable for backtest cycle {}: {}", sequence, e.getMessage());
            return result.error("candidates: " + e.getMessage()).finishedAt(clock.instant()).build();
        }
        if (symbols.isEmpty()) {
            log.info("Backtest cycle {}: no candidates to test", sequence);
            return result.finishedAt(clock.instant()).build();
        }

        List<BacktestResult> results = new ArrayList<>();
        boolean cancelled = false;
        for (String strategy : backtestSettings.getStrategies()) {
            if (stopRequested.getAsBoolean()) {
                cancelled = true;
                break;
            }
            BacktestRunner runner = runners.get(strategy);
            if (runner == null) {
                continue;
            }
            try {
                BacktestResult backtest =
                        adapterCallGuard.call(AdapterName.BACKTEST, "run " + strategy, () -> runner.run(symbols));
                results.add(backtest);
                bufferedAuditWriter.recordBacktest(backtest);
                log.info(
                        "Backtest {} on {}: return={}, sharpe={}, maxDrawdown={}, trades={}",
                        strategy,
                        symbols,
                        backtest.getTotalReturn(),
                        backtest.getSharpeRatio(),
                        backtest.getMaxDrawdown(),
                        backtest.getTrades());
            } catch (AdapterException e) {
                log.warn("Backtest {} failed: {}", strategy, e.getMessage());
                result.error("backtest " + strategy + ": " + e.getMessage());
            }
        }

        Optional<BacktestResult> best = results.stream()
                .filter(r -> r.getTotalReturn() != null)
                .max(Comparator.comparing(BacktestResult::getTotalReturn));
        best.ifPresent(b -> announceBest(sequence, b, symbols));

        return result.bestBacktest(best.orElse(null))
                .cancelled(cancelled)
                .finishedAt(clock.instant())
                .build();
    }

    private void announceBest(long sequence, BacktestResult best, List<String> symbols) {
        log.info("Best backtest in cycle {}: {} with return {}", sequence, best.getStrategy(), best.getTotalReturn());
        if (best.getTotalReturn().compareTo(backtestSettings.getNotifyReturnThreshold()) > 0) {
            notificationService.notify(
                    AlertSeverity.INFO,
                    "backtest:" + best.getStrategy(),
                    String.format(
                            "Backtest %s on %s returned %s%% (sharpe %s, max drawdown %s)",
                            best.getStrategy(),
                            String.join(",", symbols),
                            best.getTotalReturn().movePointRight(2).stripTrailingZeros().toPlainString(),
                            best.getSharpeRatio(),
                            best.getMaxDrawdown()));
        }
    }
}
