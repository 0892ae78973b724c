package com.autopilot.observability;

import com.autopilot.config.RiskSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.Position;
import com.autopilot.risk.RiskState;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Publishes the read-only view of the system for the control surface.
 *
 * <p>{@link #publish} runs on the scheduling loop after a cycle has fully finished: it copies every
 * account into immutable snapshots and replaces the previous {@link SystemSnapshot} with one atomic
 * reference swap. Readers call {@link #current()} from any thread and always get a snapshot built
 * from a single completed cycle.
 */
@Component
public class SnapshotPublisher {

    private final SchedulerSettings schedulerSettings;
    private final RiskSettings riskSettings;
    private final EquityHistory equityHistory;
    private final Deque<CycleResult> cycleHistory = new ArrayDeque<>();
    private final AtomicReference<SystemSnapshot> current = new AtomicReference<>();

    public SnapshotPublisher(SchedulerSettings schedulerSettings, RiskSettings riskSettings) {
        this.schedulerSettings = schedulerSettings;
        this.riskSettings = riskSettings;
        this.equityHistory = new EquityHistory(riskSettings.getPerformanceWindow());
        this.current.set(SystemSnapshot.builder()
                .cycleSequence(0)
                .mode(OperatingMode.BACKTESTING)
                .accounts(List.of())
                .recentCycles(List.of())
                .build());
    }

    /** Startup snapshot, before any cycle has run. */
    public void publishInitial(Collection<Account> accounts, OperatingMode mode, Instant now) {
        current.set(build(accounts, 0, mode, now, null));
    }

    public void publish(CycleResult result, Collection<Account> accounts) {
        if (result.getMode() == OperatingMode.TRADING) {
            for (Account account : accounts) {
                equityHistory.record(account.getAccountId(), account.getEquity().doubleValue());
            }
        }
        cycleHistory.addLast(result);
        while (cycleHistory.size() > schedulerSettings.getCycleHistorySize()) {
            cycleHistory.pollFirst();
        }
        current.set(build(accounts, result.getSequence(), result.getMode(), result.getFinishedAt(), result.getFinishedAt()));
    }

    /**
     * Re-publishes account state without a new cycle (after an emergency halt or a manual reset),
     * keeping the last cycle's sequence number.
     */
    public void republish(Collection<Account> accounts, Instant now) {
        SystemSnapshot previous = current.get();
        current.set(build(accounts, previous.getCycleSequence(), previous.getMode(), now, previous.getLastCycleAt()));
    }

    public SystemSnapshot current() {
        return current.get();
    }

    private SystemSnapshot build(
            Collection<Account> accounts, long sequence, OperatingMode mode, Instant capturedAt, Instant lastCycleAt) {
        List<AccountSnapshot> accountSnapshots = new ArrayList<>();
        for (Account account : accounts) {
            accountSnapshots.add(snapshot(account, sequence));
        }
        return SystemSnapshot.builder()
                .cycleSequence(sequence)
                .mode(mode)
                .capturedAt(capturedAt)
                .lastCycleAt(lastCycleAt)
                .accounts(List.copyOf(accountSnapshots))
                .recentCycles(List.copyOf(cycleHistory))
                .build();
    }

    private AccountSnapshot snapshot(Account account, long sequence) {
        RiskState risk = account.getRiskState();
        List<PositionSnapshot> positions = new ArrayList<>();
        for (Position position : account.getPositions()) {
            positions.add(PositionSnapshot.builder()
                    .symbol(position.getSymbol())
                    .quantity(position.getQuantity())
                    .entryPrice(position.getEntryPrice())
                    .currentPrice(position.getCurrentPrice())
                    .marketValue(position.marketValue())
                    .unrealizedPnl(position.unrealizedPnl())
                    .unrealizedPnlPct(position.unrealizedPnlPct().movePointRight(2))
                    .openedAt(position.getOpenedAt())
                    .build());
        }
        BigDecimal dailyPnl = account.dailyPnl();
        BigDecimal startEquity = account.getSessionStartEquity();
        BigDecimal dailyPnlPct = startEquity.signum() > 0
                ? dailyPnl.divide(startEquity, 6, RoundingMode.HALF_UP).movePointRight(2)
                : BigDecimal.ZERO;

        return AccountSnapshot.builder()
                .accountId(account.getAccountId())
                .cycleSequence(sequence)
                .equity(account.getEquity())
                .cash(account.getCash())
                .sessionStartEquity(startEquity)
                .dailyPnl(dailyPnl)
                .dailyPnlPct(dailyPnlPct)
                .dailyRealizedPnl(risk.getDailyRealizedPnl())
                .openPositions(positions.size())
                .grossExposure(account.grossExposure())
                .exposurePct(account.exposureFraction().movePointRight(2))
                .tradesToday(risk.getTradesToday())
                .dayTradesToday(risk.getDayTradesToday())
                .consecutiveLosses(risk.getConsecutiveLosses())
                .circuitBreaker(risk.getStatus())
                .haltReason(risk.getHaltReason())
                .performance(PerformanceCalculator.calculate(
                        equityHistory.curve(account.getAccountId()), riskSettings.getPerformanceMinSamples()))
                .positions(List.copyOf(positions))
                .build();
    }
}
