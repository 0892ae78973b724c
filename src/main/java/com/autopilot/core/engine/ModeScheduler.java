package com.autopilot.core.engine;

import com.autopilot.audit.BufferedAuditWriter;
import com.autopilot.calendar.MarketSessionOracle;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.HaltReason;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.enums.SchedulerState;
import com.autopilot.domain.enums.StopOrigin;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.EmergencyStopRequest;
import com.autopilot.event.CycleCompletedEvent;
import com.autopilot.event.ModeChangedEvent;
import com.autopilot.event.RiskEvent;
import com.autopilot.event.RiskEventType;
import com.autopilot.event.RiskLevel;
import com.autopilot.exception.ConflictException;
import com.autopilot.observability.DailyReportService;
import com.autopilot.observability.SnapshotPublisher;
import com.autopilot.risk.RiskEngine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * The control loop that owns process lifetime and every account mutation.
 *
 * <pre>
 * STARTING -> RUNNING(TRADING) <-> RUNNING(BACKTESTING) -> STOPPING -> STOPPED
 * </pre>
 *
 * <p>Runs on a single {@code mode-scheduler} thread started through {@link SmartLifecycle}. Each
 * {@link #tick()} applies queued manual resets, re-evaluates the market session, switches mode if
 * needed and runs a cycle when one is due. Cycles run to completion inside a tick, so a mode switch
 * never interrupts one, and sequence numbers increase by exactly one per recorded result.
 *
 * <p>An emergency stop (or context shutdown) latches every breaker OPEN once the in-flight account
 * step has finished, optionally liquidates, flushes the audit buffer and stops the loop. The
 * control surface stays up and reports the stopped state.
 */
@Component
public class ModeScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ModeScheduler.class);

    private static final Duration MIN_SLEEP = Duration.ofMillis(10);

    private final AccountRegistry accountRegistry;
    private final MarketSessionOracle marketSessionOracle;
    private final RiskEngine riskEngine;
    private final TradingCycleExecutor tradingCycleExecutor;
    private final BacktestCycleExecutor backtestCycleExecutor;
    private final EmergencyLiquidator emergencyLiquidator;
    private final EmergencyStopSignal emergencyStopSignal;
    private final SnapshotPublisher snapshotPublisher;
    private final BufferedAuditWriter bufferedAuditWriter;
    private final DailyReportService dailyReportService;
    private final SchedulerSettings schedulerSettings;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.STARTING);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Queue<ResetRequest> pendingResets = new ConcurrentLinkedQueue<>();

    private volatile OperatingMode mode = OperatingMode.BACKTESTING;
    private volatile Instant startedAt;
    private volatile boolean shutdownRequested;
    private Thread loopThread;

    // Loop-thread state
    private long sequence;
    private Instant nextCycleAt = Instant.EPOCH;
    private LocalDate lastTradingDate;

    public ModeScheduler(
            AccountRegistry accountRegistry,
            MarketSessionOracle marketSessionOracle,
            RiskEngine riskEngine,
            TradingCycleExecutor tradingCycleExecutor,
            BacktestCycleExecutor backtestCycleExecutor,
            EmergencyLiquidator emergencyLiquidator,
            EmergencyStopSignal emergencyStopSignal,
            SnapshotPublisher snapshotPublisher,
            BufferedAuditWriter bufferedAuditWriter,
            DailyReportService dailyReportService,
            SchedulerSettings schedulerSettings,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.accountRegistry = accountRegistry;
        this.marketSessionOracle = marketSessionOracle;
        this.riskEngine = riskEngine;
        this.tradingCycleExecutor = tradingCycleExecutor;
        this.backtestCycleExecutor = backtestCycleExecutor;
        this.emergencyLiquidator = emergencyLiquidator;
        this.emergencyStopSignal = emergencyStopSignal;
        this.snapshotPublisher = snapshotPublisher;
        this.bufferedAuditWriter = bufferedAuditWriter;
        this.dailyReportService = dailyReportService;
        this.schedulerSettings = schedulerSettings;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ==================== Lifecycle ====================

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            initialize();
            loopThread = new Thread(this::runLoop, "mode-scheduler");
            loopThread.setDaemon(true);
            loopThread.start();
        }
    }

    /**
     * Requests shutdown and waits for the loop to finish its current account step, latch the
     * breakers and flush the audit buffer.
     */
    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        shutdownRequested = true;
        emergencyStopSignal.wake();
        if (loopThread != null) {
            try {
                loopThread.join(schedulerSettings.getShutdownTimeout().plusSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loopThread.isAlive()) {
                log.warn("Scheduler loop did not stop within {}", schedulerSettings.getShutdownTimeout());
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** Decides the initial mode and publishes the startup snapshot. */
    public void initialize() {
        Instant now = clock.instant();
        startedAt = now;
        mode = OperatingMode.forMarket(marketSessionOracle.isMarketOpen(now));
        snapshotPublisher.publishInitial(accountRegistry.all(), mode, now);
        transition(SchedulerState.RUNNING);
        log.info("Mode scheduler started in {} mode with {} account(s)", mode, accountRegistry.size());
    }

    private void runLoop() {
        while (state.get() == SchedulerState.RUNNING) {
            if (shutdownRequested) {
                halt(null, StopOrigin.SHUTDOWN);
                break;
            }
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Unexpected error in scheduling loop", e);
            }
            if (state.get() != SchedulerState.RUNNING) {
                break;
            }
            try {
                emergencyStopSignal.await(sleepDuration());
            } catch (InterruptedException e) {
                log.warn("Scheduler loop interrupted, shutting down");
                shutdownRequested = true;
            }
        }
        log.info("Mode scheduler loop exited in state {}", state.get());
    }

    private Duration sleepDuration() {
        Duration untilCycle = Duration.between(clock.instant(), nextCycleAt);
        Duration sleep = untilCycle.compareTo(schedulerSettings.getPollInterval()) < 0
                ? untilCycle
                : schedulerSettings.getPollInterval();
        return sleep.compareTo(MIN_SLEEP) < 0 ? MIN_SLEEP : sleep;
    }

    // ==================== Loop iteration ====================

    /** One iteration of the control loop. No-op unless RUNNING. */
    public void tick() {
        if (state.get() != SchedulerState.RUNNING) {
            return;
        }
        if (emergencyStopSignal.isRequested()) {
            handleEmergencyStop();
            return;
        }

        Instant now = clock.instant();
        applyPendingResets(now);

        OperatingMode target = OperatingMode.forMarket(marketSessionOracle.isMarketOpen(now));
        if (target != mode) {
            switchMode(target, now);
        }
        if (now.isBefore(nextCycleAt)) {
            return;
        }

        runCycle(now);
        if (emergencyStopSignal.isRequested()) {
            handleEmergencyStop();
        }
    }

    private void runCycle(Instant now) {
        long cycleSequence = sequence + 1;
        OperatingMode cycleMode = mode;
        CycleResult result;
        try {
            if (cycleMode == OperatingMode.TRADING) {
                startSessions(now);
                result = tradingCycleExecutor.execute(cycleSequence, this::stopRequested);
            } else {
                result = backtestCycleExecutor.execute(cycleSequence, this::stopRequested);
            }
        } catch (RuntimeException e) {
            log.error("{} cycle {} failed outside the account boundary", cycleMode, cycleSequence, e);
            result = CycleResult.builder()
                    .sequence(cycleSequence)
                    .mode(cycleMode)
                    .startedAt(now)
                    .finishedAt(clock.instant())
                    .error("cycle: " + e)
                    .build();
        }
        sequence = cycleSequence;
        record(result);
        nextCycleAt = now.plus(cycleMode == OperatingMode.TRADING
                ? schedulerSettings.getTradingInterval()
                : schedulerSettings.getBacktestInterval());
    }

    private void record(CycleResult result) {
        bufferedAuditWriter.recordCycle(result);
        snapshotPublisher.publish(result, accountRegistry.all());
        applicationEventPublisher.publishEvent(new CycleCompletedEvent(this, result));
        log.info(
                "{} cycle {} done in {} ms: accounts={}, orders attempted={} filled={} rejected={}, errors={}{}",
                result.getMode(),
                result.getSequence(),
                result.getDuration().toMillis(),
                result.getAccountsProcessed(),
                result.getOrdersAttempted(),
                result.getOrdersFilled(),
                result.getOrdersRejected(),
                result.getErrorCount(),
                result.isCancelled() ? " (cancelled)" : "");
    }

    private void startSessions(Instant now) {
        LocalDate tradingDate = marketSessionOracle.tradingDate(now);
        for (Account account : accountRegistry.all()) {
            riskEngine.startSessionIfNeeded(account, tradingDate);
        }
        lastTradingDate = tradingDate;
    }

    private void switchMode(OperatingMode target, Instant now) {
        OperatingMode previous = mode;
        mode = target;
        nextCycleAt = now;
        log.info("Switching mode {} -> {}", previous, target);
        if (previous == OperatingMode.TRADING && target == OperatingMode.BACKTESTING) {
            LocalDate reportDate = lastTradingDate != null ? lastTradingDate : marketSessionOracle.tradingDate(now);
            try {
                dailyReportService.generate(accountRegistry.all(), reportDate);
            } catch (RuntimeException e) {
                log.error("Daily report generation failed for {}", reportDate, e);
            }
        }
        applicationEventPublisher.publishEvent(new ModeChangedEvent(this, previous, target));
    }

    // ==================== Manual reset ====================

    /**
     * Queues an operator override of one account's circuit breaker. The reset is applied by the
     * loop thread before its next cycle.
     */
    public void requestManualReset(String accountId, String requestedBy) {
        accountRegistry.get(accountId);
        SchedulerState current = state.get();
        if (current != SchedulerState.RUNNING) {
            throw new ConflictException("Scheduler is " + current + "; resets are not accepted", current.name());
        }
        pendingResets.add(new ResetRequest(accountId, requestedBy));
        log.warn("Manual circuit-breaker reset queued for {} by {}", accountId, requestedBy);
        emergencyStopSignal.wake();
    }

    private void applyPendingResets(Instant now) {
        boolean applied = false;
        ResetRequest reset;
        while ((reset = pendingResets.poll()) != null) {
            Optional<Account> account = accountRegistry.find(reset.accountId());
            if (account.isPresent()) {
                applied |= riskEngine.manualReset(account.get(), reset.requestedBy(), now);
            }
        }
        if (applied) {
            snapshotPublisher.republish(accountRegistry.all(), now);
        }
    }

    // ==================== Emergency stop ====================

    private boolean stopRequested() {
        return shutdownRequested || emergencyStopSignal.isRequested();
    }

    private void handleEmergencyStop() {
        Optional<EmergencyStopRequest> request = emergencyStopSignal.consume();
        request.ifPresent(r -> halt(r, r.getOrigin()));
    }

    /**
     * Latches every breaker OPEN and winds the loop down. {@code request} is null for a plain
     * context shutdown, which neither announces an emergency nor liquidates.
     */
    private void halt(EmergencyStopRequest request, StopOrigin origin) {
        Instant now = clock.instant();
        int newlyHalted = riskEngine.haltAll(accountRegistry.all(), now);

        if (request != null) {
            log.error("Emergency stop from {}: {} ({} account(s) newly halted)", origin, request.getReason(), newlyHalted);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("origin", origin.name());
            details.put("reason", request.getReason());
            details.put("requestedAt", request.getRequestedAt().toString());
            details.put("newlyHalted", newlyHalted);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.EMERGENCY_STOP,
                    RiskLevel.CRITICAL,
                    null,
                    HaltReason.EMERGENCY_STOP,
                    "Emergency stop: " + request.getReason(),
                    details));
            if (schedulerSettings.isLiquidateOnEmergencyStop()) {
                try {
                    emergencyLiquidator.liquidate(accountRegistry.all(), sequence);
                } catch (RuntimeException e) {
                    log.error("Emergency liquidation aborted", e);
                }
            }
        } else {
            log.info("Shutdown requested; trading halted on all accounts");
        }
        snapshotPublisher.republish(accountRegistry.all(), clock.instant());

        transition(SchedulerState.STOPPING);
        if (!bufferedAuditWriter.flushWithin(schedulerSettings.getShutdownTimeout())) {
            log.warn("Audit buffer not fully flushed before stop: {} record(s) pending",
                    bufferedAuditWriter.pendingCount());
        }
        transition(SchedulerState.STOPPED);
        log.info("Mode scheduler stopped");
    }

    private void transition(SchedulerState target) {
        SchedulerState current = state.get();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal scheduler transition " + current + " -> " + target);
        }
        state.set(target);
    }

    // ==================== Read side ====================

    public SchedulerState getState() {
        return state.get();
    }

    public OperatingMode getMode() {
        return mode;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    private record ResetRequest(String accountId, String requestedBy) {}
}
