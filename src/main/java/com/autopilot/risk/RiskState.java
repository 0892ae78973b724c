package com.autopilot.risk;

import com.autopilot.domain.enums.CircuitBreakerStatus;
import com.autopilot.domain.enums.HaltReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-account rolling risk bookkeeping.
 *
 * <p>Readable from anywhere, writable only from this package so that {@link RiskEngine} is the sole
 * mutator. Once {@link #getStatus()} is OPEN it returns to CLOSED only through a session reset or
 * a manual override.
 */
public class RiskState {

    private final String accountId;

    private LocalDate sessionDate;
    private int tradesToday;
    private int dayTradesToday;
    private int entriesThisCycle;
    private int consecutiveLosses;
    private int consecutiveFailedCycles;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;

    /** Realized P&L counted against the daily-loss limit; rebased on manual override. */
    private BigDecimal limitedRealizedPnl = BigDecimal.ZERO;

    private CircuitBreakerStatus status = CircuitBreakerStatus.CLOSED;
    private HaltReason haltReason;
    private Instant haltedAt;

    public RiskState(String accountId) {
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public int getTradesToday() {
        return tradesToday;
    }

    public int getDayTradesToday() {
        return dayTradesToday;
    }

    public int getEntriesThisCycle() {
        return entriesThisCycle;
    }

    public int getConsecutiveLosses() {
        return consecutiveLosses;
    }

    public int getConsecutiveFailedCycles() {
        return consecutiveFailedCycles;
    }

    public BigDecimal getDailyRealizedPnl() {
        return dailyRealizedPnl;
    }

    BigDecimal getLimitedRealizedPnl() {
        return limitedRealizedPnl;
    }

    public CircuitBreakerStatus getStatus() {
        return status;
    }

    public HaltReason getHaltReason() {
        return haltReason;
    }

    public Instant getHaltedAt() {
        return haltedAt;
    }

    public boolean isHalted() {
        return status == CircuitBreakerStatus.OPEN;
    }

    void startSession(LocalDate date) {
        this.sessionDate = date;
        this.tradesToday = 0;
        this.dayTradesToday = 0;
        this.entriesThisCycle = 0;
        this.consecutiveLosses = 0;
        this.consecutiveFailedCycles = 0;
        this.dailyRealizedPnl = BigDecimal.ZERO;
        this.limitedRealizedPnl = BigDecimal.ZERO;
        close();
    }

    void beginCycle() {
        this.entriesThisCycle = 0;
    }

    void recordEntry() {
        this.entriesThisCycle++;
    }

    void recordTrade(boolean dayTrade) {
        this.tradesToday++;
        if (dayTrade) {
            this.dayTradesToday++;
        }
    }

    void recordRealized(BigDecimal realized) {
        this.dailyRealizedPnl = dailyRealizedPnl.add(realized);
        this.limitedRealizedPnl = limitedRealizedPnl.add(realized);
        if (realized.signum() < 0) {
            this.consecutiveLosses++;
        } else if (realized.signum() > 0) {
            this.consecutiveLosses = 0;
        }
    }

    void recordCycleFailure() {
        this.consecutiveFailedCycles++;
    }

    void recordCycleSuccess() {
        this.consecutiveFailedCycles = 0;
    }

    /** Returns true only on the CLOSED -> OPEN transition. */
    boolean open(HaltReason reason, Instant at) {
        if (status == CircuitBreakerStatus.OPEN) {
            return false;
        }
        this.status = CircuitBreakerStatus.OPEN;
        this.haltReason = reason;
        this.haltedAt = at;
        return true;
    }

    /**
     * Emergency halt: opens the breaker and replaces any earlier halt reason, so the latch cannot be
     * cleared by a manual reset. Returns true if the breaker was CLOSED.
     */
    boolean latchEmergencyStop(Instant at) {
        boolean wasClosed = status == CircuitBreakerStatus.CLOSED;
        this.status = CircuitBreakerStatus.OPEN;
        this.haltReason = HaltReason.EMERGENCY_STOP;
        if (wasClosed) {
            this.haltedAt = at;
        }
        return wasClosed;
    }

    void overrideReset() {
        this.consecutiveLosses = 0;
        this.consecutiveFailedCycles = 0;
        this.limitedRealizedPnl = BigDecimal.ZERO;
        close();
    }

    private void close() {
        this.status = CircuitBreakerStatus.CLOSED;
        this.haltReason = null;
        this.haltedAt = null;
    }
}
