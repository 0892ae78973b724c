package com.autopilot.risk;

import com.autopilot.calendar.MarketSessionOracle;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.TradingSettings;
import com.autopilot.domain.enums.ActionType;
import com.autopilot.domain.enums.ExitTrigger;
import com.autopilot.domain.enums.HaltReason;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.CandidateAction;
import com.autopilot.domain.model.OrderReceipt;
import com.autopilot.domain.model.Position;
import com.autopilot.event.RiskEvent;
import com.autopilot.event.RiskEventType;
import com.autopilot.event.RiskLevel;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Admission-control gate between strategy intent and the broker, and sole mutator of
 * {@link RiskState}.
 *
 * <p>Admission checks, first failure wins:
 * <ol>
 *   <li>Circuit breaker OPEN: reject "account halted"</li>
 *   <li>Verified stop-loss / take-profit close: allow, skipping every check below</li>
 *   <li>Day-trade count would exceed {@code max_day_trades}: reject "PDT limit"</li>
 *   <li>Opening orders beyond {@code max_entries_per_cycle}: reject "entry limit"</li>
 *   <li>Position size above {@code max_position_size}: clamp; reject "below minimum size" if the
 *       clamp leaves zero shares</li>
 *   <li>Gross exposure above {@code max_total_exposure}: reject "exposure limit"</li>
 * </ol>
 *
 * <p>Every method reads and writes only the {@link Account} passed in. Nothing here looks at other
 * accounts, so one account's losses never influence another's sizing.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private final TradingSettings tradingSettings;
    private final RiskSettings riskSettings;
    private final PositionSizer positionSizer;
    private final MarketSessionOracle marketSessionOracle;
    private final ApplicationEventPublisher applicationEventPublisher;

    public RiskEngine(
            TradingSettings tradingSettings,
            RiskSettings riskSettings,
            PositionSizer positionSizer,
            MarketSessionOracle marketSessionOracle,
            ApplicationEventPublisher applicationEventPublisher) {
        this.tradingSettings = tradingSettings;
        this.riskSettings = riskSettings;
        this.positionSizer = positionSizer;
        this.marketSessionOracle = marketSessionOracle;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ==================== Admission ====================

    public AdmissionDecision admit(Account account, CandidateAction action, Instant now) {
        AdmissionDecision decision = evaluate(account, action, now);
        if (decision.isRejected()) {
            log.info(
                    "Rejected {} {} {} for {}: {}",
                    action.getType(),
                    action.getSymbol(),
                    action.getReason() != null ? "(" + action.getReason() + ")" : "",
                    account.getAccountId(),
                    decision.getRejectReason().getMessage());
        }
        return decision;
    }

    private AdmissionDecision evaluate(Account account, CandidateAction action, Instant now) {
        RiskState state = account.getRiskState();
        if (state.isHalted()) {
            return AdmissionDecision.reject(RejectReason.ACCOUNT_HALTED);
        }
        if (action.getType() == null || action.getSymbol() == null) {
            return AdmissionDecision.reject(RejectReason.INVALID_ACTION);
        }

        Optional<Position> position = account.findPosition(action.getSymbol());
        return switch (action.getType()) {
            case CLOSE -> admitClose(account, action, position, now);
            case OPEN -> admitOpen(account, action, position);
            case RESIZE -> admitResize(account, action, position, now);
        };
    }

    private AdmissionDecision admitClose(
            Account account, CandidateAction action, Optional<Position> position, Instant now) {
        if (position.isEmpty()) {
            return AdmissionDecision.reject(RejectReason.NO_POSITION);
        }
        Position held = position.get();
        OrderSide side = held.isLong() ? OrderSide.SELL : OrderSide.BUY;
        int quantity = Math.abs(held.getQuantity());

        if (isVerifiedProtectiveExit(action, held)) {
            return AdmissionDecision.allowRiskReducing(side, quantity);
        }
        if (wouldExceedDayTrades(account, held, now)) {
            return AdmissionDecision.reject(RejectReason.PDT_LIMIT);
        }
        return AdmissionDecision.allow(side, quantity, false);
    }

    private AdmissionDecision admitOpen(Account account, CandidateAction action, Optional<Position> position) {
        OrderSide side = action.getSide();
        if (side == null) {
            return AdmissionDecision.reject(RejectReason.INVALID_ACTION);
        }
        if (position.isPresent() && position.get().isLong() != (side == OrderSide.BUY)) {
            // Opposite-side opens would net against the position; strategies must CLOSE or RESIZE instead.
            return AdmissionDecision.reject(RejectReason.INVALID_ACTION);
        }
        RiskState state = account.getRiskState();
        if (state.getDayTradesToday() >= tradingSettings.getMaxDayTrades()) {
            return AdmissionDecision.reject(RejectReason.PDT_LIMIT);
        }
        if (state.getEntriesThisCycle() >= tradingSettings.getMaxEntriesPerCycle()) {
            return AdmissionDecision.reject(RejectReason.ENTRY_LIMIT);
        }
        return sizeIncrease(account, action, side, action.getQuantity());
    }

    private AdmissionDecision admitResize(
            Account account, CandidateAction action, Optional<Position> position, Instant now) {
        if (position.isEmpty()) {
            return AdmissionDecision.reject(RejectReason.NO_POSITION);
        }
        Position held = position.get();
        int current = Math.abs(held.getQuantity());
        int target = action.getQuantity();
        if (target < 0 || target == current) {
            return AdmissionDecision.reject(RejectReason.INVALID_ACTION);
        }
        OrderSide increaseSide = held.isLong() ? OrderSide.BUY : OrderSide.SELL;

        if (target < current) {
            if (wouldExceedDayTrades(account, held, now)) {
                return AdmissionDecision.reject(RejectReason.PDT_LIMIT);
            }
            return AdmissionDecision.allow(increaseSide.opposite(), current - target, false);
        }
        if (account.getRiskState().getDayTradesToday() >= tradingSettings.getMaxDayTrades()) {
            return AdmissionDecision.reject(RejectReason.PDT_LIMIT);
        }
        CandidateAction withoutKelly = action.toBuilder().kellyFraction(null).build();
        return sizeIncrease(account, withoutKelly, increaseSide, target - current);
    }

    private AdmissionDecision sizeIncrease(Account account, CandidateAction action, OrderSide side, int shares) {
        PositionSizer.SizingResult sizing = positionSizer.size(account, action, shares);
        if (sizing.getShares() <= 0) {
            return AdmissionDecision.reject(RejectReason.BELOW_MINIMUM_SIZE);
        }

        BigDecimal addedNotional = action.getReferencePrice().multiply(BigDecimal.valueOf(sizing.getShares()));
        BigDecimal projected = account.grossExposure().add(addedNotional);
        BigDecimal limit = tradingSettings.getMaxTotalExposure().multiply(account.getEquity().max(BigDecimal.ZERO));
        if (projected.compareTo(limit) > 0) {
            return AdmissionDecision.reject(RejectReason.EXPOSURE_LIMIT);
        }
        return AdmissionDecision.allow(side, sizing.getShares(), sizing.isClamped());
    }

    private boolean isVerifiedProtectiveExit(CandidateAction action, Position position) {
        BigDecimal pnlPct = position.unrealizedPnlPct();
        if (action.getExitTrigger() == ExitTrigger.STOP_LOSS) {
            return pnlPct.compareTo(tradingSettings.getStopLossPct().negate()) <= 0;
        }
        if (action.getExitTrigger() == ExitTrigger.TAKE_PROFIT) {
            return pnlPct.compareTo(tradingSettings.getTakeProfitPct()) >= 0;
        }
        return false;
    }

    private boolean wouldExceedDayTrades(Account account, Position position, Instant now) {
        if (!isOpenedToday(position, now)) {
            return false;
        }
        return account.getRiskState().getDayTradesToday() + 1 > tradingSettings.getMaxDayTrades();
    }

    private boolean isOpenedToday(Position position, Instant now) {
        LocalDate today = marketSessionOracle.tradingDate(now);
        return position.openedOn(today, marketSessionOracle.getZone());
    }

    // ==================== Protective exits ====================

    /**
     * Scans open positions for stop-loss and take-profit conditions. Returned actions still go
     * through {@link #admit}, where they are allowed unless the breaker is OPEN.
     */
    public List<CandidateAction> protectiveExits(Account account) {
        List<CandidateAction> exits = new ArrayList<>();
        for (Position position : account.getPositions()) {
            BigDecimal pnlPct = position.unrealizedPnlPct();
            ExitTrigger trigger = ExitTrigger.NONE;
            if (pnlPct.compareTo(tradingSettings.getStopLossPct().negate()) <= 0) {
                trigger = ExitTrigger.STOP_LOSS;
            } else if (pnlPct.compareTo(tradingSettings.getTakeProfitPct()) >= 0) {
                trigger = ExitTrigger.TAKE_PROFIT;
            }
            if (trigger != ExitTrigger.NONE) {
                exits.add(CandidateAction.builder()
                        .type(ActionType.CLOSE)
                        .symbol(position.getSymbol())
                        .side(position.isLong() ? OrderSide.SELL : OrderSide.BUY)
                        .quantity(Math.abs(position.getQuantity()))
                        .referencePrice(position.getCurrentPrice())
                        .exitTrigger(trigger)
                        .reason(trigger + " at " + pnlPct.movePointRight(2).stripTrailingZeros().toPlainString() + "%")
                        .build());
            }
        }
        return exits;
    }

    // ==================== Bookkeeping ====================

    public void beginCycle(Account account) {
        account.getRiskState().beginCycle();
    }

    /**
     * Applies an executed order to the account and its risk counters. Returns the realized P&L of
     * the fill (zero for opening fills and unfilled acceptances).
     */
    public BigDecimal recordExecution(
            Account account, CandidateAction action, AdmissionDecision decision, OrderReceipt receipt, Instant now) {
        RiskState state = account.getRiskState();
        Optional<Position> before = account.findPosition(action.getSymbol());
        boolean reducing = before.isPresent() && before.get().isLong() != (decision.getSide() == OrderSide.BUY);
        boolean dayTrade = reducing && isOpenedToday(before.get(), now);

        state.recordTrade(dayTrade);
        if (action.getType() == ActionType.OPEN) {
            state.recordEntry();
        }

        if (!receipt.isFilled()) {
            if (!reducing) {
                account.addPendingNotional(
                        action.getReferencePrice().multiply(BigDecimal.valueOf(decision.getQuantity())));
            }
            return BigDecimal.ZERO;
        }

        BigDecimal realized = account.applyFill(
                action.getSymbol(), decision.getSide(), receipt.getFilledQuantity(), receipt.getAveragePrice(), now);
        if (reducing) {
            state.recordRealized(realized);
        }
        return realized;
    }

    /**
     * Trips the breaker on daily-loss or loss-streak breaches. Runs once per account per cycle;
     * disabled entirely when {@code circuit_breaker_enabled} is false.
     */
    public void evaluateCircuitBreaker(Account account, Instant now) {
        if (!riskSettings.isCircuitBreakerEnabled()) {
            return;
        }
        RiskState state = account.getRiskState();
        if (state.isHalted()) {
            return;
        }
        BigDecimal lossLimit = account.getSettings()
                .getDailyLossLimit()
                .multiply(account.getSessionStartEquity())
                .negate();
        if (state.getLimitedRealizedPnl().compareTo(lossLimit) <= 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("dailyRealizedPnl", state.getDailyRealizedPnl());
            details.put("limit", lossLimit);
            trip(account, HaltReason.DAILY_LOSS_LIMIT, now, details);
            return;
        }
        if (state.getConsecutiveLosses() >= riskSettings.getMaxConsecutiveLosses()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("consecutiveLosses", state.getConsecutiveLosses());
            details.put("limit", riskSettings.getMaxConsecutiveLosses());
            trip(account, HaltReason.CONSECUTIVE_LOSSES, now, details);
        }
    }

    /**
     * Tracks fully failed cycles. Reaching {@code failedCyclesBeforeHalt} in a row is a systemic
     * failure and trips the breaker even when loss-based tripping is disabled.
     */
    public void recordCycleHealth(Account account, boolean fullyFailed, Instant now) {
        RiskState state = account.getRiskState();
        if (!fullyFailed) {
            state.recordCycleSuccess();
            return;
        }
        state.recordCycleFailure();
        if (state.getConsecutiveFailedCycles() >= riskSettings.getFailedCyclesBeforeHalt()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("consecutiveFailedCycles", state.getConsecutiveFailedCycles());
            trip(account, HaltReason.SYSTEMIC_FAILURE, now, details);
        }
    }

    /**
     * Starts a new session if {@code tradingDate} differs from the account's current one. Clears
     * counters and closes the breaker. Returns true when a reset happened.
     */
    public boolean startSessionIfNeeded(Account account, LocalDate tradingDate) {
        RiskState state = account.getRiskState();
        if (tradingDate.equals(state.getSessionDate())) {
            return false;
        }
        boolean wasHalted = state.isHalted();
        state.startSession(tradingDate);
        account.markSessionStart();
        log.info(
                "Session reset for {}: date={}, startEquity={}{}",
                account.getAccountId(),
                tradingDate,
                account.getSessionStartEquity(),
                wasHalted ? ", breaker closed" : "");
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.SESSION_RESET,
                RiskLevel.INFO,
                account.getAccountId(),
                null,
                "Session started for " + tradingDate,
                Map.of("sessionStartEquity", account.getSessionStartEquity())));
        return true;
    }

    /**
     * Latches every account's breaker OPEN for an emergency stop. No per-account events are
     * published; the scheduler announces the stop once.
     */
    public int haltAll(Collection<Account> accounts, Instant now) {
        int newlyHalted = 0;
        for (Account account : accounts) {
            if (account.getRiskState().latchEmergencyStop(now)) {
                newlyHalted++;
            }
        }
        log.warn("Circuit breakers latched OPEN on {} account(s), {} newly halted", accounts.size(), newlyHalted);
        return newlyHalted;
    }

    /**
     * Operator override: closes the breaker and clears the loss streak, failed-cycle count and the
     * realized P&L counted against the daily-loss limit. Reported daily P&L is kept. Returns false
     * when the account is latched by an emergency stop.
     */
    public boolean manualReset(Account account, String requestedBy, Instant now) {
        RiskState state = account.getRiskState();
        HaltReason previous = state.getHaltReason();
        if (previous == HaltReason.EMERGENCY_STOP) {
            log.warn("Ignoring manual reset of {}: emergency stop is not resettable", account.getAccountId());
            return false;
        }
        state.overrideReset();
        log.warn("Circuit breaker manually reset for {} by {} (was {})", account.getAccountId(), requestedBy, previous);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestedBy", requestedBy);
        details.put("previousReason", previous != null ? previous.name() : "NONE");
        details.put("at", now.toString());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.CIRCUIT_BREAKER_RESET,
                RiskLevel.WARNING,
                account.getAccountId(),
                previous,
                "Circuit breaker manually reset",
                details));
        return true;
    }

    private void trip(Account account, HaltReason reason, Instant now, Map<String, Object> details) {
        if (!account.getRiskState().open(reason, now)) {
            return;
        }
        log.error("Circuit breaker OPEN for {}: {} {}", account.getAccountId(), reason, details);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.CIRCUIT_BREAKER_TRIPPED,
                RiskLevel.CRITICAL,
                account.getAccountId(),
                reason,
                "Trading halted for " + account.getAccountId() + ": " + reason,
                details));
    }
}
