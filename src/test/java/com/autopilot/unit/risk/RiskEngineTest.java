package com.autopilot.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.autopilot.calendar.HolidayCalendarConfig;
import com.autopilot.calendar.MarketSessionOracle;
import com.autopilot.config.AccountSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.TradingSettings;
import com.autopilot.domain.enums.ActionType;
import com.autopilot.domain.enums.CircuitBreakerStatus;
import com.autopilot.domain.enums.ExitTrigger;
import com.autopilot.domain.enums.HaltReason;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.AccountBalance;
import com.autopilot.domain.model.CandidateAction;
import com.autopilot.domain.model.OrderReceipt;
import com.autopilot.domain.model.Position;
import com.autopilot.event.RiskEvent;
import com.autopilot.event.RiskEventType;
import com.autopilot.risk.AdmissionDecision;
import com.autopilot.risk.PositionSizer;
import com.autopilot.risk.RejectReason;
import com.autopilot.risk.RiskEngine;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for RiskEngine covering admission order, position clamping, exposure limits,
 * protective exits, PDT counting, circuit-breaker trips and resets.
 */
@ExtendWith(MockitoExtension.class)
class RiskEngineTest {

    /** Wednesday 11:00 New York time. */
    private static final Instant NOW = Instant.parse("2026-03-11T15:00:00Z");

    private static final Instant YESTERDAY = NOW.minus(Duration.ofDays(1));
    private static final Instant EARLIER_TODAY = NOW.minus(Duration.ofHours(1));

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private TradingSettings tradingSettings;
    private RiskEngine riskEngine;

    @BeforeEach
    void setUp() {
        tradingSettings = TradingSettings.builder()
                .maxTotalExposure(new BigDecimal("0.75"))
                .stopLossPct(new BigDecimal("0.05"))
                .takeProfitPct(new BigDecimal("0.10"))
                .maxDayTrades(3)
                .maxEntriesPerCycle(2)
                .maxCashFraction(new BigDecimal("0.80"))
                .significantTradeValue(new BigDecimal("1000"))
                .build();
        riskEngine = newEngine(true);
    }

    private RiskEngine newEngine(boolean circuitBreakerEnabled) {
        RiskSettings riskSettings = RiskSettings.builder()
                .maxDailyLoss(new BigDecimal("0.03"))
                .kellyEnabled(true)
                .maxConsecutiveLosses(3)
                .circuitBreakerEnabled(circuitBreakerEnabled)
                .failedCyclesBeforeHalt(3)
                .performanceMinSamples(30)
                .performanceWindow(252)
                .build();
        return new RiskEngine(
                tradingSettings,
                riskSettings,
                new PositionSizer(tradingSettings, riskSettings),
                new MarketSessionOracle(calendar()),
                applicationEventPublisher);
    }

    private static HolidayCalendarConfig calendar() {
        HolidayCalendarConfig config = new HolidayCalendarConfig();
        config.setCoveredYears(List.of(2026));
        return config;
    }

    private static Account account(String id, String equity) {
        return new Account(AccountSettings.builder()
                .accountId(id)
                .startingEquity(new BigDecimal(equity))
                .maxPositionSize(new BigDecimal("0.15"))
                .riskMultiplier(BigDecimal.ONE)
                .dailyLossLimit(new BigDecimal("0.03"))
                .build());
    }

    /** Replaces the account's holdings; equity stays at the starting value. */
    private static void hold(Account account, Position... positions) {
        BigDecimal invested = BigDecimal.ZERO;
        for (Position position : positions) {
            invested = invested.add(position.marketValue());
        }
        BigDecimal equity = account.getSettings().getStartingEquity();
        account.applyBrokerState(
                AccountBalance.builder()
                        .accountId(account.getAccountId())
                        .cash(equity.subtract(invested))
                        .equity(equity)
                        .build(),
                List.of(positions),
                NOW);
    }

    private static Position position(String symbol, int quantity, String entry, String current, Instant openedAt) {
        return new Position(symbol, quantity, new BigDecimal(entry), new BigDecimal(current), openedAt);
    }

    private static CandidateAction open(String symbol, int shares, String price) {
        return CandidateAction.builder()
                .type(ActionType.OPEN)
                .symbol(symbol)
                .side(OrderSide.BUY)
                .quantity(shares)
                .referencePrice(new BigDecimal(price))
                .build();
    }

    private static CandidateAction close(String symbol, ExitTrigger trigger) {
        return CandidateAction.builder()
                .type(ActionType.CLOSE)
                .symbol(symbol)
                .exitTrigger(trigger)
                .build();
    }

    private static OrderReceipt fill(int shares, String price) {
        return OrderReceipt.builder()
                .orderId("ORD-" + shares)
                .filledQuantity(shares)
                .averagePrice(new BigDecimal(price))
                .build();
    }

    /** Admits and fills the action at {@code price}, asserting that admission allowed it. */
    private void execute(Account account, CandidateAction action, String price) {
        AdmissionDecision decision = riskEngine.admit(account, action, NOW);
        assertThat(decision.isAllowed()).as(decision.describe()).isTrue();
        riskEngine.recordExecution(account, action, decision, fill(decision.getQuantity(), price), NOW);
    }

    // ==============================
    // POSITION SIZING
    // ==============================

    @Nested
    @DisplayName("Position sizing")
    class Sizing {

        @Test
        @DisplayName("Buy of 100 shares at $100 on $30k equity is clamped to 45 shares")
        void clampsToMaxPositionSize() {
            Account account = account("acct-1", "30000");

            AdmissionDecision decision = riskEngine.admit(account, open("AAPL", 100, "100"), NOW);

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(decision.getQuantity()).isEqualTo(45);
            assertThat(decision.isClamped()).isTrue();
        }

        @Test
        @DisplayName("Clamp to zero shares is rejected as below minimum size")
        void clampToZeroRejected() {
            Account account = account("acct-1", "30000");

            AdmissionDecision decision = riskEngine.admit(account, open("BRK.A", 1, "6000"), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.BELOW_MINIMUM_SIZE);
        }

        @Test
        @DisplayName("Existing holding in the symbol counts against the position limit")
        void existingHoldingReducesRoom() {
            Account account = account("acct-1", "30000");
            hold(account, position("AAPL", 40, "100", "100", YESTERDAY));

            AdmissionDecision decision = riskEngine.admit(account, open("AAPL", 100, "100"), NOW);

            assertThat(decision.getQuantity()).isEqualTo(5);
        }

        @Test
        @DisplayName("Opening against an existing short is invalid")
        void oppositeSideOpenRejected() {
            Account account = account("acct-1", "30000");
            hold(account, position("AAPL", -10, "100", "100", YESTERDAY));

            AdmissionDecision decision = riskEngine.admit(account, open("AAPL", 5, "100"), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.INVALID_ACTION);
        }
    }

    // ==============================
    // EXPOSURE
    // ==============================

    @Nested
    @DisplayName("Gross exposure")
    class Exposure {

        @Test
        @DisplayName("Order that would push exposure past the limit is rejected")
        void rejectsAboveExposureLimit() {
            Account account = account("acct-1", "30000");
            hold(account,
                    position("MSFT", 45, "100", "100", YESTERDAY),
                    position("NVDA", 45, "100", "100", YESTERDAY),
                    position("AMD", 45, "100", "100", YESTERDAY),
                    position("TSLA", 45, "100", "100", YESTERDAY),
                    position("META", 45, "100", "100", YESTERDAY));

            AdmissionDecision decision = riskEngine.admit(account, open("AAPL", 10, "100"), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.EXPOSURE_LIMIT);
        }

        @Test
        @DisplayName("Randomized order stream never breaches exposure, position or cash limits")
        void randomizedOrdersStayWithinLimits() {
            Account account = account("fuzz", "100000");
            Random random = new Random(20260311L);
            String[] symbols = {"AAPL", "MSFT", "NVDA", "AMD", "TSLA", "META", "AMZN", "GOOG"};
            BigDecimal[] prices = new BigDecimal[symbols.length];
            for (int i = 0; i < symbols.length; i++) {
                prices[i] = BigDecimal.valueOf(10 + random.nextInt(490));
            }
            BigDecimal equity = account.getEquity();
            BigDecimal exposureLimit = tradingSettings.getMaxTotalExposure().multiply(equity);
            BigDecimal positionLimit = new BigDecimal("0.15").multiply(equity);

            for (int i = 0; i < 500; i++) {
                riskEngine.beginCycle(account);
                int index = random.nextInt(symbols.length);
                String symbol = symbols[index];
                String price = prices[index].toPlainString();
                CandidateAction action = open(symbol, 1 + random.nextInt(400), price);

                AdmissionDecision decision = riskEngine.admit(account, action, NOW);
                if (decision.isAllowed()) {
                    riskEngine.recordExecution(account, action, decision, fill(decision.getQuantity(), price), NOW);
                }

                assertThat(account.grossExposure()).isLessThanOrEqualTo(exposureLimit);
                assertThat(account.getCash()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
                for (Position position : account.getPositions()) {
                    assertThat(position.absMarketValue()).isLessThanOrEqualTo(positionLimit);
                }
            }
            assertThat(account.getPositions()).isNotEmpty();
        }
    }

    // ==============================
    // PROTECTIVE EXITS
    // ==============================

    @Nested
    @DisplayName("Protective exits")
    class ProtectiveExits {

        @Test
        @DisplayName("Stop-loss close is admitted while exposure is at the limit")
        void stopLossAdmittedAtFullExposure() {
            Account account = account("acct-1", "30000");
            hold(account,
                    position("MSFT", 240, "100", "94", YESTERDAY),
                    position("NVDA", 1, "100", "100", YESTERDAY));

            List<CandidateAction> exits = riskEngine.protectiveExits(account);
            assertThat(exits).hasSize(1);
            assertThat(exits.get(0).getExitTrigger()).isEqualTo(ExitTrigger.STOP_LOSS);

            AdmissionDecision decision = riskEngine.admit(account, exits.get(0), NOW);

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.isRiskReducing()).isTrue();
            assertThat(decision.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(decision.getQuantity()).isEqualTo(240);
        }

        @Test
        @DisplayName("Take-profit on a short buys to cover")
        void takeProfitOnShort() {
            Account account = account("acct-1", "30000");
            hold(account, position("TSLA", -20, "100", "85", YESTERDAY));

            List<CandidateAction> exits = riskEngine.protectiveExits(account);

            assertThat(exits).singleElement().satisfies(exit -> {
                assertThat(exit.getExitTrigger()).isEqualTo(ExitTrigger.TAKE_PROFIT);
                assertThat(exit.getSide()).isEqualTo(OrderSide.BUY);
            });
        }

        @Test
        @DisplayName("Stop-loss close is still rejected on a halted account")
        void haltedAccountRejectsStopLoss() {
            Account account = account("acct-1", "30000");
            hold(account, position("MSFT", 10, "100", "90", YESTERDAY));
            riskEngine.haltAll(List.of(account), NOW);

            AdmissionDecision decision = riskEngine.admit(account, close("MSFT", ExitTrigger.STOP_LOSS), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.ACCOUNT_HALTED);
        }
    }

    // ==============================
    // PATTERN DAY TRADING
    // ==============================

    @Nested
    @DisplayName("Pattern day trading")
    class DayTrades {

        private Account account;

        @BeforeEach
        void exhaustDayTrades() {
            account = account("acct-1", "30000");
            hold(account,
                    position("AAPL", 10, "100", "100", EARLIER_TODAY),
                    position("MSFT", 10, "100", "100", EARLIER_TODAY),
                    position("NVDA", 10, "100", "100", EARLIER_TODAY),
                    position("TSLA", 10, "100", "100", EARLIER_TODAY),
                    position("AMD", 10, "100", "94", EARLIER_TODAY),
                    position("GOOG", 10, "100", "100", YESTERDAY));
            execute(account, close("AAPL", ExitTrigger.NONE), "100");
            execute(account, close("MSFT", ExitTrigger.NONE), "100");
            execute(account, close("NVDA", ExitTrigger.NONE), "100");
        }

        @Test
        @DisplayName("Closing same-day positions counts day trades")
        void countsDayTrades() {
            assertThat(account.getRiskState().getDayTradesToday()).isEqualTo(3);
            assertThat(account.getRiskState().getTradesToday()).isEqualTo(3);
        }

        @Test
        @DisplayName("Fourth same-day close is rejected")
        void fourthDayTradeRejected() {
            AdmissionDecision decision = riskEngine.admit(account, close("TSLA", ExitTrigger.NONE), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.PDT_LIMIT);
        }

        @Test
        @DisplayName("Opens are rejected once the day-trade limit is reached")
        void openRejected() {
            AdmissionDecision decision = riskEngine.admit(account, open("META", 1, "100"), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.PDT_LIMIT);
        }

        @Test
        @DisplayName("Closing a position opened on an earlier day is not a day trade")
        void overnightCloseAllowed() {
            AdmissionDecision decision = riskEngine.admit(account, close("GOOG", ExitTrigger.NONE), NOW);

            assertThat(decision.isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Verified stop-loss bypasses the day-trade limit")
        void stopLossBypassesPdt() {
            AdmissionDecision decision = riskEngine.admit(account, close("AMD", ExitTrigger.STOP_LOSS), NOW);

            assertThat(decision.isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Unverified stop-loss claim does not bypass the day-trade limit")
        void unverifiedStopLossRejected() {
            AdmissionDecision decision = riskEngine.admit(account, close("TSLA", ExitTrigger.STOP_LOSS), NOW);

            assertThat(decision.getRejectReason()).isEqualTo(RejectReason.PDT_LIMIT);
        }
    }

    @Test
    @DisplayName("Third open in one cycle hits the entry limit; next cycle admits again")
    void entryLimitPerCycle() {
        Account account = account("acct-1", "30000");
        riskEngine.beginCycle(account);
        execute(account, open("AAPL", 5, "100"), "100");
        execute(account, open("MSFT", 5, "100"), "100");

        assertThat(riskEngine.admit(account, open("NVDA", 5, "100"), NOW).getRejectReason())
                .isEqualTo(RejectReason.ENTRY_LIMIT);

        riskEngine.beginCycle(account);
        assertThat(riskEngine.admit(account, open("NVDA", 5, "100"), NOW).isAllowed()).isTrue();
    }

    // ==============================
    // CIRCUIT BREAKER
    // ==============================

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreaker {

        @Test
        @DisplayName("Realized loss at the daily limit trips once and publishes one event")
        void dailyLossTrips() {
            Account account = account("acct-1", "30000");
            hold(account, position("AAPL", 100, "100", "90", YESTERDAY));
            execute(account, close("AAPL", ExitTrigger.NONE), "90");

            riskEngine.evaluateCircuitBreaker(account, NOW);
            riskEngine.evaluateCircuitBreaker(account, NOW.plusSeconds(300));

            assertThat(account.getRiskState().getStatus()).isEqualTo(CircuitBreakerStatus.OPEN);
            assertThat(account.getRiskState().getHaltReason()).isEqualTo(HaltReason.DAILY_LOSS_LIMIT);
            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher, times(1)).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.CIRCUIT_BREAKER_TRIPPED);
            assertThat(captor.getValue().getAccountId()).isEqualTo("acct-1");
        }

        @Test
        @DisplayName("Open breaker stays open through profits until a new session")
        void breakerIsMonotonicWithinSession() {
            Account account = account("acct-1", "30000");
            LocalDate today = LocalDate.of(2026, 3, 11);
            riskEngine.startSessionIfNeeded(account, today);
            hold(account, position("AAPL", 100, "100", "90", YESTERDAY), position("MSFT", 10, "100", "200", YESTERDAY));
            execute(account, close("AAPL", ExitTrigger.NONE), "90");
            riskEngine.evaluateCircuitBreaker(account, NOW);

            riskEngine.recordExecution(
                    account,
                    close("MSFT", ExitTrigger.NONE),
                    AdmissionDecision.allow(OrderSide.SELL, 10, false),
                    fill(10, "200"),
                    NOW);
            riskEngine.evaluateCircuitBreaker(account, NOW);
            assertThat(account.getRiskState().isHalted()).isTrue();

            assertThat(riskEngine.startSessionIfNeeded(account, today)).isFalse();
            assertThat(account.getRiskState().isHalted()).isTrue();

            assertThat(riskEngine.startSessionIfNeeded(account, today.plusDays(1))).isTrue();
            assertThat(account.getRiskState().isHalted()).isFalse();
            assertThat(account.getRiskState().getDailyRealizedPnl()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Consecutive losing closes trip the loss-streak breaker")
        void consecutiveLossesTrip() {
            Account account = account("acct-1", "30000");
            hold(account,
                    position("AAPL", 1, "100", "99", YESTERDAY),
                    position("MSFT", 1, "100", "99", YESTERDAY),
                    position("NVDA", 1, "100", "99", YESTERDAY));
            execute(account, close("AAPL", ExitTrigger.NONE), "99");
            execute(account, close("MSFT", ExitTrigger.NONE), "99");
            riskEngine.evaluateCircuitBreaker(account, NOW);
            assertThat(account.getRiskState().isHalted()).isFalse();

            execute(account, close("NVDA", ExitTrigger.NONE), "99");
            riskEngine.evaluateCircuitBreaker(account, NOW);

            assertThat(account.getRiskState().getHaltReason()).isEqualTo(HaltReason.CONSECUTIVE_LOSSES);
        }

        @Test
        @DisplayName("Disabled breaker ignores losses but still trips on repeated failed cycles")
        void disabledBreakerStillTripsOnSystemicFailure() {
            riskEngine = newEngine(false);
            Account account = account("acct-1", "30000");
            hold(account, position("AAPL", 100, "100", "80", YESTERDAY));
            execute(account, close("AAPL", ExitTrigger.NONE), "80");
            riskEngine.evaluateCircuitBreaker(account, NOW);
            assertThat(account.getRiskState().isHalted()).isFalse();

            riskEngine.recordCycleHealth(account, true, NOW);
            riskEngine.recordCycleHealth(account, true, NOW);
            assertThat(account.getRiskState().isHalted()).isFalse();
            riskEngine.recordCycleHealth(account, true, NOW);

            assertThat(account.getRiskState().getHaltReason()).isEqualTo(HaltReason.SYSTEMIC_FAILURE);
        }

        @Test
        @DisplayName("A successful cycle resets the failed-cycle count")
        void successResetsFailureCount() {
            Account account = account("acct-1", "30000");
            riskEngine.recordCycleHealth(account, true, NOW);
            riskEngine.recordCycleHealth(account, true, NOW);
            riskEngine.recordCycleHealth(account, false, NOW);
            riskEngine.recordCycleHealth(account, true, NOW);

            assertThat(account.getRiskState().isHalted()).isFalse();
            assertThat(account.getRiskState().getConsecutiveFailedCycles()).isEqualTo(1);
        }

        @Test
        @DisplayName("Tripping one account leaves the others trading")
        void accountsAreIsolated() {
            Account losing = account("losing", "30000");
            Account healthy = account("healthy", "30000");
            hold(losing, position("AAPL", 100, "100", "90", YESTERDAY));
            execute(losing, close("AAPL", ExitTrigger.NONE), "90");

            riskEngine.evaluateCircuitBreaker(losing, NOW);
            riskEngine.evaluateCircuitBreaker(healthy, NOW);

            assertThat(losing.getRiskState().isHalted()).isTrue();
            assertThat(healthy.getRiskState().isHalted()).isFalse();
            assertThat(riskEngine.admit(healthy, open("MSFT", 100, "100"), NOW).getQuantity()).isEqualTo(45);
        }
    }

    // ==============================
    // OVERRIDES
    // ==============================

    @Nested
    @DisplayName("Manual reset and emergency latch")
    class Overrides {

        @Test
        @DisplayName("Manual reset closes a loss trip and rebases the daily-loss counter")
        void manualResetClosesLossTrip() {
            Account account = account("acct-1", "30000");
            hold(account, position("AAPL", 100, "100", "90", YESTERDAY));
            execute(account, close("AAPL", ExitTrigger.NONE), "90");
            riskEngine.evaluateCircuitBreaker(account, NOW);
            clearInvocations(applicationEventPublisher);

            assertThat(riskEngine.manualReset(account, "ops", NOW)).isTrue();
            riskEngine.evaluateCircuitBreaker(account, NOW);

            assertThat(account.getRiskState().isHalted()).isFalse();
            assertThat(account.getRiskState().getDailyRealizedPnl()).isEqualByComparingTo("-1000");
            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.CIRCUIT_BREAKER_RESET);
        }

        @Test
        @DisplayName("Emergency latch overrides an earlier trip and cannot be reset manually")
        void emergencyLatchNotResettable() {
            Account account = account("acct-1", "30000");
            riskEngine.recordCycleHealth(account, true, NOW);
            riskEngine.recordCycleHealth(account, true, NOW);
            riskEngine.recordCycleHealth(account, true, NOW);
            Account fresh = account("acct-2", "30000");
            clearInvocations(applicationEventPublisher);

            int newlyHalted = riskEngine.haltAll(List.of(account, fresh), NOW);

            assertThat(newlyHalted).isEqualTo(1);
            assertThat(account.getRiskState().getHaltReason()).isEqualTo(HaltReason.EMERGENCY_STOP);
            assertThat(riskEngine.manualReset(account, "ops", NOW)).isFalse();
            assertThat(account.getRiskState().isHalted()).isTrue();
            verify(applicationEventPublisher, never()).publishEvent(any(RiskEvent.class));
        }

        @Test
        @DisplayName("Halted accounts reject every action type")
        void haltedRejectsEverything() {
            Account account = account("acct-1", "30000");
            hold(account, position("AAPL", 10, "100", "100", YESTERDAY));
            riskEngine.haltAll(List.of(account), NOW);

            List<AdmissionDecision> decisions = new ArrayList<>();
            decisions.add(riskEngine.admit(account, open("MSFT", 1, "100"), NOW));
            decisions.add(riskEngine.admit(account, close("AAPL", ExitTrigger.NONE), NOW));
            decisions.add(riskEngine.admit(
                    account,
                    CandidateAction.builder()
                            .type(ActionType.RESIZE)
                            .symbol("AAPL")
                            .quantity(5)
                            .referencePrice(BigDecimal.TEN)
                            .build(),
                    NOW));

            assertThat(decisions).allSatisfy(d -> assertThat(d.getRejectReason()).isEqualTo(RejectReason.ACCOUNT_HALTED));
        }
    }
}
