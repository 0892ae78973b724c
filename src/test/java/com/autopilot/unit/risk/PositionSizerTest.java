package com.autopilot.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.autopilot.config.AccountSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.TradingSettings;
import com.autopilot.domain.enums.ActionType;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.AccountBalance;
import com.autopilot.domain.model.CandidateAction;
import com.autopilot.risk.PositionSizer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for PositionSizer: fixed-quantity and Kelly sizing against the position and cash caps. */
class PositionSizerTest {

    private static final TradingSettings TRADING = TradingSettings.builder()
            .maxTotalExposure(new BigDecimal("0.75"))
            .stopLossPct(new BigDecimal("0.05"))
            .takeProfitPct(new BigDecimal("0.10"))
            .maxDayTrades(3)
            .maxEntriesPerCycle(2)
            .maxCashFraction(new BigDecimal("0.80"))
            .significantTradeValue(new BigDecimal("1000"))
            .build();

    private static PositionSizer sizer(boolean kellyEnabled) {
        return new PositionSizer(
                TRADING,
                RiskSettings.builder()
                        .maxDailyLoss(new BigDecimal("0.03"))
                        .kellyEnabled(kellyEnabled)
                        .maxConsecutiveLosses(5)
                        .circuitBreakerEnabled(true)
                        .failedCyclesBeforeHalt(3)
                        .performanceMinSamples(30)
                        .performanceWindow(252)
                        .build());
    }

    private static Account account(boolean aggressive, String riskMultiplier) {
        return new Account(AccountSettings.builder()
                .accountId("acct-1")
                .startingEquity(new BigDecimal("30000"))
                .maxPositionSize(new BigDecimal("0.15"))
                .aggressiveSizingEnabled(aggressive)
                .riskMultiplier(new BigDecimal(riskMultiplier))
                .dailyLossLimit(new BigDecimal("0.03"))
                .build());
    }

    private static CandidateAction buy(int shares, String kelly) {
        return CandidateAction.builder()
                .type(ActionType.OPEN)
                .symbol("AAPL")
                .side(OrderSide.BUY)
                .quantity(shares)
                .referencePrice(new BigDecimal("100"))
                .kellyFraction(kelly != null ? new BigDecimal(kelly) : null)
                .build();
    }

    @Test
    @DisplayName("Request under every cap is passed through unclamped")
    void underCapsUnchanged() {
        PositionSizer.SizingResult result = sizer(true).size(account(false, "1.0"), buy(20, null), 20);

        assertThat(result.getShares()).isEqualTo(20);
        assertThat(result.isClamped()).isFalse();
    }

    @Test
    @DisplayName("Kelly fraction sizes from equity instead of the requested quantity")
    void kellySizing() {
        PositionSizer.SizingResult result = sizer(true).size(account(false, "1.0"), buy(1, "0.10"), 1);

        assertThat(result.getShares()).isEqualTo(30);
    }

    @Test
    @DisplayName("Risk multiplier above 1.0 is ignored unless aggressive sizing is enabled")
    void multiplierCappedWithoutAggressiveSizing() {
        PositionSizer sizer = sizer(true);

        assertThat(sizer.size(account(false, "2.0"), buy(1, "0.05"), 1).getShares()).isEqualTo(15);
        assertThat(sizer.size(account(true, "2.0"), buy(1, "0.05"), 1).getShares()).isEqualTo(30);
    }

    @Test
    @DisplayName("Kelly fraction above the cap is clamped, then the position limit applies")
    void oversizedKellyClamped() {
        PositionSizer.SizingResult result = sizer(true).size(account(true, "1.5"), buy(1, "0.90"), 1);

        assertThat(result.getShares()).isEqualTo(45);
        assertThat(result.isClamped()).isTrue();
    }

    @Test
    @DisplayName("Kelly fraction is ignored when Kelly sizing is disabled")
    void kellyDisabled() {
        assertThat(sizer(false).size(account(false, "1.0"), buy(7, "0.20"), 7).getShares()).isEqualTo(7);
    }

    @Test
    @DisplayName("Opening notional never exceeds the cash fraction")
    void cashCap() {
        Account account = account(false, "1.0");
        account.applyBrokerState(
                AccountBalance.builder()
                        .accountId("acct-1")
                        .cash(new BigDecimal("1000"))
                        .equity(new BigDecimal("30000"))
                        .build(),
                List.of(),
                Instant.parse("2026-03-11T15:00:00Z"));

        PositionSizer.SizingResult result = sizer(true).size(account, buy(40, null), 40);

        assertThat(result.getShares()).isEqualTo(8);
        assertThat(result.isClamped()).isTrue();
    }

    @Test
    @DisplayName("Missing or non-positive reference price sizes to zero")
    void invalidPrice() {
        CandidateAction action = buy(10, null).toBuilder().referencePrice(BigDecimal.ZERO).build();

        assertThat(sizer(true).size(account(false, "1.0"), action, 10).getShares()).isZero();
    }
}
