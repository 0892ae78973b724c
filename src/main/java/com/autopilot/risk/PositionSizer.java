package com.autopilot.risk;

import com.autopilot.config.AccountSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.TradingSettings;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.CandidateAction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts a requested opening order into a share count that fits the account's position-size
 * limit.
 *
 * <p>Requested notional is either {@code quantity x price}, or under Kelly sizing
 * {@code riskMultiplier x kellyFraction x equity}. It is then clamped to:
 * <ul>
 *   <li>{@code maxPositionSize x equity} minus what the account already holds in the symbol</li>
 *   <li>{@code maxCashFraction x cash}</li>
 * </ul>
 * and floored to whole shares. The Kelly fraction is supplied by the strategy; this class never
 * estimates edge.
 */
@Component
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    /** Upper bound on any Kelly fraction a strategy hands us. */
    static final BigDecimal MAX_KELLY_FRACTION = new BigDecimal("0.25");

    private final TradingSettings tradingSettings;
    private final RiskSettings riskSettings;

    public PositionSizer(TradingSettings tradingSettings, RiskSettings riskSettings) {
        this.tradingSettings = tradingSettings;
        this.riskSettings = riskSettings;
    }

    /**
     * Sizes an increase of {@code requestedShares} (or a Kelly target when enabled and supplied).
     */
    public SizingResult size(Account account, CandidateAction action, int requestedShares) {
        BigDecimal price = action.getReferencePrice();
        if (price == null || price.signum() <= 0) {
            return new SizingResult(0, false);
        }
        AccountSettings settings = account.getSettings();
        BigDecimal equity = account.getEquity().max(BigDecimal.ZERO);

        BigDecimal requestedNotional = requestedNotional(account, action, requestedShares, price);

        BigDecimal held = account.findPosition(action.getSymbol())
                .map(p -> p.absMarketValue())
                .orElse(BigDecimal.ZERO);
        BigDecimal positionCap = settings.getMaxPositionSize().multiply(equity).subtract(held).max(BigDecimal.ZERO);
        BigDecimal cashCap = tradingSettings.getMaxCashFraction().multiply(account.getCash().max(BigDecimal.ZERO));

        BigDecimal allowedNotional = requestedNotional.min(positionCap).min(cashCap);
        int shares = allowedNotional.divide(price, 0, RoundingMode.DOWN).intValue();
        int requestedAsShares = requestedNotional.divide(price, 0, RoundingMode.DOWN).intValue();
        boolean clamped = shares < requestedAsShares;

        if (clamped) {
            log.debug(
                    "Clamped {} {} from {} to {} shares (positionCap={}, cashCap={})",
                    account.getAccountId(),
                    action.getSymbol(),
                    requestedAsShares,
                    shares,
                    positionCap,
                    cashCap);
        }
        return new SizingResult(shares, clamped);
    }

    private BigDecimal requestedNotional(Account account, CandidateAction action, int requestedShares, BigDecimal price) {
        if (riskSettings.isKellyEnabled() && action.getKellyFraction() != null) {
            BigDecimal kelly = action.getKellyFraction().max(BigDecimal.ZERO).min(MAX_KELLY_FRACTION);
            return account.getSettings()
                    .effectiveRiskMultiplier()
                    .multiply(kelly)
                    .multiply(account.getEquity().max(BigDecimal.ZERO));
        }
        return price.multiply(BigDecimal.valueOf(Math.max(0, requestedShares)));
    }

    @Value
    public static class SizingResult {
        int shares;
        boolean clamped;
    }
}
