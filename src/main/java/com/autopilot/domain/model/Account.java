package com.autopilot.domain.model;

import com.autopilot.config.AccountSettings;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.risk.RiskState;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A brokerage account under management.
 *
 * <p>Mutable, and only ever touched from the scheduling loop (or the per-account worker it hands
 * the account to for one cycle). Readers on other threads see {@code AccountSnapshot}s instead.
 */
public class Account {

    private final AccountSettings settings;
    private final RiskState riskState;
    private final Map<String, Position> positions = new LinkedHashMap<>();

    private BigDecimal cash;
    private BigDecimal equity;
    private BigDecimal sessionStartEquity;

    /** Notional of orders accepted by the broker but not yet reflected in positions. */
    private BigDecimal pendingNotional = BigDecimal.ZERO;

    private Instant lastRefreshedAt;

    public Account(AccountSettings settings) {
        this.settings = settings;
        this.riskState = new RiskState(settings.getAccountId());
        this.cash = settings.getStartingEquity();
        this.equity = settings.getStartingEquity();
        this.sessionStartEquity = settings.getStartingEquity();
    }

    public String getAccountId() {
        return settings.getAccountId();
    }

    public AccountSettings getSettings() {
        return settings;
    }

    public RiskState getRiskState() {
        return riskState;
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getEquity() {
        return equity;
    }

    public BigDecimal getSessionStartEquity() {
        return sessionStartEquity;
    }

    public BigDecimal getPendingNotional() {
        return pendingNotional;
    }

    public Instant getLastRefreshedAt() {
        return lastRefreshedAt;
    }

    public Collection<Position> getPositions() {
        return Collections.unmodifiableCollection(positions.values());
    }

    public Optional<Position> findPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public List<String> heldSymbols() {
        return new ArrayList<>(positions.keySet());
    }

    /** Sum of absolute position market values plus pending order notional. */
    public BigDecimal grossExposure() {
        BigDecimal total = pendingNotional;
        for (Position position : positions.values()) {
            total = total.add(position.absMarketValue());
        }
        return total;
    }

    public BigDecimal exposureFraction() {
        if (equity.signum() <= 0) {
            return grossExposure().signum() == 0 ? BigDecimal.ZERO : BigDecimal.ONE;
        }
        return grossExposure().divide(equity, 6, RoundingMode.HALF_UP);
    }

    public BigDecimal dailyPnl() {
        return equity.subtract(sessionStartEquity);
    }

    /**
     * Replaces the local view with the broker's. Positions are keyed by symbol; pending notional is
     * cleared because the broker's position set now includes anything that filled.
     */
    public void applyBrokerState(AccountBalance balance, List<Position> brokerPositions, Instant refreshedAt) {
        positions.clear();
        for (Position position : brokerPositions) {
            positions.put(position.getSymbol(), position);
        }
        this.cash = balance.getCash();
        this.equity = balance.getEquity();
        this.pendingNotional = BigDecimal.ZERO;
        this.lastRefreshedAt = refreshedAt;
    }

    public void applyPrices(Map<String, BigDecimal> prices) {
        for (Position position : positions.values()) {
            position.updatePrice(prices.get(position.getSymbol()));
        }
        recomputeEquity();
    }

    /**
     * Applies a fill to the local position set and returns the realized P&L of the closed portion
     * (zero for fills that only add exposure).
     */
    public BigDecimal applyFill(String symbol, OrderSide side, int shares, BigDecimal price, Instant filledAt) {
        int signed = side == OrderSide.BUY ? shares : -shares;
        BigDecimal notional = price.multiply(BigDecimal.valueOf(shares));
        cash = side == OrderSide.BUY ? cash.subtract(notional) : cash.add(notional);

        Position existing = positions.get(symbol);
        BigDecimal realized = BigDecimal.ZERO;
        if (existing == null) {
            positions.put(symbol, new Position(symbol, signed, price, price, filledAt));
        } else if (Integer.signum(existing.getQuantity()) == Integer.signum(signed)) {
            existing.addShares(signed, price);
        } else {
            int closing = Math.min(shares, Math.abs(existing.getQuantity()));
            BigDecimal perShare = existing.isLong()
                    ? price.subtract(existing.getEntryPrice())
                    : existing.getEntryPrice().subtract(price);
            realized = perShare.multiply(BigDecimal.valueOf(closing));
            existing.reduceShares(closing);
            if (existing.getQuantity() == 0) {
                positions.remove(symbol);
            }
            int remainder = shares - closing;
            if (remainder > 0) {
                int flipped = side == OrderSide.BUY ? remainder : -remainder;
                positions.put(symbol, new Position(symbol, flipped, price, price, filledAt));
            }
        }
        recomputeEquity();
        return realized;
    }

    public void addPendingNotional(BigDecimal notional) {
        this.pendingNotional = pendingNotional.add(notional);
    }

    public void markSessionStart() {
        this.sessionStartEquity = equity;
    }

    private void recomputeEquity() {
        BigDecimal value = cash;
        for (Position position : positions.values()) {
            value = value.add(position.marketValue());
        }
        this.equity = value;
    }
}
