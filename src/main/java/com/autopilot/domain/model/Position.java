package com.autopilot.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import lombok.Getter;

/**
 * One open holding within an {@link Account}.
 *
 * <p>Quantity is signed: positive for long, negative for short, and never zero. A fully closed
 * position is removed from its account rather than kept at zero.
 */
@Getter
public class Position {

    private final String symbol;
    private int quantity;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private final Instant openedAt;

    public Position(String symbol, int quantity, BigDecimal entryPrice, BigDecimal currentPrice, Instant openedAt) {
        if (quantity == 0) {
            throw new IllegalArgumentException("Position quantity must be nonzero: " + symbol);
        }
        this.symbol = symbol;
        this.quantity = quantity;
        this.entryPrice = entryPrice;
        this.currentPrice = currentPrice;
        this.openedAt = openedAt;
    }

    /** Signed market value (negative for shorts). */
    public BigDecimal marketValue() {
        return currentPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public BigDecimal absMarketValue() {
        return marketValue().abs();
    }

    public BigDecimal unrealizedPnl() {
        return currentPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(quantity));
    }

    /** Unrealized P&L as a fraction of entry cost, sign-adjusted for shorts. */
    public BigDecimal unrealizedPnlPct() {
        if (entryPrice.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal move = currentPrice.subtract(entryPrice).divide(entryPrice, 8, RoundingMode.HALF_UP);
        return quantity > 0 ? move : move.negate();
    }

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean openedOn(LocalDate date, ZoneId zone) {
        return openedAt != null && openedAt.atZone(zone).toLocalDate().equals(date);
    }

    public void updatePrice(BigDecimal price) {
        if (price != null && price.signum() > 0) {
            this.currentPrice = price;
        }
    }

    /**
     * Applies a fill that adds to the position in its current direction, re-averaging the entry price.
     */
    void addShares(int signedShares, BigDecimal fillPrice) {
        BigDecimal existingCost = entryPrice.multiply(BigDecimal.valueOf(Math.abs(quantity)));
        BigDecimal addedCost = fillPrice.multiply(BigDecimal.valueOf(Math.abs(signedShares)));
        int newQuantity = quantity + signedShares;
        this.entryPrice = existingCost.add(addedCost).divide(BigDecimal.valueOf(Math.abs(newQuantity)), 6, RoundingMode.HALF_UP);
        this.quantity = newQuantity;
        this.currentPrice = fillPrice;
    }

    /** Reduces the position toward zero. Caller removes the position once quantity reaches zero. */
    void reduceShares(int shares) {
        this.quantity = quantity > 0 ? quantity - shares : quantity + shares;
    }
}
