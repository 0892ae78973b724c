package com.autopilot.simulator;

import com.autopilot.broker.BrokerAdapter;
import com.autopilot.config.AccountSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.enums.OrderType;
import com.autopilot.domain.model.AccountBalance;
import com.autopilot.domain.model.OrderReceipt;
import com.autopilot.domain.model.Position;
import com.autopilot.exception.AdapterException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory broker for paper trading.
 *
 * <p>Every account starts with its configured starting equity in cash. MARKET and LIMIT orders fill
 * immediately and completely at the current quote; orders for symbols without a quote are rejected
 * as permanent failures. Quotes come from {@code autopilot.paper.prices} and can be moved with
 * {@link #setPrice}.
 */
public class PaperBrokerAdapter implements BrokerAdapter {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerAdapter.class);

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();
    private final Map<String, PaperAccount> accounts = new ConcurrentHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();
    private final Clock clock;

    public PaperBrokerAdapter(List<AccountSettings> accountSettings, Map<String, BigDecimal> initialPrices, Clock clock) {
        this.clock = clock;
        this.prices.putAll(initialPrices);
        for (AccountSettings settings : accountSettings) {
            accounts.put(settings.getAccountId(), new PaperAccount(settings.getStartingEquity()));
        }
        log.info("Paper broker ready: {} account(s), {} quoted symbol(s)", accounts.size(), prices.size());
    }

    @Override
    public AccountBalance getAccountSummary(String accountId) {
        PaperAccount account = account(accountId);
        synchronized (account) {
            BigDecimal equity = account.cash;
            for (PaperHolding holding : account.holdings.values()) {
                equity = equity.add(quote(holding.symbol, holding.entryPrice).multiply(BigDecimal.valueOf(holding.quantity)));
            }
            return AccountBalance.builder()
                    .accountId(accountId)
                    .cash(account.cash)
                    .equity(equity)
                    .build();
        }
    }

    @Override
    public List<Position> getPositions(String accountId) {
        PaperAccount account = account(accountId);
        synchronized (account) {
            List<Position> positions = new ArrayList<>();
            for (PaperHolding holding : account.holdings.values()) {
                positions.add(new Position(
                        holding.symbol,
                        holding.quantity,
                        holding.entryPrice,
                        quote(holding.symbol, holding.entryPrice),
                        holding.openedAt));
            }
            return positions;
        }
    }

    @Override
    public Map<String, BigDecimal> getPrices(Collection<String> symbols) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        for (String symbol : symbols) {
            BigDecimal price = prices.get(symbol);
            if (price != null) {
                result.put(symbol, price);
            }
        }
        return result;
    }

    @Override
    public OrderReceipt submitOrder(String accountId, String symbol, OrderSide side, int quantity, OrderType type) {
        if (quantity <= 0) {
            throw AdapterException.permanentFailure(AdapterName.BROKER, "Quantity must be positive: " + quantity);
        }
        BigDecimal price = prices.get(symbol);
        if (price == null) {
            throw AdapterException.permanentFailure(AdapterName.BROKER, "No quote for " + symbol);
        }
        PaperAccount account = account(accountId);
        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        synchronized (account) {
            int signed = side == OrderSide.BUY ? quantity : -quantity;
            BigDecimal notional = price.multiply(BigDecimal.valueOf(quantity));
            account.cash = side == OrderSide.BUY ? account.cash.subtract(notional) : account.cash.add(notional);

            PaperHolding holding = account.holdings.get(symbol);
            if (holding == null) {
                account.holdings.put(symbol, new PaperHolding(symbol, signed, price, clock.instant()));
            } else if (Integer.signum(holding.quantity) == Integer.signum(signed)) {
                BigDecimal cost = holding.entryPrice.multiply(BigDecimal.valueOf(Math.abs(holding.quantity))).add(notional);
                holding.quantity += signed;
                holding.entryPrice = cost.divide(BigDecimal.valueOf(Math.abs(holding.quantity)), 6, RoundingMode.HALF_UP);
            } else {
                int remaining = holding.quantity + signed;
                if (remaining == 0) {
                    account.holdings.remove(symbol);
                } else if (Integer.signum(remaining) == Integer.signum(holding.quantity)) {
                    holding.quantity = remaining;
                } else {
                    account.holdings.put(symbol, new PaperHolding(symbol, remaining, price, clock.instant()));
                }
            }
        }
        log.debug("Paper fill {}: {} {} {} @ {} ({})", orderId, accountId, side, quantity, price, type);
        return OrderReceipt.builder()
                .orderId(orderId)
                .filledQuantity(quantity)
                .averagePrice(price)
                .build();
    }

    @Override
    public void cancelOrder(String accountId, String orderId) {
        // Paper orders fill synchronously; nothing is ever left working.
        log.debug("Paper cancel {} for {}: no working order", orderId, accountId);
    }

    public void setPrice(String symbol, BigDecimal price) {
        prices.put(symbol, price);
    }

    private BigDecimal quote(String symbol, BigDecimal fallback) {
        return prices.getOrDefault(symbol, fallback);
    }

    private PaperAccount account(String accountId) {
        PaperAccount account = accounts.get(accountId);
        if (account == null) {
            throw AdapterException.permanentFailure(AdapterName.BROKER, "Unknown paper account: " + accountId);
        }
        return account;
    }

    private static final class PaperAccount {

        private BigDecimal cash;
        private final Map<String, PaperHolding> holdings = new LinkedHashMap<>();

        private PaperAccount(BigDecimal cash) {
            this.cash = cash;
        }
    }

    private static final class PaperHolding {

        private final String symbol;
        private int quantity;
        private BigDecimal entryPrice;
        private final Instant openedAt;

        private PaperHolding(String symbol, int quantity, BigDecimal entryPrice, Instant openedAt) {
            this.symbol = symbol;
            this.quantity = quantity;
            this.entryPrice = entryPrice;
            this.openedAt = openedAt;
        }
    }
}
