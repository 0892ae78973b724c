package com.autopilot.broker;

import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.enums.OrderType;
import com.autopilot.domain.model.AccountBalance;
import com.autopilot.domain.model.OrderReceipt;
import com.autopilot.domain.model.Position;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Narrow broker and market-data capability consumed by the control core. Every call made by the
 * core goes through {@code AdapterCallGuard}, which bounds it with a deadline.
 *
 * <p>Implementations signal failures with {@link com.autopilot.exception.AdapterException}; the
 * {@code transientFailure} flag decides whether the guard retries. Any other exception is treated
 * as permanent.
 *
 * <p>{@code PaperBrokerAdapter} is the built-in implementation for {@code trading-mode=PAPER}. LIVE
 * mode requires a bean supplied by the deployment.
 */
public interface BrokerAdapter {

    AccountBalance getAccountSummary(String accountId);

    List<Position> getPositions(String accountId);

    /**
     * Latest quotes for the given symbols. Symbols without a quote are omitted from the result.
     */
    Map<String, BigDecimal> getPrices(Collection<String> symbols);

    /**
     * Places an order.
     *
     * @return receipt with the broker order id, and fill details when it filled synchronously
     */
    OrderReceipt submitOrder(String accountId, String symbol, OrderSide side, int quantity, OrderType type);

    void cancelOrder(String accountId, String orderId);

    /** Ids of orders that are still working. Used by emergency liquidation. */
    default List<String> getOpenOrderIds(String accountId) {
        return List.of();
    }

    /** Cheap connectivity check used by the background health probe. */
    default void ping() {
        getPrices(List.of());
    }
}
