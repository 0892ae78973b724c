package com.autopilot.core.engine;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.audit.BufferedAuditWriter;
import com.autopilot.broker.BrokerAdapter;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.enums.OrderType;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.OrderAudit;
import com.autopilot.domain.model.OrderReceipt;
import com.autopilot.domain.model.Position;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Flattens every account after an emergency halt, when {@code liquidate-on-emergency-stop} is on.
 *
 * <p>Execution order:
 * <ol>
 *   <li>Cancel every working broker order (parallel)</li>
 *   <li>Close every open position with a MARKET order (parallel)</li>
 *   <li>Apply the fills to the local accounts, on the calling thread</li>
 * </ol>
 *
 * <p>Orders go straight to the broker through {@link AdapterCallGuard}: the breakers are already
 * OPEN, and risk-reducing closes are never subject to admission. Reads and cancels retry; a close
 * submit gets one attempt under the call deadline. A failure on one order never aborts the rest.
 */
@Component
public class EmergencyLiquidator {

    private static final Logger log = LoggerFactory.getLogger(EmergencyLiquidator.class);

    private static final Duration STEP_TIMEOUT = Duration.ofSeconds(30);

    private final BrokerAdapter brokerAdapter;
    private final AdapterCallGuard adapterCallGuard;
    private final BufferedAuditWriter bufferedAuditWriter;
    private final ExecutorService adapterExecutor;
    private final Clock clock;

    public EmergencyLiquidator(
            BrokerAdapter brokerAdapter,
            AdapterCallGuard adapterCallGuard,
            BufferedAuditWriter bufferedAuditWriter,
            @Qualifier("adapterExecutor") ExecutorService adapterExecutor,
            Clock clock) {
        this.brokerAdapter = brokerAdapter;
        this.adapterCallGuard = adapterCallGuard;
        this.bufferedAuditWriter = bufferedAuditWriter;
        this.adapterExecutor = adapterExecutor;
        this.clock = clock;
    }

    /** Must be called from the scheduling loop; it applies fills to the accounts it is given. */
    public LiquidationResult liquidate(Collection<Account> accounts, long cycleSequence) {
        log.error("Emergency liquidation of {} account(s) started", accounts.size());
        List<String> errors = new ArrayList<>();
        int cancelled = cancelOpenOrders(accounts, errors);

        List<CloseTask> closes = new ArrayList<>();
        for (Account account : accounts) {
            for (Position position : account.getPositions()) {
                closes.add(new CloseTask(account, position, CompletableFuture.supplyAsync(
                        () -> submitClose(account.getAccountId(), position), adapterExecutor)));
            }
        }

        int closed = 0;
        for (CloseTask close : closes) {
            String label = close.account().getAccountId() + " " + close.position().getSymbol();
            try {
                OrderReceipt receipt = close.future().get(STEP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                applyClose(close, receipt, cycleSequence);
                closed++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add("Interrupted while closing " + label);
                break;
            } catch (ExecutionException | TimeoutException e) {
                Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
                String error = "Failed to close " + label + ": " + cause.getMessage();
                log.error(error);
                errors.add(error);
            }
        }

        if (errors.isEmpty()) {
            log.info("Emergency liquidation complete: {} order(s) cancelled, {} position(s) closed", cancelled, closed);
        } else {
            log.error("Emergency liquidation finished with {} error(s): {}", errors.size(), errors);
        }
        return LiquidationResult.builder()
                .ordersCancelled(cancelled)
                .positionsClosed(closed)
                .errors(errors)
                .build();
    }

    private int cancelOpenOrders(Collection<Account> accounts, List<String> errors) {
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (Account account : accounts) {
            String accountId = account.getAccountId();
            futures.add(CompletableFuture.supplyAsync(
                    () -> {
                        List<String> orderIds = adapterCallGuard.call(
                                AdapterName.BROKER, "getOpenOrderIds", () -> brokerAdapter.getOpenOrderIds(accountId));
                        int count = 0;
                        for (String orderId : orderIds) {
                            try {
                                adapterCallGuard.run(
                                        AdapterName.BROKER, "cancelOrder", () -> brokerAdapter.cancelOrder(accountId, orderId));
                                count++;
                            } catch (RuntimeException e) {
                                String error = "Failed to cancel order " + orderId + " for " + accountId + ": "
                                        + e.getMessage();
                                log.error(error);
                                synchronized (errors) {
                                    errors.add(error);
                                }
                            }
                        }
                        return count;
                    },
                    adapterExecutor));
        }

        int cancelled = 0;
        for (CompletableFuture<Integer> future : futures) {
            try {
                cancelled += future.get(STEP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                synchronized (errors) {
                    errors.add("Interrupted while cancelling orders");
                }
                break;
            } catch (ExecutionException | TimeoutException e) {
                Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
                log.error("Order cancellation step failed: {}", cause.getMessage());
                synchronized (errors) {
                    errors.add("Order cancellation failed: " + cause.getMessage());
                }
            }
        }
        return cancelled;
    }

    /** Single attempt: a close that timed out may already be filled, so it is never resubmitted. */
    private OrderReceipt submitClose(String accountId, Position position) {
        OrderSide side = position.isLong() ? OrderSide.SELL : OrderSide.BUY;
        int quantity = Math.abs(position.getQuantity());
        return adapterCallGuard.callOnce(
                AdapterName.BROKER,
                "submitOrder",
                () -> brokerAdapter.submitOrder(accountId, position.getSymbol(), side, quantity, OrderType.MARKET));
    }

    private void applyClose(CloseTask close, OrderReceipt receipt, long cycleSequence) {
        Position position = close.position();
        OrderSide side = position.isLong() ? OrderSide.SELL : OrderSide.BUY;
        int quantity = Math.abs(position.getQuantity());
        if (receipt.isFilled()) {
            close.account().applyFill(
                    position.getSymbol(), side, receipt.getFilledQuantity(), receipt.getAveragePrice(), clock.instant());
        }
        log.info("Emergency close {} {} x{} for {}: order {}",
                side, position.getSymbol(), quantity, close.account().getAccountId(), receipt.getOrderId());
        bufferedAuditWriter.recordOrder(OrderAudit.builder()
                .cycleSequence(cycleSequence)
                .accountId(close.account().getAccountId())
                .symbol(position.getSymbol())
                .side(side)
                .requestedQuantity(quantity)
                .admittedQuantity(quantity)
                .price(receipt.isFilled() ? receipt.getAveragePrice() : position.getCurrentPrice())
                .orderId(receipt.getOrderId())
                .outcome(receipt.isFilled() ? OrderAudit.Outcome.FILLED : OrderAudit.Outcome.ACCEPTED)
                .reason("emergency liquidation")
                .at(clock.instant())
                .build());
    }

    private record CloseTask(Account account, Position position, CompletableFuture<OrderReceipt> future) {}
}
