package com.autopilot.notification;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.config.TradingSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.AlertSeverity;
import com.autopilot.domain.model.OrderAudit;
import com.autopilot.event.AdapterStatusEvent;
import com.autopilot.event.RiskEvent;
import com.autopilot.event.TradeExecutedEvent;
import com.autopilot.exception.AdapterException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Turns application events into operator alerts.
 *
 * <p>Every alert carries a key; {@link AlertThrottle} drops repeats of a key inside the cooldown
 * window. Delivery runs on the {@code event-} executor so a slow or failing webhook never delays a
 * cycle.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationAdapter notificationAdapter;
    private final AlertThrottle alertThrottle;
    private final AdapterCallGuard adapterCallGuard;
    private final TradingSettings tradingSettings;
    private final Clock clock;

    public NotificationService(
            NotificationAdapter notificationAdapter,
            AlertThrottle alertThrottle,
            AdapterCallGuard adapterCallGuard,
            TradingSettings tradingSettings,
            Clock clock) {
        this.notificationAdapter = notificationAdapter;
        this.alertThrottle = alertThrottle;
        this.adapterCallGuard = adapterCallGuard;
        this.tradingSettings = tradingSettings;
        this.clock = clock;
    }

    /**
     * Sends {@code message} unless {@code key} is cooling down. Returns true if the adapter accepted
     * it.
     */
    public boolean notify(AlertSeverity severity, String key, String message) {
        Instant now = clock.instant();
        if (!alertThrottle.tryAcquire(key, now)) {
            log.debug("Alert suppressed by cooldown: {}", key);
            return false;
        }
        try {
            adapterCallGuard.run(
                    AdapterName.NOTIFICATION, "notify", () -> notificationAdapter.notify(severity, message));
            return true;
        } catch (AdapterException e) {
            log.warn("Alert {} not delivered: {}", key, e.getMessage());
            return false;
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onRiskEvent(RiskEvent event) {
        switch (event.getEventType()) {
            case CIRCUIT_BREAKER_TRIPPED -> notify(
                    AlertSeverity.CRITICAL,
                    "breaker:" + event.getAccountId() + ":" + event.getHaltReason(),
                    event.getMessage() + " " + event.getDetails());
            case CIRCUIT_BREAKER_RESET -> notify(
                    AlertSeverity.WARNING,
                    "breaker-reset:" + event.getAccountId(),
                    "Circuit breaker manually reset for " + event.getAccountId() + " " + event.getDetails());
            case EMERGENCY_STOP -> notify(AlertSeverity.CRITICAL, "emergency-stop", event.getMessage());
            case SESSION_RESET -> log.debug("Session reset for {}", event.getAccountId());
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onAdapterStatus(AdapterStatusEvent event) {
        if (event.isConnected() || event.getAdapter() == AdapterName.NOTIFICATION) {
            return;
        }
        notify(
                AlertSeverity.WARNING,
                "adapter:" + event.getAdapter(),
                "Adapter " + event.getAdapter() + " unavailable: " + event.getError());
    }

    @Async("eventExecutor")
    @EventListener
    public void onTradeExecuted(TradeExecutedEvent event) {
        OrderAudit order = event.getOrder();
        if (order.getPrice() == null) {
            return;
        }
        BigDecimal notional = order.getPrice().multiply(BigDecimal.valueOf(order.getAdmittedQuantity()));
        if (notional.compareTo(tradingSettings.getSignificantTradeValue()) < 0) {
            return;
        }
        notify(
                AlertSeverity.INFO,
                "trade:" + order.getAccountId() + ":" + order.getOrderId(),
                String.format(
                        "%s %s %d %s @ %s (%s)%s",
                        order.getAccountId(),
                        order.getSide(),
                        order.getAdmittedQuantity(),
                        order.getSymbol(),
                        order.getPrice(),
                        order.getOutcome(),
                        order.getReason() != null ? " " + order.getReason() : ""));
    }

    @Scheduled(fixedDelayString = "${autopilot.notifications.cooldown:15m}")
    public void evictExpiredCooldowns() {
        alertThrottle.evictExpired(clock.instant());
    }
}
