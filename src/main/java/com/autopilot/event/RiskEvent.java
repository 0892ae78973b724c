package com.autopilot.event;

import com.autopilot.domain.enums.HaltReason;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the risk engine and the scheduler when trading is halted, resumed or reset.
 *
 * <p>Listeners:
 * <ul>
 *   <li>NotificationService - alerts the operator channel</li>
 *   <li>BufferedAuditWriter - persists circuit-breaker events</li>
 *   <li>CustomMetricsService - counts trips</li>
 * </ul>
 *
 * <p>{@code accountId} is null for process-wide events (EMERGENCY_STOP).
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String accountId;
    private final HaltReason haltReason;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String accountId,
            HaltReason haltReason,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.accountId = accountId;
        this.haltReason = haltReason;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getAccountId() {
        return accountId;
    }

    public HaltReason getHaltReason() {
        return haltReason;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific values, e.g. {"dailyRealizedPnl": -950.00, "limit": -900.00} for a
     * daily-loss trip.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
