package com.autopilot.event;

import com.autopilot.domain.model.OrderAudit;
import org.springframework.context.ApplicationEvent;

/** Published for every filled or broker-accepted order. */
public class TradeExecutedEvent extends ApplicationEvent {

    private final OrderAudit order;

    public TradeExecutedEvent(Object source, OrderAudit order) {
        super(source);
        this.order = order;
    }

    public OrderAudit getOrder() {
        return order;
    }
}
