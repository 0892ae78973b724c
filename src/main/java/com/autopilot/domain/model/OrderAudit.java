package com.autopilot.domain.model;

import com.autopilot.domain.enums.ExitTrigger;
import com.autopilot.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Audit record for one admitted, rejected or failed order. */
@Value
@Builder
public class OrderAudit {

    public enum Outcome {
        FILLED,
        ACCEPTED,
        REJECTED,
        FAILED
    }

    long cycleSequence;
    String accountId;
    String symbol;
    OrderSide side;
    int requestedQuantity;
    int admittedQuantity;
    BigDecimal price;
    String orderId;
    Outcome outcome;
    ExitTrigger exitTrigger;
    String reason;
    Instant at;
}
