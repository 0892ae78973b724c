package com.autopilot.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Broker acknowledgement of a submitted order. {@code filledQuantity} is zero when the order was
 * accepted but has not filled yet.
 */
@Value
@Builder
public class OrderReceipt {

    String orderId;
    int filledQuantity;
    BigDecimal averagePrice;

    public boolean isFilled() {
        return filledQuantity > 0;
    }
}
