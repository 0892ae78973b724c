package com.autopilot.domain.model;

import com.autopilot.domain.enums.ActionType;
import com.autopilot.domain.enums.ExitTrigger;
import com.autopilot.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An intended change to one account's holdings, produced by a strategy or by the protective-exit
 * scan, before admission.
 *
 * <p>For OPEN, {@code quantity} is the number of shares to add on {@code side}. For RESIZE it is the
 * target absolute size of the existing position. CLOSE ignores it and closes the whole position.
 */
@Value
@Builder(toBuilder = true)
public class CandidateAction {

    ActionType type;
    String symbol;
    OrderSide side;
    int quantity;
    BigDecimal referencePrice;
    BigDecimal kellyFraction;

    @Builder.Default
    ExitTrigger exitTrigger = ExitTrigger.NONE;

    String reason;

    public boolean isProtectiveExit() {
        return type == ActionType.CLOSE && exitTrigger != ExitTrigger.NONE;
    }
}
