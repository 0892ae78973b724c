package com.autopilot.risk;

import com.autopilot.domain.enums.OrderSide;
import lombok.Getter;

/**
 * ALLOW or REJECT for one candidate action.
 *
 * <p>An allowed decision carries the order to place: {@code side} and {@code quantity} may differ
 * from the request when the position-size limit clamped it or when the action was a RESIZE.
 */
@Getter
public class AdmissionDecision {

    private final boolean allowed;
    private final OrderSide side;
    private final int quantity;
    private final boolean clamped;
    private final boolean riskReducing;
    private final RejectReason rejectReason;

    private AdmissionDecision(
            boolean allowed,
            OrderSide side,
            int quantity,
            boolean clamped,
            boolean riskReducing,
            RejectReason rejectReason) {
        this.allowed = allowed;
        this.side = side;
        this.quantity = quantity;
        this.clamped = clamped;
        this.riskReducing = riskReducing;
        this.rejectReason = rejectReason;
    }

    public static AdmissionDecision allow(OrderSide side, int quantity, boolean clamped) {
        return new AdmissionDecision(true, side, quantity, clamped, false, null);
    }

    public static AdmissionDecision allowRiskReducing(OrderSide side, int quantity) {
        return new AdmissionDecision(true, side, quantity, false, true, null);
    }

    public static AdmissionDecision reject(RejectReason reason) {
        return new AdmissionDecision(false, null, 0, false, false, reason);
    }

    public boolean isRejected() {
        return !allowed;
    }

    public String describe() {
        if (allowed) {
            return "ALLOW " + side + " " + quantity + (clamped ? " (clamped)" : "");
        }
        return "REJECT " + rejectReason.getMessage();
    }
}
