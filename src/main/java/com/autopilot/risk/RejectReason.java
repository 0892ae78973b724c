package com.autopilot.risk;

/** Why the risk engine refused a candidate action. Messages are surfaced in cycle results. */
public enum RejectReason {
    ACCOUNT_HALTED("account halted"),
    PDT_LIMIT("PDT limit"),
    ENTRY_LIMIT("entry limit"),
    BELOW_MINIMUM_SIZE("below minimum size"),
    EXPOSURE_LIMIT("exposure limit"),
    NO_POSITION("no open position"),
    INVALID_ACTION("invalid action");

    private final String message;

    RejectReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
