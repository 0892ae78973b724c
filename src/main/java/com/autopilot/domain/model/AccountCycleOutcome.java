package com.autopilot.domain.model;

import com.autopilot.domain.enums.AccountStepStatus;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** One account's slot within a {@link CycleResult}. */
@Value
@Builder
public class AccountCycleOutcome {

    String accountId;
    AccountStepStatus status;

    /** Admitted orders sent to the broker. */
    int ordersAttempted;

    int ordersFilled;

    /** Candidate actions refused by the risk engine. */
    int ordersRejected;

    /** Admitted orders the broker call failed for. */
    int ordersFailed;

    @Singular
    List<String> errors;

    @Singular
    List<String> rejections;

    /** True when nothing useful happened because the account step itself failed. */
    public boolean isFullyFailed() {
        return status == AccountStepStatus.FAILED;
    }
}
