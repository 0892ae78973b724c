package com.autopilot.core.engine;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Outcome of an emergency liquidation; every step is best-effort and failures are listed. */
@Value
@Builder
public class LiquidationResult {

    int ordersCancelled;
    int positionsClosed;

    @Singular
    List<String> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
