package com.autopilot.observability;

import com.autopilot.domain.enums.CircuitBreakerStatus;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.model.CycleResult;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the read surface shows, swapped in atomically at the end of each cycle. Sequence 0 is
 * the startup snapshot taken before the first cycle.
 */
@Value
@Builder
public class SystemSnapshot {

    long cycleSequence;
    OperatingMode mode;
    Instant capturedAt;
    Instant lastCycleAt;
    List<AccountSnapshot> accounts;

    /** Most recent cycles, oldest first. */
    List<CycleResult> recentCycles;

    public int haltedAccountCount() {
        return (int) accounts.stream()
                .filter(a -> a.getCircuitBreaker() == CircuitBreakerStatus.OPEN)
                .count();
    }
}
