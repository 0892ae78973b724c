package com.autopilot.observability;

import com.autopilot.adapter.AdapterHealthRegistry;
import com.autopilot.adapter.AdapterStatus;
import com.autopilot.api.dto.response.HealthResponse;
import com.autopilot.audit.BufferedAuditWriter;
import com.autopilot.calendar.MarketSessionOracle;
import com.autopilot.core.engine.EmergencyStopSignal;
import com.autopilot.core.engine.ModeScheduler;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.SchedulerState;
import com.autopilot.domain.model.EmergencyStopRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Assembles the health view from already-published state: the scheduler, the last snapshot, the
 * adapter registry and the market calendar. Side-effect free.
 *
 * <p>Status precedence: EMERGENCY_STOP, then STOPPED, then DEGRADED (an adapter's latest outcome
 * was a failure, or an account is halted), otherwise UP.
 */
@Service
public class HealthService {

    private final ModeScheduler modeScheduler;
    private final SnapshotPublisher snapshotPublisher;
    private final AdapterHealthRegistry adapterHealthRegistry;
    private final MarketSessionOracle marketSessionOracle;
    private final EmergencyStopSignal emergencyStopSignal;
    private final BufferedAuditWriter bufferedAuditWriter;
    private final Clock clock;

    public HealthService(
            ModeScheduler modeScheduler,
            SnapshotPublisher snapshotPublisher,
            AdapterHealthRegistry adapterHealthRegistry,
            MarketSessionOracle marketSessionOracle,
            EmergencyStopSignal emergencyStopSignal,
            BufferedAuditWriter bufferedAuditWriter,
            Clock clock) {
        this.modeScheduler = modeScheduler;
        this.snapshotPublisher = snapshotPublisher;
        this.adapterHealthRegistry = adapterHealthRegistry;
        this.marketSessionOracle = marketSessionOracle;
        this.emergencyStopSignal = emergencyStopSignal;
        this.bufferedAuditWriter = bufferedAuditWriter;
        this.clock = clock;
    }

    public HealthResponse getHealth() {
        Instant now = clock.instant();
        SystemSnapshot snapshot = snapshotPublisher.current();

        Map<String, HealthResponse.AdapterHealth> adapters = new LinkedHashMap<>();
        boolean adapterDown = false;
        for (Map.Entry<AdapterName, AdapterStatus> entry : adapterHealthRegistry.snapshot().entrySet()) {
            AdapterStatus status = entry.getValue();
            boolean checked = status.getLastCheckedAt() != null;
            adapterDown |= checked && !status.isConnected();
            adapters.put(entry.getKey().name(), HealthResponse.AdapterHealth.builder()
                    .connected(checked ? status.isConnected() : null)
                    .lastCheckedAt(status.getLastCheckedAt())
                    .lastError(status.getLastError())
                    .consecutiveFailures(status.getConsecutiveFailures())
                    .build());
        }

        Optional<EmergencyStopRequest> emergency = emergencyStopSignal.current();
        SchedulerState schedulerState = modeScheduler.getState();
        int halted = snapshot.haltedAccountCount();
        Instant startedAt = modeScheduler.getStartedAt();

        return HealthResponse.builder()
                .status(status(emergency.isPresent(), schedulerState, adapterDown, halted))
                .uptimeSeconds(startedAt != null ? Duration.between(startedAt, now).getSeconds() : 0)
                .schedulerState(schedulerState.name())
                .mode(modeScheduler.getMode().name())
                .marketOpen(marketSessionOracle.isMarketOpen(now))
                .marketPhase(marketSessionOracle.phaseAt(now).name())
                .nextBoundary(marketSessionOracle.nextBoundary(now).orElse(null))
                .lastCycleSequence(snapshot.getCycleSequence())
                .lastCycleAt(snapshot.getLastCycleAt())
                .haltedAccounts(halted)
                .pendingAuditRecords(bufferedAuditWriter.pendingCount())
                .adapters(adapters)
                .emergencyStop(emergency
                        .map(r -> HealthResponse.EmergencyStopInfo.builder()
                                .reason(r.getReason())
                                .origin(r.getOrigin().name())
                                .requestedAt(r.getRequestedAt())
                                .build())
                        .orElse(null))
                .build();
    }

    static String status(boolean emergencyStop, SchedulerState schedulerState, boolean adapterDown, int haltedAccounts) {
        if (emergencyStop) {
            return "EMERGENCY_STOP";
        }
        if (schedulerState == SchedulerState.STOPPED || schedulerState == SchedulerState.STOPPING) {
            return "STOPPED";
        }
        if (adapterDown || haltedAccounts > 0) {
            return "DEGRADED";
        }
        return "UP";
    }
}
