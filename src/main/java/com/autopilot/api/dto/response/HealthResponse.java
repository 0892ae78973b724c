package com.autopilot.api.dto.response;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Returned by GET /health. Adapter connectivity reflects the latest recorded call or background
 * probe; reading it never contacts an adapter.
 */
@Getter
@Builder
public class HealthResponse {

    /** "UP", "DEGRADED", "EMERGENCY_STOP" or "STOPPED". */
    private final String status;

    private final long uptimeSeconds;
    private final String schedulerState;
    private final String mode;
    private final boolean marketOpen;
    private final String marketPhase;
    private final Instant nextBoundary;
    private final long lastCycleSequence;
    private final Instant lastCycleAt;
    private final int haltedAccounts;
    private final int pendingAuditRecords;
    private final Map<String, AdapterHealth> adapters;

    /** Present only after an emergency stop was requested. */
    private final EmergencyStopInfo emergencyStop;

    @Getter
    @Builder
    public static class AdapterHealth {

        /** Null until the adapter has been called or probed at least once. */
        private final Boolean connected;

        private final Instant lastCheckedAt;
        private final String lastError;
        private final int consecutiveFailures;
    }

    @Getter
    @Builder
    public static class EmergencyStopInfo {
        private final String reason;
        private final String origin;
        private final Instant requestedAt;
    }
}
