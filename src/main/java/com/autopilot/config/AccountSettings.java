package com.autopilot.config;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Per-account risk configuration, fixed for the life of the process.
 *
 * <p>{@code dailyLossLimit} is already resolved against the global default.
 */
@Value
@Builder
public class AccountSettings {

    String accountId;
    BigDecimal startingEquity;
    BigDecimal maxPositionSize;
    boolean aggressiveSizingEnabled;
    BigDecimal riskMultiplier;
    BigDecimal dailyLossLimit;

    @ToString.Exclude
    String apiKeyId;

    @ToString.Exclude
    String apiSecret;

    /** Multiplier actually applied to Kelly sizing; capped at 1.0 unless aggressive sizing is on. */
    public BigDecimal effectiveRiskMultiplier() {
        if (aggressiveSizingEnabled) {
            return riskMultiplier;
        }
        return riskMultiplier.min(BigDecimal.ONE);
    }

    public boolean hasCredentials() {
        return apiKeyId != null && !apiKeyId.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }
}
