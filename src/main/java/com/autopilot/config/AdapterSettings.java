package com.autopilot.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Deadline and retry policy applied to every adapter call. */
@Value
@Builder
public class AdapterSettings {

    Duration callTimeout;
    int maxAttempts;
    Duration initialBackoff;
    double backoffMultiplier;
}
