package com.autopilot.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AuditSettings {

    int bufferCapacity;
    Duration flushInterval;
}
