package com.autopilot.config;

import lombok.Builder;
import lombok.Value;

/** Thresholds for the default score-based strategy. */
@Value
@Builder
public class StrategySettings {

    int entryScore;
    int entryConfidence;
    int exitScore;
    int exitConfidence;
}
