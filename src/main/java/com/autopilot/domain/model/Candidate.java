package com.autopilot.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A scored symbol from the candidate source.
 *
 * <p>{@code kellyFraction} is optional and used only when Kelly sizing is enabled.
 */
@Value
@Builder
public class Candidate {

    String symbol;
    int score;
    int confidence;
    BigDecimal kellyFraction;
}
