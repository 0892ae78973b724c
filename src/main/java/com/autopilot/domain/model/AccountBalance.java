package com.autopilot.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Broker-reported cash and total equity for one account. */
@Value
@Builder
public class AccountBalance {

    String accountId;
    BigDecimal cash;
    BigDecimal equity;
}
