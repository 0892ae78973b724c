package com.autopilot.strategy;

import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.Candidate;
import com.autopilot.domain.model.CandidateAction;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Turns candidates into intended actions for one account. Implementations must treat the account as
 * read-only; every returned action still passes through the risk engine.
 */
public interface TradingStrategy {

    List<CandidateAction> evaluate(Account account, List<Candidate> candidates, Map<String, BigDecimal> prices);
}
