package com.autopilot.strategy;

import com.autopilot.config.StrategySettings;
import com.autopilot.domain.enums.ActionType;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.Candidate;
import com.autopilot.domain.model.CandidateAction;
import com.autopilot.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default long-only strategy driven by candidate score and confidence.
 *
 * <p>Exits a held symbol whose latest score or confidence dropped below the exit thresholds, and
 * opens symbols at or above both entry thresholds, highest score first. Opening orders ask for a
 * full position ({@code max_position_size x equity}); the risk engine clamps from there.
 */
public class ScoreThresholdStrategy implements TradingStrategy {

    private final StrategySettings settings;

    public ScoreThresholdStrategy(StrategySettings settings) {
        this.settings = settings;
    }

    @Override
    public List<CandidateAction> evaluate(Account account, List<Candidate> candidates, Map<String, BigDecimal> prices) {
        Map<String, Candidate> bySymbol = candidates.stream()
                .collect(Collectors.toMap(Candidate::getSymbol, Function.identity(), (a, b) -> a));
        List<CandidateAction> actions = new ArrayList<>();

        for (Position position : account.getPositions()) {
            Candidate candidate = bySymbol.get(position.getSymbol());
            if (candidate != null && isExitSignal(candidate)) {
                actions.add(CandidateAction.builder()
                        .type(ActionType.CLOSE)
                        .symbol(position.getSymbol())
                        .side(position.isLong() ? OrderSide.SELL : OrderSide.BUY)
                        .quantity(Math.abs(position.getQuantity()))
                        .referencePrice(position.getCurrentPrice())
                        .reason("score " + candidate.getScore() + "/conf " + candidate.getConfidence())
                        .build());
            }
        }

        BigDecimal targetNotional = account.getSettings().getMaxPositionSize().multiply(account.getEquity());
        for (Candidate candidate : candidates) {
            if (!isEntrySignal(candidate) || account.findPosition(candidate.getSymbol()).isPresent()) {
                continue;
            }
            BigDecimal price = prices.get(candidate.getSymbol());
            if (price == null || price.signum() <= 0) {
                continue;
            }
            int quantity = targetNotional.divide(price, 0, RoundingMode.DOWN).intValue();
            actions.add(CandidateAction.builder()
                    .type(ActionType.OPEN)
                    .symbol(candidate.getSymbol())
                    .side(OrderSide.BUY)
                    .quantity(quantity)
                    .referencePrice(price)
                    .kellyFraction(candidate.getKellyFraction())
                    .reason("score " + candidate.getScore() + "/conf " + candidate.getConfidence())
                    .build());
        }
        return actions;
    }

    private boolean isEntrySignal(Candidate candidate) {
        return candidate.getScore() >= settings.getEntryScore()
                && candidate.getConfidence() >= settings.getEntryConfidence();
    }

    private boolean isExitSignal(Candidate candidate) {
        return candidate.getScore() < settings.getExitScore()
                || candidate.getConfidence() < settings.getExitConfidence();
    }
}
