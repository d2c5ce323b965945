package tw.gc.paper.trader.services;

import tw.gc.paper.trader.entities.StrategyDefinition;

import java.time.LocalDateTime;

/**
 * Content of the active-strategy slot. Immutable; a score refresh produces a new instance.
 *
 * @param score most recent composite score of {@code definition}
 * @param backtest replay that produced {@code score}, null until the first optimization cycle
 */
public record ActiveStrategy(StrategyDefinition definition, double score, BacktestResult backtest,
                             LocalDateTime activatedAt) {

    public String id() {
        return definition.getId();
    }

    public ActiveStrategy withScore(double refreshedScore, BacktestResult refreshedBacktest) {
        return new ActiveStrategy(definition, refreshedScore, refreshedBacktest, activatedAt);
    }
}
