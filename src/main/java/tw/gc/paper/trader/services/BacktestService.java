package tw.gc.paper.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.entities.OptimizationResult;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.enums.ExitReason;
import tw.gc.paper.trader.exceptions.InsufficientHistoryException;
import tw.gc.paper.trader.services.ledger.PortfolioLedger;
import tw.gc.paper.trader.services.positionsizing.RiskPolicy;

import java.util.List;

/**
 * Replays historical samples through the live decision pipeline on an isolated ledger.
 * Safe to call concurrently: every call owns its ledger.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BacktestService {

    private final DecisionPipeline decisionPipeline;
    private final StrategyScoringService strategyScoringService;

    /**
     * @param lookback configured window length, the same one the live loop uses
     * @param minReplaySamples samples that must remain after the strategy's warm-up
     * @throws InsufficientHistoryException if history cannot cover warm-up plus minimum replay
     */
    public BacktestResult run(StrategyDefinition strategy, List<PriceSample> history, RiskPolicy policy,
                              int lookback, int minReplaySamples) {
        int windowSize = decisionPipeline.windowSize(strategy, lookback);
        int required = decisionPipeline.windowSize(strategy, 0) + minReplaySamples;
        if (history == null || history.size() < required) {
            throw new InsufficientHistoryException(strategy.getId(), history == null ? 0 : history.size(), required);
        }

        PortfolioLedger ledger = new PortfolioLedger(policy.getStartingBalance(), policy.getFeeRate());
        for (int i = 0; i < history.size(); i++) {
            List<PriceSample> window = history.subList(Math.max(0, i - windowSize + 1), i + 1);
            decisionPipeline.process(history.get(i), window, strategy, ledger, policy);
        }

        PriceSample last = history.get(history.size() - 1);
        ledger.closePosition(last.getClose(), last.getTimestamp(), ExitReason.MANUAL);

        BacktestResult result = new BacktestResult(strategy, ledger.getTrades(), ledger.getEquityCurve(),
                ledger.statistics(), policy.getStartingBalance(),
                history.get(0).getTimestamp(), last.getTimestamp());
        log.debug("🧪 Backtest {}: {} trades, return {}%", strategy.getId(), result.statistics().tradeCount(),
                String.format("%.2f", result.statistics().totalReturn() * 100));
        return result;
    }

    /**
     * Backtest and score a candidate.
     */
    public ScoredBacktest evaluate(StrategyDefinition strategy, List<PriceSample> history, RiskPolicy policy,
                                   int lookback, int minReplaySamples) {
        BacktestResult backtest = run(strategy, history, policy, lookback, minReplaySamples);
        OptimizationResult result = strategyScoringService.toResult(backtest);
        return new ScoredBacktest(result, backtest);
    }

    public record ScoredBacktest(OptimizationResult result, BacktestResult backtest) {
    }
}
