package tw.gc.paper.trader.services;

import org.springframework.stereotype.Service;
import tw.gc.paper.trader.entities.OptimizationResult;
import tw.gc.paper.trader.services.ledger.LedgerStatistics;

/**
 * Composite 0..1 score of a backtest.
 *
 * <pre>
 * score = 0.40 * returnScore + 0.25 * riskAdjusted + 0.15 * winScore + 0.10 * activityScore + profitFactorBonus
 * </pre>
 * clamped to [0, 1].
 */
@Service
public class StrategyScoringService {

    private static final double RETURN_WEIGHT = 0.40;
    private static final double RISK_ADJUSTED_WEIGHT = 0.25;
    private static final double WIN_RATE_WEIGHT = 0.15;
    private static final double ACTIVITY_WEIGHT = 0.10;
    private static final double MAX_PROFIT_FACTOR_BONUS = 0.20;

    private static final double TARGET_SHARPE = 5.0;
    private static final double DRAWDOWN_SCALE = 0.30;
    private static final double TARGET_WIN_RATE = 0.80;
    private static final int TARGET_TRADES = 200;

    public double score(LedgerStatistics stats) {
        double returnScore = returnScore(stats.totalReturn());
        double drawdownPenalty = Math.min(0.5, stats.maxDrawdown() / DRAWDOWN_SCALE);
        double riskAdjusted = clamp(stats.sharpeRatio() / TARGET_SHARPE, 0.0, 1.0) * (1.0 - drawdownPenalty);
        double winScore = Math.min(1.0, stats.winRate() / TARGET_WIN_RATE);
        double activityScore = Math.min(1.0, stats.tradeCount() / (double) TARGET_TRADES);
        double profitFactorBonus = stats.tradeCount() == 0
                ? 0.0
                : clamp((stats.profitFactor() - 1.0) / 5.0, 0.0, MAX_PROFIT_FACTOR_BONUS);

        double composite = RETURN_WEIGHT * returnScore
                + RISK_ADJUSTED_WEIGHT * riskAdjusted
                + WIN_RATE_WEIGHT * winScore
                + ACTIVITY_WEIGHT * activityScore
                + profitFactorBonus;
        return clamp(composite, 0.0, 1.0);
    }

    public OptimizationResult toResult(BacktestResult backtest) {
        LedgerStatistics stats = backtest.statistics();
        return OptimizationResult.builder()
                .strategy(backtest.strategy())
                .score(score(stats))
                .totalReturn(stats.totalReturn())
                .winRate(stats.winRate())
                .sharpeRatio(stats.sharpeRatio())
                .maxDrawdown(stats.maxDrawdown())
                .profitFactor(stats.profitFactor())
                .tradeCount(stats.tradeCount())
                .rangeStart(backtest.rangeStart())
                .rangeEnd(backtest.rangeEnd())
                .build();
    }

    /**
     * Log-compressed so a 10% return already scores well and outliers do not dominate.
     */
    static double returnScore(double totalReturn) {
        double magnitude = Math.min(1.0, Math.log1p(Math.abs(10.0 * totalReturn)) / 3.0);
        return Math.signum(totalReturn) * magnitude;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
