package tw.gc.paper.trader.services.ledger;

import tw.gc.paper.trader.entities.EquityPoint;
import tw.gc.paper.trader.entities.Trade;

import java.util.List;

/**
 * Performance figures derived from a trade history and equity curve. Computed on read, never stored.
 *
 * @param tradeCount closed trades
 * @param winRate share of trades with positive realized P&L
 * @param totalReturn (equity - starting balance) / starting balance
 * @param realizedPnl sum of realized P&L net of fees
 * @param sharpeRatio mean / stdev of per-trade returns, scaled by sqrt(252)
 * @param maxDrawdown largest peak-to-trough decline of the equity curve, as a fraction of the peak
 * @param profitFactor gross profit / gross loss, capped at {@value #PROFIT_FACTOR_CAP}
 */
public record LedgerStatistics(
        int tradeCount,
        double winRate,
        double totalReturn,
        double realizedPnl,
        double sharpeRatio,
        double maxDrawdown,
        double profitFactor
) {

    public static final double PROFIT_FACTOR_CAP = 10.0;
    private static final double ANNUALIZATION = Math.sqrt(252);

    public static LedgerStatistics from(List<Trade> trades, List<EquityPoint> equityCurve,
                                        double startingBalance, double currentEquity) {
        int count = trades.size();
        int wins = 0;
        double realized = 0.0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        for (Trade trade : trades) {
            realized += trade.getRealizedPnl();
            if (trade.getRealizedPnl() > 0) {
                wins++;
                grossProfit += trade.getRealizedPnl();
            } else {
                grossLoss += -trade.getRealizedPnl();
            }
        }
        double winRate = count == 0 ? 0.0 : (double) wins / count;
        double totalReturn = startingBalance > 0 ? (currentEquity - startingBalance) / startingBalance : 0.0;
        return new LedgerStatistics(count, winRate, totalReturn, realized,
                sharpe(trades), maxDrawdown(equityCurve, startingBalance), profitFactor(grossProfit, grossLoss));
    }

    static double sharpe(List<Trade> trades) {
        if (trades.size() < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (Trade trade : trades) {
            sum += trade.returnPct();
        }
        double mean = sum / trades.size();
        double variance = 0.0;
        for (Trade trade : trades) {
            double diff = trade.returnPct() - mean;
            variance += diff * diff;
        }
        double std = Math.sqrt(variance / trades.size());
        if (std == 0.0) {
            return 0.0;
        }
        return mean / std * ANNUALIZATION;
    }

    static double maxDrawdown(List<EquityPoint> equityCurve, double startingBalance) {
        double peak = startingBalance;
        double maxDrawdown = 0.0;
        for (EquityPoint point : equityCurve) {
            peak = Math.max(peak, point.equity());
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - point.equity()) / peak);
            }
        }
        return maxDrawdown;
    }

    static double profitFactor(double grossProfit, double grossLoss) {
        if (grossLoss == 0.0) {
            return grossProfit > 0 ? PROFIT_FACTOR_CAP : 0.0;
        }
        return Math.min(PROFIT_FACTOR_CAP, grossProfit / grossLoss);
    }
}
