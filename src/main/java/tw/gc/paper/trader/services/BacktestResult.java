package tw.gc.paper.trader.services;

import tw.gc.paper.trader.entities.EquityPoint;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.entities.Trade;
import tw.gc.paper.trader.services.ledger.LedgerStatistics;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Output of one replay of a strategy through a private ledger.
 */
public record BacktestResult(
        StrategyDefinition strategy,
        List<Trade> trades,
        List<EquityPoint> equityCurve,
        LedgerStatistics statistics,
        double startingBalance,
        LocalDateTime rangeStart,
        LocalDateTime rangeEnd
) {
    public BacktestResult {
        trades = List.copyOf(trades);
        equityCurve = List.copyOf(equityCurve);
    }
}
