package tw.gc.paper.trader.entities;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Read-only view of a ledger at one instant, as exposed by {@code status()}.
 */
@Value
@Builder
@Jacksonized
public class PortfolioSnapshot {

    double startingBalance;
    double cash;
    double equity;
    double unrealizedPnl;
    double realizedPnl;
    Double lastPrice;
    Position openPosition;
    int tradeCount;
    double winRate;
    double sharpeRatio;
    double maxDrawdown;
    double totalReturn;
    double profitFactor;
}
