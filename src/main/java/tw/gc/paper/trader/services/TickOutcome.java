package tw.gc.paper.trader.services;

import tw.gc.paper.trader.entities.EquityPoint;
import tw.gc.paper.trader.entities.Order;
import tw.gc.paper.trader.entities.Trade;
import tw.gc.paper.trader.enums.RejectionReason;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.util.List;

/**
 * What one pass of the decision pipeline did to a ledger.
 *
 * @param closedTrades trades closed this tick, in the order they closed
 * @param openedOrder entry order accepted by the ledger, or null
 * @param rejection why a non-flat signal did not open a position, or null
 */
public record TickOutcome(
        TradeSignal signal,
        List<Trade> closedTrades,
        Order openedOrder,
        RejectionReason rejection,
        String rejectionDetail,
        EquityPoint equityPoint
) {

    public boolean changedPosition() {
        return !closedTrades.isEmpty() || openedOrder != null;
    }
}
