package tw.gc.paper.trader.entities;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.enums.TradeDirection;

import java.time.LocalDateTime;

/**
 * Entry instruction produced by position sizing and consumed by the ledger.
 * {@code sizeFraction} is the share of equity committed; {@code notional} is that share in quote currency.
 */
@Value
@Builder
@Jacksonized
public class Order {

    TradeDirection direction;
    double sizeFraction;
    double notional;
    double entryPrice;
    double stopLoss;
    double takeProfit;
    LocalDateTime openedAt;
    String strategyId;

    /**
     * Stop below entry and target above for longs, mirrored for shorts.
     */
    public boolean hasMonotonicExits() {
        if (direction == TradeDirection.LONG) {
            return stopLoss < entryPrice && takeProfit > entryPrice;
        }
        return stopLoss > entryPrice && takeProfit < entryPrice;
    }
}
