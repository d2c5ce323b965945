package tw.gc.paper.trader.entities;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.enums.TradeDirection;

import java.time.LocalDateTime;

/**
 * The single open position of a portfolio.
 */
@Value
@Builder
@Jacksonized
public class Position {

    TradeDirection direction;
    double entryPrice;
    double quantity;
    double notional;
    double stopLoss;
    double takeProfit;
    double entryFee;
    LocalDateTime openedAt;
    String strategyId;

    public double unrealizedPnl(double price) {
        return direction.sign() * (price - entryPrice) * quantity;
    }

    public boolean stopHit(PriceSample sample) {
        return direction == TradeDirection.LONG ? sample.getLow() <= stopLoss : sample.getHigh() >= stopLoss;
    }

    public boolean targetHit(PriceSample sample) {
        return direction == TradeDirection.LONG ? sample.getHigh() >= takeProfit : sample.getLow() <= takeProfit;
    }
}
