package tw.gc.paper.trader.entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.enums.ExitReason;
import tw.gc.paper.trader.enums.TradeDirection;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A closed position. Appended to the trade history and never modified.
 */
@Value
@Builder
@Jacksonized
public class Trade {

    TradeDirection direction;
    double entryPrice;
    double exitPrice;
    double quantity;
    double notional;

    /**
     * Price P&L minus entry and exit fees.
     */
    double realizedPnl;
    double fees;
    LocalDateTime openedAt;
    LocalDateTime closedAt;
    String strategyId;
    ExitReason exitReason;

    @JsonIgnore
    public Duration getDuration() {
        return Duration.between(openedAt, closedAt);
    }

    @JsonIgnore
    public boolean isWin() {
        return realizedPnl > 0;
    }

    /**
     * Return on the notional committed to the trade.
     */
    public double returnPct() {
        return notional == 0 ? 0.0 : realizedPnl / notional;
    }
}
