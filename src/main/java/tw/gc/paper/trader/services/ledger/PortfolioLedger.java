package tw.gc.paper.trader.services.ledger;

import lombok.extern.slf4j.Slf4j;
import tw.gc.paper.trader.entities.EquityPoint;
import tw.gc.paper.trader.entities.Order;
import tw.gc.paper.trader.entities.Position;
import tw.gc.paper.trader.entities.PortfolioSnapshot;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.entities.Trade;
import tw.gc.paper.trader.enums.ExitReason;
import tw.gc.paper.trader.enums.RejectionReason;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Virtual account holding cash, at most one open position, the append-only trade history
 * and the equity curve.
 *
 * <p>Not thread-safe. The live ledger is owned by the decision loop; each backtest owns a private one.
 *
 * <p>Cash changes only by realized P&L and fees; equity = cash + unrealized P&L of the open position.
 * Fees are charged on both legs at {@code feeRate} of the traded notional.
 */
@Slf4j
public class PortfolioLedger {

    private final double startingBalance;
    private final List<Trade> trades;
    private final List<EquityPoint> equityCurve;
    private double feeRate;
    private double cash;
    private Position openPosition;
    private Double lastPrice;
    private long version;

    public PortfolioLedger(double startingBalance, double feeRate) {
        this(startingBalance, startingBalance, null, List.of(), List.of(), null, feeRate);
    }

    private PortfolioLedger(double startingBalance, double cash, Position openPosition,
                            List<Trade> trades, List<EquityPoint> equityCurve, Double lastPrice, double feeRate) {
        if (!(startingBalance > 0)) {
            throw new IllegalArgumentException("startingBalance must be positive");
        }
        this.startingBalance = startingBalance;
        this.cash = cash;
        this.openPosition = openPosition;
        this.trades = new ArrayList<>(trades);
        this.equityCurve = new ArrayList<>(equityCurve);
        this.lastPrice = lastPrice;
        this.feeRate = feeRate;
    }

    /**
     * Rebuild a ledger from persisted state.
     */
    public static PortfolioLedger restore(double startingBalance, double cash, Position openPosition,
                                          List<Trade> trades, List<EquityPoint> equityCurve,
                                          Double lastPrice, double feeRate) {
        return new PortfolioLedger(startingBalance, cash, openPosition,
                trades == null ? List.of() : trades,
                equityCurve == null ? List.of() : equityCurve,
                lastPrice, feeRate);
    }

    /**
     * Open a position from an entry order. Only valid while flat.
     */
    public LedgerResult applyOrder(Order order) {
        if (order == null || order.getDirection() == null || order.getOpenedAt() == null) {
            return LedgerResult.rejected(RejectionReason.INVALID_ORDER, "Missing direction or timestamp");
        }
        if (openPosition != null) {
            return LedgerResult.rejected(RejectionReason.POSITION_ALREADY_OPEN,
                    "Open " + openPosition.getDirection() + " from " + openPosition.getStrategyId());
        }
        if (!(order.getEntryPrice() > 0) || !(order.getNotional() > 0)) {
            return LedgerResult.rejected(RejectionReason.INVALID_ORDER,
                    String.format("entry %.4f notional %.2f", order.getEntryPrice(), order.getNotional()));
        }
        if (!order.hasMonotonicExits()) {
            return LedgerResult.rejected(RejectionReason.INVALID_STOP_PLACEMENT,
                    String.format("%s entry %.4f stop %.4f take %.4f", order.getDirection(),
                            order.getEntryPrice(), order.getStopLoss(), order.getTakeProfit()));
        }
        double equity = cash;
        if (order.getSizeFraction() > 1.0 || order.getNotional() > equity) {
            return LedgerResult.rejected(RejectionReason.SIZE_EXCEEDS_LIMIT,
                    String.format("notional %.2f > equity %.2f", order.getNotional(), equity));
        }

        double quantity = order.getNotional() / order.getEntryPrice();
        double entryFee = order.getNotional() * feeRate;
        cash -= entryFee;
        openPosition = Position.builder()
                .direction(order.getDirection())
                .entryPrice(order.getEntryPrice())
                .quantity(quantity)
                .notional(order.getNotional())
                .stopLoss(order.getStopLoss())
                .takeProfit(order.getTakeProfit())
                .entryFee(entryFee)
                .openedAt(order.getOpenedAt())
                .strategyId(order.getStrategyId())
                .build();
        lastPrice = order.getEntryPrice();
        version++;
        return LedgerResult.accepted(openPosition);
    }

    /**
     * Close the open position if the candle crossed its stop-loss or take-profit.
     * The stop wins when both levels lie inside the same candle. Fills happen at the level itself.
     */
    public Optional<Trade> checkExits(PriceSample sample) {
        if (openPosition == null) {
            return Optional.empty();
        }
        if (openPosition.stopHit(sample)) {
            return closePosition(openPosition.getStopLoss(), sample.getTimestamp(), ExitReason.STOP_LOSS);
        }
        if (openPosition.targetHit(sample)) {
            return closePosition(openPosition.getTakeProfit(), sample.getTimestamp(), ExitReason.TAKE_PROFIT);
        }
        return Optional.empty();
    }

    public Optional<Trade> closePosition(double exitPrice, LocalDateTime timestamp, ExitReason reason) {
        if (openPosition == null) {
            return Optional.empty();
        }
        Position position = openPosition;
        double pricePnl = position.unrealizedPnl(exitPrice);
        double exitFee = exitPrice * position.getQuantity() * feeRate;
        cash += pricePnl - exitFee;

        Trade trade = Trade.builder()
                .direction(position.getDirection())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exitPrice)
                .quantity(position.getQuantity())
                .notional(position.getNotional())
                .realizedPnl(pricePnl - position.getEntryFee() - exitFee)
                .fees(position.getEntryFee() + exitFee)
                .openedAt(position.getOpenedAt())
                .closedAt(timestamp)
                .strategyId(position.getStrategyId())
                .exitReason(reason)
                .build();
        trades.add(trade);
        openPosition = null;
        lastPrice = exitPrice;
        version++;
        return Optional.of(trade);
    }

    /**
     * Revalue the open position at {@code price} and append a point to the equity curve.
     */
    public EquityPoint markToMarket(double price, LocalDateTime timestamp) {
        lastPrice = price;
        EquityPoint point = new EquityPoint(timestamp, equity(price));
        equityCurve.add(point);
        version++;
        return point;
    }

    public double equity(double price) {
        return cash + unrealizedPnl(price);
    }

    /**
     * Equity at the last known price.
     */
    public double equity() {
        return lastPrice == null ? cash : equity(lastPrice);
    }

    public double unrealizedPnl(double price) {
        return openPosition == null ? 0.0 : openPosition.unrealizedPnl(price);
    }

    public boolean hasOpenPosition() {
        return openPosition != null;
    }

    /**
     * True while nothing has ever been traded or marked.
     */
    public boolean isPristine() {
        return openPosition == null && trades.isEmpty() && equityCurve.isEmpty();
    }

    public LedgerStatistics statistics() {
        return LedgerStatistics.from(trades, equityCurve, startingBalance, equity());
    }

    public PortfolioSnapshot snapshot() {
        LedgerStatistics stats = statistics();
        return PortfolioSnapshot.builder()
                .startingBalance(startingBalance)
                .cash(cash)
                .equity(equity())
                .unrealizedPnl(lastPrice == null ? 0.0 : unrealizedPnl(lastPrice))
                .realizedPnl(stats.realizedPnl())
                .lastPrice(lastPrice)
                .openPosition(openPosition)
                .tradeCount(stats.tradeCount())
                .winRate(stats.winRate())
                .sharpeRatio(stats.sharpeRatio())
                .maxDrawdown(stats.maxDrawdown())
                .totalReturn(stats.totalReturn())
                .profitFactor(stats.profitFactor())
                .build();
    }

    public double getStartingBalance() {
        return startingBalance;
    }

    public double getCash() {
        return cash;
    }

    public Position getOpenPosition() {
        return openPosition;
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public Double getLastPrice() {
        return lastPrice;
    }

    public double getFeeRate() {
        return feeRate;
    }

    /**
     * Applies to fills after the call.
     */
    public void setFeeRate(double feeRate) {
        this.feeRate = feeRate;
    }

    /**
     * Incremented on every mutation. Lets callers detect whether a tick changed anything.
     */
    public long getVersion() {
        return version;
    }
}
