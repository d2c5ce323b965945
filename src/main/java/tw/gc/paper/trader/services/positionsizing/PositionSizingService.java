package tw.gc.paper.trader.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.entities.Order;
import tw.gc.paper.trader.enums.RejectionReason;
import tw.gc.paper.trader.enums.TradeDirection;
import tw.gc.paper.trader.services.ledger.PortfolioLedger;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.time.LocalDateTime;

/**
 * Converts a signal into a bounded entry order under a {@link RiskPolicy}.
 *
 * <p>Sizing: {@code fraction = min(maxPositionFraction, confidence * fullConfidenceFraction)},
 * {@code notional = fraction * equity}. Stop-loss and take-profit are percentage offsets from entry,
 * or multiples of the average true range when the policy turns ATR stops on.
 *
 * <p>Any limit breach is returned as a typed rejection. Orders are never shrunk or moved to fit.
 */
@Service
@Slf4j
public class PositionSizingService {

    public SizingDecision size(TradeSignal signal, PortfolioLedger ledger, double entryPrice,
                               LocalDateTime timestamp, RiskPolicy policy) {
        return size(signal, ledger, entryPrice, timestamp, policy, null);
    }

    /**
     * @param atr average true range at entry, required when {@link RiskPolicy#usesAtrStops()}
     */
    public SizingDecision size(TradeSignal signal, PortfolioLedger ledger, double entryPrice,
                               LocalDateTime timestamp, RiskPolicy policy, Double atr) {
        if (signal == null || signal.isFlat()) {
            return SizingDecision.rejected(RejectionReason.FLAT_SIGNAL, "No direction");
        }
        if (signal.getConfidence() < policy.getMinConfidence()) {
            return SizingDecision.rejected(RejectionReason.LOW_CONFIDENCE,
                    String.format("confidence %.2f < %.2f", signal.getConfidence(), policy.getMinConfidence()));
        }
        if (ledger.hasOpenPosition()) {
            return SizingDecision.rejected(RejectionReason.POSITION_ALREADY_OPEN,
                    "Open " + ledger.getOpenPosition().getDirection() + " position");
        }
        if (!(entryPrice > 0) || Double.isInfinite(entryPrice)) {
            return SizingDecision.rejected(RejectionReason.INVALID_ORDER, "Entry price " + entryPrice);
        }

        double equity = ledger.equity(entryPrice);
        if (equity <= 0) {
            return SizingDecision.rejected(RejectionReason.INSUFFICIENT_EQUITY, String.format("equity %.2f", equity));
        }

        double fraction;
        if (signal.getRequestedFraction() != null) {
            fraction = signal.getRequestedFraction();
            if (fraction > policy.getMaxPositionFraction()) {
                return SizingDecision.rejected(RejectionReason.SIZE_EXCEEDS_LIMIT,
                        String.format("requested %.4f > max %.4f", fraction, policy.getMaxPositionFraction()));
            }
            if (!(fraction > 0)) {
                return SizingDecision.rejected(RejectionReason.INVALID_ORDER, "Requested fraction " + fraction);
            }
        } else {
            fraction = Math.min(policy.getMaxPositionFraction(),
                    signal.getConfidence() * policy.getFullConfidenceFraction());
        }

        double notional = fraction * equity;
        if (notional < policy.getMinTradeNotional()) {
            return SizingDecision.rejected(RejectionReason.BELOW_MINIMUM_SIZE,
                    String.format("notional %.2f < %.2f", notional, policy.getMinTradeNotional()));
        }

        TradeDirection direction = signal.getDirection() == TradeSignal.SignalDirection.LONG
                ? TradeDirection.LONG : TradeDirection.SHORT;
        double stopOffset;
        double takeOffset;
        if (policy.usesAtrStops()) {
            if (atr == null) {
                return SizingDecision.rejected(RejectionReason.INVALID_STOP_PLACEMENT,
                        "ATR(" + policy.getAtrPeriod() + ") unavailable");
            }
            stopOffset = atr * policy.getAtrStopMultiplier();
            takeOffset = atr * policy.getAtrTakeMultiplier();
        } else {
            stopOffset = entryPrice * policy.getStopLossPct() / 100.0;
            takeOffset = entryPrice * policy.getTakeProfitPct() / 100.0;
        }
        double stopLoss = entryPrice - direction.sign() * stopOffset;
        double takeProfit = entryPrice + direction.sign() * takeOffset;

        Order order = Order.builder()
                .direction(direction)
                .sizeFraction(fraction)
                .notional(notional)
                .entryPrice(entryPrice)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .openedAt(timestamp)
                .strategyId(signal.getStrategyId())
                .build();

        if (!order.hasMonotonicExits() || !(stopLoss > 0) || !(takeProfit > 0)) {
            return SizingDecision.rejected(RejectionReason.INVALID_STOP_PLACEMENT,
                    String.format("%s entry %.4f stop %.4f take %.4f", direction, entryPrice, stopLoss, takeProfit));
        }

        log.debug("📐 Sized {} order: {}% of equity {} = {}", direction,
                String.format("%.2f", fraction * 100), String.format("%.2f", equity), String.format("%.2f", notional));
        return SizingDecision.accepted(order);
    }
}
