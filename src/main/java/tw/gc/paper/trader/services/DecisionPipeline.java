package tw.gc.paper.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.entities.Order;
import tw.gc.paper.trader.entities.Position;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.entities.Trade;
import tw.gc.paper.trader.enums.ExitReason;
import tw.gc.paper.trader.enums.RejectionReason;
import tw.gc.paper.trader.enums.TradeDirection;
import tw.gc.paper.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.paper.trader.services.ledger.LedgerResult;
import tw.gc.paper.trader.services.ledger.PortfolioLedger;
import tw.gc.paper.trader.services.positionsizing.PositionSizingService;
import tw.gc.paper.trader.services.positionsizing.RiskPolicy;
import tw.gc.paper.trader.services.positionsizing.SizingDecision;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The per-sample decision path shared by the live loop and the backtester:
 * exits, signal, close/flip, sizing, entry, mark-to-market.
 *
 * <p>Exit checks always run first so a new entry opens against post-exit state.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DecisionPipeline {

    private final SignalEvaluator signalEvaluator;
    private final PositionSizingService positionSizingService;

    /**
     * @param sample the new sample, also the last element of {@code window}
     * @param window recent samples, oldest first
     */
    public TickOutcome process(PriceSample sample, List<PriceSample> window, StrategyDefinition strategy,
                               PortfolioLedger ledger, RiskPolicy policy) {
        List<Trade> closed = new ArrayList<>(2);
        ledger.checkExits(sample).ifPresent(closed::add);

        TradeSignal signal = signalEvaluator.evaluate(strategy, window);
        Order opened = null;
        RejectionReason rejection = null;
        String rejectionDetail = null;

        boolean reopen = true;
        if (ledger.hasOpenPosition() && isCloseInstruction(signal, ledger.getOpenPosition(), policy)) {
            Optional<Trade> exit = ledger.closePosition(sample.getClose(), sample.getTimestamp(), ExitReason.EXIT_SIGNAL);
            exit.ifPresent(closed::add);
            reopen = policy.isFlipOnReversal();
        }

        if (!signal.isFlat() && reopen) {
            SizingDecision decision = positionSizingService.size(signal, ledger, sample.getClose(),
                    sample.getTimestamp(), policy, averageTrueRange(window, policy));
            if (decision.isAccepted()) {
                LedgerResult result = ledger.applyOrder(decision.order());
                if (result.accepted()) {
                    opened = decision.order();
                } else {
                    rejection = result.reason();
                    rejectionDetail = result.detail();
                }
            } else {
                rejection = decision.rejection();
                rejectionDetail = decision.detail();
            }
        }

        return new TickOutcome(signal, List.copyOf(closed), opened, rejection, rejectionDetail,
                ledger.markToMarket(sample.getClose(), sample.getTimestamp()));
    }

    /**
     * Window length used for a strategy: the configured lookback, stretched to what the strategy needs.
     */
    public int windowSize(StrategyDefinition strategy, int configuredLookback) {
        return Math.max(configuredLookback, signalEvaluator.requiredLookback(strategy));
    }

    private static Double averageTrueRange(List<PriceSample> window, RiskPolicy policy) {
        if (!policy.usesAtrStops()) {
            return null;
        }
        return TechnicalIndicatorCalculator.averageTrueRange(window, policy.getAtrPeriod()).orElse(null);
    }

    private boolean isCloseInstruction(TradeSignal signal, Position position, RiskPolicy policy) {
        if (signal.isFlat() || signal.getConfidence() < policy.getMinConfidence()) {
            return false;
        }
        TradeDirection signalDirection = signal.getDirection() == TradeSignal.SignalDirection.LONG
                ? TradeDirection.LONG : TradeDirection.SHORT;
        return signalDirection == position.getDirection().opposite();
    }
}
