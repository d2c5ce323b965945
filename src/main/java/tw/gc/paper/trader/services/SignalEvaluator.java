package tw.gc.paper.trader.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.strategy.IStrategy;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.util.List;

/**
 * Runs one strategy definition over a price window and stamps the result with the
 * definition id and the latest sample time. Holds no state between calls.
 */
@Service
@RequiredArgsConstructor
public class SignalEvaluator {

    private final StrategyCatalog strategyCatalog;

    public TradeSignal evaluate(StrategyDefinition definition, List<PriceSample> window) {
        if (window == null || window.isEmpty()) {
            return TradeSignal.flat("No price data").stamped(definition.getId(), null);
        }
        PriceSample latest = window.get(window.size() - 1);
        IStrategy strategy = strategyCatalog.strategy(definition);
        int required = strategy.requiredLookback(definition.getParameters());
        if (window.size() < required) {
            return TradeSignal.flat("Insufficient lookback %d/%d".formatted(window.size(), required))
                    .stamped(definition.getId(), latest.getTimestamp());
        }
        return strategy.evaluate(window, definition.getParameters())
                .stamped(definition.getId(), latest.getTimestamp());
    }

    public int requiredLookback(StrategyDefinition definition) {
        return strategyCatalog.strategy(definition).requiredLookback(definition.getParameters());
    }
}
