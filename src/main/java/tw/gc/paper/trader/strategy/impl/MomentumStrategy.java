package tw.gc.paper.trader.strategy.impl;

import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.paper.trader.strategy.IStrategy;
import tw.gc.paper.trader.strategy.StrategyParameterDefinition;
import tw.gc.paper.trader.strategy.StrategyType;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static tw.gc.paper.trader.strategy.IStrategy.intParam;
import static tw.gc.paper.trader.strategy.IStrategy.param;

/**
 * Momentum Strategy
 * Type: Breakout
 *
 * Logic:
 * - Rate of change over {@code lookback} bars above +threshold -> Long
 * - Below -threshold -> Short
 */
public class MomentumStrategy implements IStrategy {

    public static final String FAMILY = "MOMENTUM";

    private static final List<StrategyParameterDefinition> PARAMETERS = List.of(
            StrategyParameterDefinition.ofInt("lookback", 3, 48, 1, 12),
            StrategyParameterDefinition.ofDouble("threshold", 0.0005, 0.02, 0.0005, 0.002)
    );

    @Override
    public TradeSignal evaluate(List<PriceSample> window, Map<String, Double> params) {
        int lookback = intParam(params, "lookback");
        double threshold = param(params, "threshold");

        Optional<Double> rocOpt = TechnicalIndicatorCalculator.rateOfChange(
                TechnicalIndicatorCalculator.closes(window), lookback);
        if (rocOpt.isEmpty()) {
            return TradeSignal.flat("Warming up momentum");
        }
        double roc = rocOpt.get();
        if (Math.abs(roc) <= threshold) {
            return TradeSignal.flat(String.format("ROC %.3f%% within threshold", roc * 100));
        }
        // Saturates when the move is five times the threshold
        double confidence = 0.5 + 0.5 * Math.min(1.0, (Math.abs(roc) - threshold) / (threshold * 4));
        String reason = String.format("ROC %.3f%% over %d bars", roc * 100, lookback);
        return roc > 0 ? TradeSignal.longSignal(confidence, reason) : TradeSignal.shortSignal(confidence, reason);
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public String getName() {
        return "Price Momentum";
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MOMENTUM;
    }

    @Override
    public List<StrategyParameterDefinition> parameterSpace() {
        return PARAMETERS;
    }

    @Override
    public int requiredLookback(Map<String, Double> params) {
        return intParam(params, "lookback") + 1;
    }

    @Override
    public List<Map<String, Double>> seedVariants() {
        return List.of(Map.of("lookback", 12.0, "threshold", 0.002));
    }
}
