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
 * Relative Strength Index (RSI) Strategy
 * Type: Mean Reversion
 *
 * Logic:
 * - Long when RSI < oversold -> expect bounce
 * - Short when RSI > overbought -> expect pullback
 *
 * Confidence grows with the distance past the threshold.
 */
public class RSIStrategy implements IStrategy {

    public static final String FAMILY = "RSI";

    private static final List<StrategyParameterDefinition> PARAMETERS = List.of(
            StrategyParameterDefinition.ofInt("period", 7, 28, 1, 14),
            StrategyParameterDefinition.ofInt("oversold", 15, 40, 1, 30),
            StrategyParameterDefinition.ofInt("overbought", 60, 85, 1, 70)
    );

    @Override
    public TradeSignal evaluate(List<PriceSample> window, Map<String, Double> params) {
        int period = intParam(params, "period");
        double oversold = param(params, "oversold");
        double overbought = param(params, "overbought");

        Optional<Double> rsiOpt = TechnicalIndicatorCalculator.relativeStrengthIndex(
                TechnicalIndicatorCalculator.closes(window), period);
        if (rsiOpt.isEmpty()) {
            return TradeSignal.flat("Warming up RSI");
        }
        double rsi = rsiOpt.get();

        if (rsi < oversold) {
            double confidence = 0.5 + 0.5 * (oversold - rsi) / oversold;
            return TradeSignal.longSignal(confidence, String.format("RSI %.2f < %.0f (Oversold)", rsi, oversold));
        }
        if (rsi > overbought) {
            double confidence = 0.5 + 0.5 * (rsi - overbought) / (100.0 - overbought);
            return TradeSignal.shortSignal(confidence, String.format("RSI %.2f > %.0f (Overbought)", rsi, overbought));
        }
        return TradeSignal.flat(String.format("RSI %.2f", rsi));
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public String getName() {
        return "Relative Strength Index";
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MEAN_REVERSION;
    }

    @Override
    public List<StrategyParameterDefinition> parameterSpace() {
        return PARAMETERS;
    }

    @Override
    public int requiredLookback(Map<String, Double> params) {
        return intParam(params, "period") + 1;
    }

    @Override
    public List<Map<String, Double>> seedVariants() {
        return List.of(
                Map.of("period", 14.0, "oversold", 30.0, "overbought", 70.0),
                Map.of("period", 21.0, "oversold", 25.0, "overbought", 75.0)
        );
    }

    @Override
    public boolean isValid(Map<String, Double> params) {
        return IStrategy.super.isValid(params) && param(params, "oversold") < param(params, "overbought");
    }
}
