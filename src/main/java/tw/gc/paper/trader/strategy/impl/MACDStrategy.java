package tw.gc.paper.trader.strategy.impl;

import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.paper.trader.indicators.TechnicalIndicatorCalculator.MacdResult;
import tw.gc.paper.trader.strategy.IStrategy;
import tw.gc.paper.trader.strategy.StrategyParameterDefinition;
import tw.gc.paper.trader.strategy.StrategyType;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static tw.gc.paper.trader.strategy.IStrategy.intParam;

/**
 * MACD Strategy
 * Type: Trend Following
 *
 * Logic:
 * - Long when the MACD line crosses above the signal line
 * - Short when it crosses below
 */
public class MACDStrategy implements IStrategy {

    public static final String FAMILY = "MACD";

    private static final List<StrategyParameterDefinition> PARAMETERS = List.of(
            StrategyParameterDefinition.ofInt("fast", 5, 15, 1, 12),
            StrategyParameterDefinition.ofInt("slow", 16, 40, 1, 26),
            StrategyParameterDefinition.ofInt("signal", 4, 12, 1, 9)
    );

    @Override
    public TradeSignal evaluate(List<PriceSample> window, Map<String, Double> params) {
        int fast = intParam(params, "fast");
        int slow = intParam(params, "slow");
        int signal = intParam(params, "signal");

        List<Double> closes = TechnicalIndicatorCalculator.closes(window);
        Optional<MacdResult> macdOpt = TechnicalIndicatorCalculator.macd(closes, fast, slow, signal);
        if (macdOpt.isEmpty()) {
            return TradeSignal.flat("Warming up MACD");
        }
        MacdResult macd = macdOpt.get();
        double price = closes.get(closes.size() - 1);
        // Histogram relative to price, 0.1% of price saturates confidence
        double strength = Math.min(1.0, Math.abs(macd.histogram()) / (price * 0.001));

        if (macd.crossedUp()) {
            return TradeSignal.longSignal(0.6 + 0.4 * strength,
                    String.format("MACD bullish crossover (hist %.4f)", macd.histogram()));
        }
        if (macd.crossedDown()) {
            return TradeSignal.shortSignal(0.6 + 0.4 * strength,
                    String.format("MACD bearish crossover (hist %.4f)", macd.histogram()));
        }
        return TradeSignal.flat(String.format("MACD hist %.4f", macd.histogram()));
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public String getName() {
        return "MACD Crossover";
    }

    @Override
    public StrategyType getType() {
        return StrategyType.TREND;
    }

    @Override
    public List<StrategyParameterDefinition> parameterSpace() {
        return PARAMETERS;
    }

    @Override
    public int requiredLookback(Map<String, Double> params) {
        return intParam(params, "slow") + intParam(params, "signal") + 1;
    }

    @Override
    public List<Map<String, Double>> seedVariants() {
        return List.of(
                Map.of("fast", 12.0, "slow", 26.0, "signal", 9.0),
                Map.of("fast", 8.0, "slow", 21.0, "signal", 6.0)
        );
    }

    @Override
    public boolean isValid(Map<String, Double> params) {
        return IStrategy.super.isValid(params) && intParam(params, "fast") < intParam(params, "slow");
    }
}
