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

/**
 * Moving Average Crossover Strategy
 * Type: Trend Following
 *
 * Logic:
 * - Golden cross (fast SMA moves above slow SMA) -> Long
 * - Death cross (fast SMA moves below slow SMA) -> Short
 */
public class MovingAverageCrossoverStrategy implements IStrategy {

    public static final String FAMILY = "SMA_CROSSOVER";

    private static final List<StrategyParameterDefinition> PARAMETERS = List.of(
            StrategyParameterDefinition.ofInt("fast", 3, 30, 1, 10),
            StrategyParameterDefinition.ofInt("slow", 10, 100, 1, 30)
    );

    @Override
    public TradeSignal evaluate(List<PriceSample> window, Map<String, Double> params) {
        int fast = intParam(params, "fast");
        int slow = intParam(params, "slow");

        List<Double> closes = TechnicalIndicatorCalculator.closes(window);
        if (closes.size() < slow + 1) {
            return TradeSignal.flat("Warming up moving averages");
        }
        List<Double> previous = closes.subList(0, closes.size() - 1);
        Optional<Double> fastNow = TechnicalIndicatorCalculator.simpleMovingAverage(closes, fast);
        Optional<Double> slowNow = TechnicalIndicatorCalculator.simpleMovingAverage(closes, slow);
        Optional<Double> fastPrev = TechnicalIndicatorCalculator.simpleMovingAverage(previous, fast);
        Optional<Double> slowPrev = TechnicalIndicatorCalculator.simpleMovingAverage(previous, slow);
        if (fastNow.isEmpty() || slowNow.isEmpty() || fastPrev.isEmpty() || slowPrev.isEmpty()) {
            return TradeSignal.flat("Warming up moving averages");
        }

        double spread = (fastNow.get() - slowNow.get()) / slowNow.get();
        double strength = Math.min(1.0, Math.abs(spread) / 0.005);
        if (fastPrev.get() <= slowPrev.get() && fastNow.get() > slowNow.get()) {
            return TradeSignal.longSignal(0.65 + 0.35 * strength,
                    String.format("Golden cross SMA%d/%d", fast, slow));
        }
        if (fastPrev.get() >= slowPrev.get() && fastNow.get() < slowNow.get()) {
            return TradeSignal.shortSignal(0.65 + 0.35 * strength,
                    String.format("Death cross SMA%d/%d", fast, slow));
        }
        return TradeSignal.flat(String.format("SMA spread %.4f%%", spread * 100));
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public String getName() {
        return "Moving Average Crossover";
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
        return intParam(params, "slow") + 1;
    }

    @Override
    public List<Map<String, Double>> seedVariants() {
        return List.of(
                Map.of("fast", 5.0, "slow", 15.0),
                Map.of("fast", 10.0, "slow", 30.0),
                Map.of("fast", 20.0, "slow", 50.0)
        );
    }

    @Override
    public boolean isValid(Map<String, Double> params) {
        return IStrategy.super.isValid(params) && intParam(params, "fast") < intParam(params, "slow");
    }
}
