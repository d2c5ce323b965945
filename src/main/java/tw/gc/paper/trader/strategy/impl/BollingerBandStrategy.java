package tw.gc.paper.trader.strategy.impl;

import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.paper.trader.indicators.TechnicalIndicatorCalculator.BollingerBands;
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
 * Bollinger Band Strategy
 * Type: Volatility / Mean Reversion
 *
 * Logic:
 * - Close below the lower band -> Long
 * - Close above the upper band -> Short
 */
public class BollingerBandStrategy implements IStrategy {

    public static final String FAMILY = "BOLLINGER";

    private static final List<StrategyParameterDefinition> PARAMETERS = List.of(
            StrategyParameterDefinition.ofInt("period", 10, 40, 1, 20),
            StrategyParameterDefinition.ofDouble("stdDev", 1.0, 3.0, 0.1, 2.0)
    );

    @Override
    public TradeSignal evaluate(List<PriceSample> window, Map<String, Double> params) {
        int period = intParam(params, "period");
        double stdDev = param(params, "stdDev");

        List<Double> closes = TechnicalIndicatorCalculator.closes(window);
        Optional<BollingerBands> bandsOpt = TechnicalIndicatorCalculator.bollingerBands(closes, period, stdDev);
        if (bandsOpt.isEmpty()) {
            return TradeSignal.flat("Warming up Bollinger bands");
        }
        BollingerBands bands = bandsOpt.get();
        double close = closes.get(closes.size() - 1);
        double width = bands.upper() - bands.lower();
        if (width <= 0.0) {
            return TradeSignal.flat("Bands collapsed");
        }

        if (close < bands.lower()) {
            double penetration = (bands.lower() - close) / width;
            return TradeSignal.longSignal(0.55 + penetration,
                    String.format("Close %.2f below lower band %.2f", close, bands.lower()));
        }
        if (close > bands.upper()) {
            double penetration = (close - bands.upper()) / width;
            return TradeSignal.shortSignal(0.55 + penetration,
                    String.format("Close %.2f above upper band %.2f", close, bands.upper()));
        }
        return TradeSignal.flat("Inside bands");
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public String getName() {
        return "Bollinger Bands";
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
        return intParam(params, "period");
    }

    @Override
    public List<Map<String, Double>> seedVariants() {
        return List.of(
                Map.of("period", 20.0, "stdDev", 2.0),
                Map.of("period", 10.0, "stdDev", 1.5)
        );
    }
}
