package tw.gc.paper.trader.strategy.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.paper.trader.strategy.TradeSignal;
import tw.gc.paper.trader.testutil.PriceSeriesFactory;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MovingAverageCrossoverStrategyTest {

    private MovingAverageCrossoverStrategy strategy;
    private final Map<String, Double> params = Map.of("fast", 3.0, "slow", 10.0);

    @BeforeEach
    void setUp() {
        strategy = new MovingAverageCrossoverStrategy();
    }

    private static double[] flatThen(double last) {
        double[] closes = new double[12];
        for (int i = 0; i < 11; i++) {
            closes[i] = 10.0;
        }
        closes[11] = last;
        return closes;
    }

    @Test
    void evaluate_withGoldenCross_shouldReturnLong() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.fromCloses(flatThen(12.0)), params);

        assertThat(signal.getDirection()).isEqualTo(TradeSignal.SignalDirection.LONG);
        assertThat(signal.getConfidence()).isGreaterThanOrEqualTo(0.65);
        assertThat(signal.getReason()).contains("Golden cross");
    }

    @Test
    void evaluate_withDeathCross_shouldReturnShort() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.fromCloses(flatThen(8.0)), params);

        assertThat(signal.getDirection()).isEqualTo(TradeSignal.SignalDirection.SHORT);
        assertThat(signal.getReason()).contains("Death cross");
    }

    @Test
    void evaluate_withEstablishedTrend_shouldNotSignalAgain() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.trend(40, 100, 1), params);

        assertThat(signal.isFlat()).isTrue();
    }

    @Test
    void evaluate_withShortWindow_shouldWarmUp() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.flat(10, 10), params);

        assertThat(signal.isFlat()).isTrue();
        assertThat(signal.getReason()).contains("Warming up");
    }

    @Test
    void isValid_shouldRequireFastBelowSlow() {
        assertThat(strategy.isValid(Map.of("fast", 10.0, "slow", 30.0))).isTrue();
        assertThat(strategy.isValid(Map.of("fast", 30.0, "slow", 30.0))).isFalse();
    }
}
