package tw.gc.paper.trader.strategy.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.paper.trader.strategy.StrategyType;
import tw.gc.paper.trader.strategy.TradeSignal;
import tw.gc.paper.trader.testutil.PriceSeriesFactory;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RSIStrategyTest {

    private RSIStrategy strategy;
    private Map<String, Double> params;

    @BeforeEach
    void setUp() {
        strategy = new RSIStrategy();
        params = strategy.defaultParameters();
    }

    @Test
    void evaluate_withInsufficientData_shouldReturnFlat() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.trend(10, 100, 1), params);

        assertThat(signal.isFlat()).isTrue();
        assertThat(signal.getReason()).contains("Warming up");
    }

    @Test
    void evaluate_withOversoldCondition_shouldReturnLongSignal() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.trend(20, 150, -3), params);

        assertThat(signal.getDirection()).isEqualTo(TradeSignal.SignalDirection.LONG);
        assertThat(signal.getConfidence()).isEqualTo(1.0);
        assertThat(signal.getReason()).containsIgnoringCase("oversold");
    }

    @Test
    void evaluate_withOverboughtCondition_shouldReturnShortSignal() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.trend(20, 50, 3), params);

        assertThat(signal.getDirection()).isEqualTo(TradeSignal.SignalDirection.SHORT);
        assertThat(signal.getReason()).containsIgnoringCase("overbought");
    }

    @Test
    void evaluate_withNeutralMarket_shouldReturnFlatWithRsiReason() {
        TradeSignal signal = strategy.evaluate(PriceSeriesFactory.flat(20, 100), params);

        assertThat(signal.isFlat()).isTrue();
        assertThat(signal.getReason()).startsWith("RSI");
    }

    @Test
    void isValid_shouldRejectOversoldAboveOverbought() {
        assertThat(strategy.isValid(Map.of("period", 14.0, "oversold", 30.0, "overbought", 70.0))).isTrue();
        assertThat(strategy.isValid(Map.of("period", 14.0, "oversold", 40.0, "overbought", 60.0))).isTrue();
        assertThat(strategy.isValid(Map.of("period", 50.0, "oversold", 30.0, "overbought", 70.0))).isFalse();
        assertThat(strategy.isValid(Map.of("period", 14.0, "oversold", 30.0))).isFalse();
    }

    @Test
    void metadata_shouldDescribeMeanReversion() {
        assertThat(strategy.getFamily()).isEqualTo("RSI");
        assertThat(strategy.getType()).isEqualTo(StrategyType.MEAN_REVERSION);
        assertThat(strategy.requiredLookback(params)).isEqualTo(15);
    }
}
