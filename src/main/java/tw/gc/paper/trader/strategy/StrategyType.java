package tw.gc.paper.trader.strategy;

/**
 * Strategy type classification
 */
public enum StrategyType {
    /**
     * Trend following (MA crossover, MACD)
     */
    TREND,

    /**
     * Mean reversion (RSI, Bollinger bands)
     */
    MEAN_REVERSION,

    /**
     * Momentum / breakout
     */
    MOMENTUM
}
