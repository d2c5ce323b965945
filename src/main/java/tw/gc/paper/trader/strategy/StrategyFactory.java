package tw.gc.paper.trader.strategy;

import java.util.List;

/**
 * Abstract Factory for the strategy families available to the engine.
 */
public interface StrategyFactory {

    /**
     * @return one instance per strategy family
     */
    List<IStrategy> createStrategies();
}
