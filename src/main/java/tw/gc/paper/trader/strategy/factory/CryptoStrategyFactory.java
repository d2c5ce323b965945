package tw.gc.paper.trader.strategy.factory;

import org.springframework.stereotype.Component;
import tw.gc.paper.trader.strategy.IStrategy;
import tw.gc.paper.trader.strategy.StrategyFactory;
import tw.gc.paper.trader.strategy.impl.BollingerBandStrategy;
import tw.gc.paper.trader.strategy.impl.MACDStrategy;
import tw.gc.paper.trader.strategy.impl.MomentumStrategy;
import tw.gc.paper.trader.strategy.impl.MovingAverageCrossoverStrategy;
import tw.gc.paper.trader.strategy.impl.RSIStrategy;

import java.util.List;

/**
 * Strategy families traded on crypto spot pairs. Parameters live in each strategy definition,
 * so one instance per family is enough.
 */
@Component
public class CryptoStrategyFactory implements StrategyFactory {

    @Override
    public List<IStrategy> createStrategies() {
        return List.of(
                new RSIStrategy(),                      // Mean reversion
                new MACDStrategy(),                     // Trend
                new MovingAverageCrossoverStrategy(),   // Trend
                new BollingerBandStrategy(),            // Volatility / mean reversion
                new MomentumStrategy()                  // Breakout
        );
    }
}
