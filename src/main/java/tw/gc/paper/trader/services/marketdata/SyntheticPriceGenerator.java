package tw.gc.paper.trader.services.marketdata;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.Timeframe;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded random-walk candles for offline runs. Backfills the configured history window at startup,
 * then publishes one candle per interval. Simulated time advances one candle per publish, so the
 * live stream runs faster than wall-clock time.
 */
@Component
@ConditionalOnProperty(prefix = "trading.feed.simulation", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class SyntheticPriceGenerator {

    private final TradingProperties tradingProperties;
    private final BufferedMarketDataFeed feed;

    private Random random;
    private double price;
    private LocalDateTime nextTimestamp;

    @PostConstruct
    public void backfill() {
        TradingProperties.Simulation simulation = tradingProperties.getFeed().getSimulation();
        Timeframe timeframe = tradingProperties.getTimeframe();
        random = new Random(simulation.getSeed());
        price = simulation.getStartPrice();

        Duration step = timeframe.getDuration();
        long candles = Duration.ofDays(tradingProperties.getOptimization().getHistoryDays()).dividedBy(step);
        LocalDateTime end = LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MINUTES);
        LocalDateTime start = end.minus(step.multipliedBy(candles));

        List<PriceSample> history = new ArrayList<>((int) candles);
        nextTimestamp = start;
        for (long i = 0; i < candles; i++) {
            history.add(nextCandle(timeframe, simulation.getVolatility()));
        }
        feed.seedHistory(history);
        log.info("🎲 Synthetic feed backfilled {} {} candles ending {}", candles, timeframe, nextTimestamp);
    }

    @Scheduled(fixedRateString = "${trading.feed.simulation.interval-ms:1000}")
    public synchronized void publishNext() {
        feed.publish(nextCandle(tradingProperties.getTimeframe(), tradingProperties.getFeed().getSimulation().getVolatility()));
    }

    synchronized PriceSample nextCandle(Timeframe timeframe, double volatility) {
        double open = price;
        double close = open * Math.exp(volatility * random.nextGaussian());
        double high = Math.max(open, close) * (1 + Math.abs(random.nextGaussian()) * volatility / 2);
        double low = Math.min(open, close) * (1 - Math.abs(random.nextGaussian()) * volatility / 2);
        PriceSample sample = PriceSample.builder()
                .timestamp(nextTimestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(10 + random.nextDouble() * 90)
                .timeframe(timeframe)
                .build();
        price = close;
        nextTimestamp = nextTimestamp.plus(timeframe.getDuration());
        return sample;
    }
}
