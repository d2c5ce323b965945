package tw.gc.paper.trader.services.marketdata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.Timeframe;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyntheticPriceGeneratorTest {

    private TradingProperties properties;
    private BufferedMarketDataFeed feed;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        properties.getOptimization().setHistoryDays(1);
        feed = new BufferedMarketDataFeed();
    }

    private List<PriceSample> history() {
        return feed.historicalRange(Timeframe.MIN_5, LocalDateTime.MIN, LocalDateTime.MAX);
    }

    @Test
    void backfill_shouldSeedOneDayOfValidContiguousCandles() {
        SyntheticPriceGenerator generator = new SyntheticPriceGenerator(properties, feed);

        generator.backfill();

        List<PriceSample> history = history();
        assertThat(history).hasSize(288);
        assertThat(history).allMatch(PriceSample::isValid);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).getOpen()).isEqualTo(history.get(i - 1).getClose());
            assertThat(history.get(i).getTimestamp()).isEqualTo(history.get(i - 1).getTimestamp().plusMinutes(5));
        }
        assertThat(feed.pendingCount(Timeframe.MIN_5)).isZero();
    }

    @Test
    void publishNext_shouldQueueOneCandleAfterHistory() {
        SyntheticPriceGenerator generator = new SyntheticPriceGenerator(properties, feed);
        generator.backfill();
        LocalDateTime last = feed.latestTimestamp(Timeframe.MIN_5).orElseThrow();

        generator.publishNext();

        assertThat(feed.pendingCount(Timeframe.MIN_5)).isEqualTo(1);
        assertThat(feed.nextSample(Timeframe.MIN_5).orElseThrow().getTimestamp()).isEqualTo(last.plusMinutes(5));
    }

    @Test
    void backfill_shouldBeReproducibleForSameSeed() {
        new SyntheticPriceGenerator(properties, feed).backfill();
        BufferedMarketDataFeed other = new BufferedMarketDataFeed();
        new SyntheticPriceGenerator(properties, other).backfill();

        List<Double> closes = history().stream().map(PriceSample::getClose).toList();
        List<Double> otherCloses = other.historicalRange(Timeframe.MIN_5, LocalDateTime.MIN, LocalDateTime.MAX)
                .stream().map(PriceSample::getClose).toList();
        assertThat(closes).isEqualTo(otherCloses);
    }
}
