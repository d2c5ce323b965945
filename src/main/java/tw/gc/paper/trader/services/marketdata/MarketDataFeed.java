package tw.gc.paper.trader.services.marketdata;

import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.Timeframe;
import tw.gc.paper.trader.exceptions.FeedUnavailableException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Source of ordered, timestamped price samples. Implementations never block on network I/O;
 * they serve what has already been buffered.
 */
public interface MarketDataFeed {

    /**
     * Next unconsumed live sample, oldest first.
     *
     * @return empty when no new sample arrived since the last call
     * @throws FeedUnavailableException when the upstream source is down
     */
    Optional<PriceSample> nextSample(Timeframe timeframe);

    /**
     * Samples with {@code start <= timestamp <= end}, ordered by timestamp.
     */
    List<PriceSample> historicalRange(Timeframe timeframe, LocalDateTime start, LocalDateTime end);

    /**
     * Timestamp of the newest sample held for {@code timeframe}.
     */
    Optional<LocalDateTime> latestTimestamp(Timeframe timeframe);
}
