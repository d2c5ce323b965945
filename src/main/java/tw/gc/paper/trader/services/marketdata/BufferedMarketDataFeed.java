package tw.gc.paper.trader.services.marketdata;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.Timeframe;
import tw.gc.paper.trader.exceptions.FeedUnavailableException;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory feed filled by producers (CSV loader, exchange poller, simulator) and drained by the
 * decision loop. Each timeframe keeps its own history and its own queue of unconsumed samples.
 *
 * <p>Samples must arrive in timestamp order per timeframe; older or duplicate samples are dropped.
 */
@Component
@Slf4j
public class BufferedMarketDataFeed implements MarketDataFeed {

    static final int MAX_HISTORY = 250_000;

    private final Map<Timeframe, Series> series = new ConcurrentHashMap<>();
    private final AtomicBoolean available = new AtomicBoolean(true);

    /**
     * Append a live sample. It becomes part of history and is queued for {@link #nextSample}.
     *
     * @return false if the sample was out of order, a duplicate or malformed
     */
    public boolean publish(PriceSample sample) {
        return append(sample, true);
    }

    /**
     * Load historical samples without queueing them for the live loop.
     *
     * @return number of samples accepted
     */
    public int seedHistory(List<PriceSample> samples) {
        List<PriceSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(PriceSample::getTimestamp));
        int accepted = 0;
        for (PriceSample sample : sorted) {
            if (append(sample, false)) {
                accepted++;
            }
        }
        return accepted;
    }

    /**
     * Producers flag upstream outages here; while unavailable, {@link #nextSample} throws.
     */
    public void setAvailable(boolean isAvailable) {
        boolean previous = available.getAndSet(isAvailable);
        if (previous != isAvailable) {
            if (isAvailable) {
                log.info("✅ Market data feed available again");
            } else {
                log.warn("⚠️ Market data feed unavailable");
            }
        }
    }

    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public Optional<PriceSample> nextSample(Timeframe timeframe) {
        if (!available.get()) {
            throw new FeedUnavailableException("Feed for " + timeframe + " is unavailable");
        }
        Series s = series.get(timeframe);
        if (s == null) {
            return Optional.empty();
        }
        synchronized (s) {
            return Optional.ofNullable(s.pending.pollFirst());
        }
    }

    @Override
    public List<PriceSample> historicalRange(Timeframe timeframe, LocalDateTime start, LocalDateTime end) {
        Series s = series.get(timeframe);
        if (s == null) {
            return List.of();
        }
        synchronized (s) {
            int from = lowerBound(s.history, start);
            List<PriceSample> range = new ArrayList<>();
            for (int i = from; i < s.history.size(); i++) {
                PriceSample sample = s.history.get(i);
                if (sample.getTimestamp().isAfter(end)) {
                    break;
                }
                range.add(sample);
            }
            return Collections.unmodifiableList(range);
        }
    }

    @Override
    public Optional<LocalDateTime> latestTimestamp(Timeframe timeframe) {
        Series s = series.get(timeframe);
        if (s == null) {
            return Optional.empty();
        }
        synchronized (s) {
            return s.history.isEmpty()
                    ? Optional.empty()
                    : Optional.of(s.history.get(s.history.size() - 1).getTimestamp());
        }
    }

    public int pendingCount(Timeframe timeframe) {
        Series s = series.get(timeframe);
        if (s == null) {
            return 0;
        }
        synchronized (s) {
            return s.pending.size();
        }
    }

    private boolean append(PriceSample sample, boolean live) {
        if (sample == null || !sample.isValid()) {
            log.warn("⚠️ Dropping malformed sample: {}", sample);
            return false;
        }
        Series s = series.computeIfAbsent(sample.getTimeframe(), tf -> new Series());
        synchronized (s) {
            if (!s.history.isEmpty()) {
                LocalDateTime last = s.history.get(s.history.size() - 1).getTimestamp();
                if (!sample.getTimestamp().isAfter(last)) {
                    log.debug("Dropping {} sample at {}: not after {}", sample.getTimeframe(), sample.getTimestamp(), last);
                    return false;
                }
            }
            s.history.add(sample);
            if (s.history.size() > MAX_HISTORY) {
                s.history.subList(0, s.history.size() - MAX_HISTORY).clear();
            }
            if (live) {
                s.pending.addLast(sample);
            }
            return true;
        }
    }

    private static int lowerBound(List<PriceSample> history, LocalDateTime start) {
        int low = 0;
        int high = history.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (history.get(mid).getTimestamp().isBefore(start)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static final class Series {
        private final List<PriceSample> history = new ArrayList<>();
        private final Deque<PriceSample> pending = new ArrayDeque<>();
    }
}
