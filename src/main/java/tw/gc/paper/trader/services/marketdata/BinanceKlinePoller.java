package tw.gc.paper.trader.services.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.PriceSample;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Polls Binance public klines and publishes closed candles into the buffered feed.
 * The first successful poll backfills history; later polls publish only newer candles.
 */
@Component
@ConditionalOnProperty(prefix = "trading.feed.binance", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class BinanceKlinePoller {

    private final RestTemplate restTemplate;
    private final TradingProperties tradingProperties;
    private final BufferedMarketDataFeed feed;

    private boolean backfilled;

    @Scheduled(fixedDelayString = "${trading.feed.binance.poll-interval-ms:5000}")
    public synchronized void poll() {
        TradingProperties.Binance binance = tradingProperties.getFeed().getBinance();
        String url = UriComponentsBuilder.fromHttpUrl(binance.getBaseUrl())
                .path("/api/v3/klines")
                .queryParam("symbol", tradingProperties.getSymbol())
                .queryParam("interval", tradingProperties.getTimeframe().getCode())
                .queryParam("limit", binance.getLimit())
                .toUriString();
        try {
            JsonNode klines = restTemplate.getForObject(url, JsonNode.class);
            List<PriceSample> closed = parseClosed(klines, System.currentTimeMillis());
            feed.setAvailable(true);
            if (closed.isEmpty()) {
                return;
            }
            if (!backfilled) {
                feed.seedHistory(closed.subList(0, closed.size() - 1));
                feed.publish(closed.get(closed.size() - 1));
                backfilled = true;
                log.info("📥 Backfilled {} {} candles for {}", closed.size(), tradingProperties.getTimeframe(),
                        tradingProperties.getSymbol());
                return;
            }
            for (PriceSample sample : closed) {
                feed.publish(sample);
            }
        } catch (RestClientException e) {
            feed.setAvailable(false);
            log.warn("⚠️ Binance kline poll failed: {}", e.getMessage());
        }
    }

    /**
     * Kline rows: [openTime, open, high, low, close, volume, closeTime, ...]. Candles whose
     * close time is not yet past are still forming and are skipped.
     */
    List<PriceSample> parseClosed(JsonNode klines, long nowMillis) {
        List<PriceSample> samples = new ArrayList<>();
        if (klines == null || !klines.isArray()) {
            return samples;
        }
        for (JsonNode row : klines) {
            if (!row.isArray() || row.size() < 7) {
                continue;
            }
            long closeTime = row.get(6).asLong();
            if (closeTime >= nowMillis) {
                continue;
            }
            samples.add(PriceSample.builder()
                    .timestamp(LocalDateTime.ofInstant(Instant.ofEpochMilli(row.get(0).asLong()), ZoneOffset.UTC))
                    .open(row.get(1).asDouble())
                    .high(row.get(2).asDouble())
                    .low(row.get(3).asDouble())
                    .close(row.get(4).asDouble())
                    .volume(row.get(5).asDouble())
                    .timeframe(tradingProperties.getTimeframe())
                    .build());
        }
        return samples;
    }
}
