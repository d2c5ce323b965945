package tw.gc.paper.trader.services.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.Timeframe;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BinanceKlinePollerTest {

    // 2024-01-01T00:00Z
    private static final long T0 = 1_704_067_200_000L;
    private static final long FIVE_MIN = 300_000L;

    @Mock
    private RestTemplate restTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TradingProperties properties;
    private BufferedMarketDataFeed feed;
    private BinanceKlinePoller poller;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        feed = new BufferedMarketDataFeed();
        poller = new BinanceKlinePoller(restTemplate, properties, feed);
    }

    private static String row(long openTime, long closeTime, double close) {
        return String.format(Locale.ROOT,
                "[%d,\"%.2f\",\"%.2f\",\"%.2f\",\"%.2f\",\"12.5\",%d,\"0\",10,\"0\",\"0\",\"0\"]",
                openTime, close, close + 1, close - 1, close, closeTime);
    }

    private JsonNode klines(String... rows) throws Exception {
        return objectMapper.readTree("[" + String.join(",", rows) + "]");
    }

    @Test
    void parseClosed_shouldSkipFormingCandle() throws Exception {
        JsonNode json = klines(
                row(T0, T0 + FIVE_MIN - 1, 100),
                row(T0 + FIVE_MIN, T0 + 2 * FIVE_MIN - 1, 101));

        List<PriceSample> closed = poller.parseClosed(json, T0 + FIVE_MIN + 10);

        assertThat(closed).hasSize(1);
        PriceSample sample = closed.get(0);
        assertThat(sample.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(sample.getClose()).isEqualTo(100.0);
        assertThat(sample.getHigh()).isEqualTo(101.0);
        assertThat(sample.getVolume()).isEqualTo(12.5);
        assertThat(sample.getTimeframe()).isEqualTo(Timeframe.MIN_5);
    }

    @Test
    void parseClosed_shouldIgnoreMalformedPayloads() throws Exception {
        assertThat(poller.parseClosed(null, T0)).isEmpty();
        assertThat(poller.parseClosed(objectMapper.readTree("{\"code\":-1121}"), T0)).isEmpty();
        assertThat(poller.parseClosed(objectMapper.readTree("[[1,2,3]]"), T0)).isEmpty();
    }

    @Test
    void poll_shouldBackfillThenPublishOnlyNewCandles() throws Exception {
        when(restTemplate.getForObject(contains("symbol=BTCUSDT"), eq(JsonNode.class)))
                .thenReturn(klines(row(T0, T0 + FIVE_MIN - 1, 100), row(T0 + FIVE_MIN, T0 + 2 * FIVE_MIN - 1, 101)))
                .thenReturn(klines(row(T0 + FIVE_MIN, T0 + 2 * FIVE_MIN - 1, 101),
                        row(T0 + 2 * FIVE_MIN, T0 + 3 * FIVE_MIN - 1, 102)));

        poller.poll();

        assertThat(feed.pendingCount(Timeframe.MIN_5)).isEqualTo(1);
        assertThat(feed.historicalRange(Timeframe.MIN_5, LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 1, 2, 0, 0))).hasSize(2);

        poller.poll();

        assertThat(feed.pendingCount(Timeframe.MIN_5)).isEqualTo(2);
        assertThat(feed.latestTimestamp(Timeframe.MIN_5)).contains(LocalDateTime.of(2024, 1, 1, 0, 10));
    }

    @Test
    void poll_shouldMarkFeedUnavailableOnHttpFailure() {
        when(restTemplate.getForObject(anyString(), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("connection refused"))
                .thenReturn(objectMapper.createArrayNode());

        poller.poll();
        assertThat(feed.isAvailable()).isFalse();

        poller.poll();
        assertThat(feed.isAvailable()).isTrue();
        verify(restTemplate, times(2)).getForObject(contains("interval=5m"), eq(JsonNode.class));
    }
}
