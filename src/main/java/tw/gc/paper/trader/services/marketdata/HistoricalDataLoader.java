package tw.gc.paper.trader.services.marketdata;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.Timeframe;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Seeds the buffered feed from CSV files named after the timeframe, e.g. {@code 5m.csv}.
 * Columns: {@code timestamp,open,high,low,close,volume}; timestamp is epoch millis or ISO local date-time (UTC).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HistoricalDataLoader {

    private final TradingProperties tradingProperties;
    private final BufferedMarketDataFeed feed;

    @PostConstruct
    public void loadConfiguredHistory() {
        String dir = tradingProperties.getFeed().getHistoryDir();
        if (dir == null || dir.isBlank()) {
            return;
        }
        for (Timeframe timeframe : Timeframe.values()) {
            Path file = Path.of(dir, timeframe.getCode() + ".csv");
            if (Files.isRegularFile(file)) {
                try {
                    int accepted = feed.seedHistory(parse(file, timeframe));
                    log.info("📂 Loaded {} {} samples from {}", accepted, timeframe, file);
                } catch (IOException e) {
                    log.error("❌ Failed to read history file {}", file, e);
                }
            }
        }
    }

    public List<PriceSample> parse(Path file, Timeframe timeframe) throws IOException {
        List<PriceSample> samples = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || (lineNumber == 1 && line.toLowerCase(Locale.ROOT).startsWith("timestamp"))) {
                    continue;
                }
                String[] cols = line.split(",");
                if (cols.length < 6) {
                    log.warn("Skipping {}:{} - expected 6 columns", file.getFileName(), lineNumber);
                    continue;
                }
                try {
                    samples.add(PriceSample.builder()
                            .timestamp(parseTimestamp(cols[0].trim()))
                            .open(Double.parseDouble(cols[1].trim()))
                            .high(Double.parseDouble(cols[2].trim()))
                            .low(Double.parseDouble(cols[3].trim()))
                            .close(Double.parseDouble(cols[4].trim()))
                            .volume(Double.parseDouble(cols[5].trim()))
                            .timeframe(timeframe)
                            .build());
                } catch (NumberFormatException | DateTimeParseException e) {
                    log.warn("Skipping {}:{} - {}", file.getFileName(), lineNumber, e.getMessage());
                }
            }
        }
        return samples;
    }

    static LocalDateTime parseTimestamp(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(value)), ZoneOffset.UTC);
        }
        return LocalDateTime.parse(value);
    }
}
