package tw.gc.paper.trader.enums;

import java.time.Duration;

/**
 * Candle timeframes the engine understands. Each timeframe is an independent ordered series.
 */
public enum Timeframe {
    MIN_1("1m", Duration.ofMinutes(1)),
    MIN_5("5m", Duration.ofMinutes(5)),
    MIN_15("15m", Duration.ofMinutes(15)),
    MIN_30("30m", Duration.ofMinutes(30)),
    HOUR_1("1h", Duration.ofHours(1)),
    HOUR_4("4h", Duration.ofHours(4)),
    DAY_1("1d", Duration.ofDays(1));

    private final String code;
    private final Duration duration;

    Timeframe(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    /**
     * Exchange interval code, e.g. "5m" or "1d".
     */
    public String getCode() {
        return code;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Number of candles of this timeframe in one year, used to annualise per-bar returns.
     */
    public double periodsPerYear() {
        return Duration.ofDays(365).toMinutes() / (double) duration.toMinutes();
    }

    /**
     * Parse from exchange code or enum name (case-insensitive).
     */
    public static Timeframe fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Timeframe must not be null");
        }
        for (Timeframe timeframe : values()) {
            if (timeframe.code.equalsIgnoreCase(value) || timeframe.name().equalsIgnoreCase(value)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + value);
    }
}
