package tw.gc.paper.trader.entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.enums.Timeframe;

import java.time.LocalDateTime;

/**
 * One OHLCV candle of the traded instrument. Immutable once recorded.
 * Timestamp is the candle open time in UTC.
 */
@Value
@Builder
@Jacksonized
public class PriceSample {

    LocalDateTime timestamp;
    double open;
    double high;
    double low;
    double close;
    double volume;
    Timeframe timeframe;

    @JsonIgnore
    public boolean isValid() {
        return timestamp != null && timeframe != null
                && close > 0 && open > 0 && low > 0
                && high >= low && high >= Math.max(open, close) && low <= Math.min(open, close);
    }
}
