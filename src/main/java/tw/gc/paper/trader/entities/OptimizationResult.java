package tw.gc.paper.trader.entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.enums.Timeframe;

import java.time.LocalDateTime;

/**
 * Score of one candidate strategy over one replayed date range.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizationResult {

    StrategyDefinition strategy;

    /**
     * Composite score normalised to [0, 1].
     */
    double score;
    double totalReturn;
    double winRate;
    double sharpeRatio;
    double maxDrawdown;
    double profitFactor;
    int tradeCount;
    LocalDateTime rangeStart;
    LocalDateTime rangeEnd;

    /**
     * Candle interval the replay ran on.
     */
    Timeframe timeframe;

    @JsonIgnore
    public String getStrategyId() {
        return strategy.getId();
    }
}
