package tw.gc.paper.trader.services;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import tw.gc.paper.trader.enums.Timeframe;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of one optimization or discovery cycle.
 */
@Value
@Builder
@Jacksonized
public class CycleReport {

    public enum Trigger {
        OPTIMIZATION,
        DISCOVERY
    }

    Trigger trigger;
    long cycleNumber;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;
    int populationSize;

    /**
     * Live timeframe first, then every extra timeframe that had enough history.
     */
    List<Timeframe> timeframesSwept;

    /**
     * Replays that produced a score, summed over all swept timeframes.
     */
    int evaluated;

    /**
     * Replays that failed and were left out of the ranking, summed over all swept timeframes.
     */
    int excluded;

    /**
     * Best candidate on the live timeframe, the only one eligible for promotion.
     */
    String bestStrategyId;
    double bestScore;
    String activeStrategyId;
    double activeScore;
    boolean promoted;
}
