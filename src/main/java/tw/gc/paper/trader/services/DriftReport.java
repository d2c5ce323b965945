package tw.gc.paper.trader.services;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Live versus backtest comparison of the active strategy over the same elapsed time.
 */
@Value
@Builder
@Jacksonized
public class DriftReport {

    String strategyId;
    LocalDateTime trackingSince;
    Duration elapsed;
    int liveSamples;
    double liveReturn;
    double backtestReturn;

    /**
     * liveReturn - backtestReturn
     */
    double divergence;
    double liveWinRate;
    double backtestWinRate;
    double liveDrawdown;
    double accuracyScore;
    ConfidenceLevel confidenceLevel;
    boolean driftAlert;
    boolean drawdownAlert;

    public enum ConfidenceLevel {
        HIGH,
        MEDIUM,
        LOW;

        public static ConfidenceLevel of(double accuracyScore) {
            if (accuracyScore >= 0.7) {
                return HIGH;
            }
            return accuracyScore >= 0.5 ? MEDIUM : LOW;
        }
    }
}
