package tw.gc.paper.trader.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Trade signal returned by strategy evaluation.
 * Contains direction, confidence, and reasoning.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TradeSignal {

    SignalDirection direction;

    /**
     * Confidence level (0.0 to 1.0)
     */
    double confidence;

    /**
     * Human-readable reason for the signal
     */
    String reason;

    /**
     * Id of the strategy definition that produced the signal
     */
    String strategyId;

    /**
     * Timestamp of the sample the signal was computed on
     */
    LocalDateTime timestamp;

    /**
     * Optional explicit size request as a fraction of equity. Null means confidence-scaled sizing.
     */
    Double requestedFraction;

    public enum SignalDirection {
        LONG,
        SHORT,
        FLAT
    }

    /**
     * Create a FLAT signal (no action). Equivalent to "no signal".
     */
    public static TradeSignal flat(String reason) {
        return TradeSignal.builder()
                .direction(SignalDirection.FLAT)
                .confidence(0.0)
                .reason(reason)
                .build();
    }

    public static TradeSignal longSignal(double confidence, String reason) {
        return TradeSignal.builder()
                .direction(SignalDirection.LONG)
                .confidence(clamp(confidence))
                .reason(reason)
                .build();
    }

    public static TradeSignal shortSignal(double confidence, String reason) {
        return TradeSignal.builder()
                .direction(SignalDirection.SHORT)
                .confidence(clamp(confidence))
                .reason(reason)
                .build();
    }

    public TradeSignal stamped(String strategyId, LocalDateTime timestamp) {
        return toBuilder().strategyId(strategyId).timestamp(timestamp).build();
    }

    @JsonIgnore
    public boolean isFlat() {
        return direction == SignalDirection.FLAT;
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
