package tw.gc.paper.trader.services.positionsizing;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.exceptions.InvalidRiskPolicyException;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk limits applied to every order of one portfolio.
 * Percentages ({@code stopLossPct}, {@code takeProfitPct}, {@code maxDrawdownPct}) are expressed in percent,
 * fractions and rates as plain ratios.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RiskPolicy {

    double startingBalance;

    /**
     * Hard cap on the share of equity committed to one position.
     */
    double maxPositionFraction;

    /**
     * Share of equity a signal with confidence 1.0 would commit, before the hard cap.
     */
    double fullConfidenceFraction;
    double stopLossPct;
    double takeProfitPct;
    double minConfidence;
    double maxDrawdownPct;
    double feeRate;
    double minTradeNotional;

    /**
     * Open the reverse position after an exit signal closes the current one.
     */
    boolean flipOnReversal;

    /**
     * Stop distance in average true ranges. Zero keeps percentage stops.
     */
    double atrStopMultiplier;
    double atrTakeMultiplier;
    int atrPeriod;

    public boolean usesAtrStops() {
        return atrStopMultiplier > 0;
    }

    /**
     * @throws InvalidRiskPolicyException listing every violated limit
     */
    public RiskPolicy validate() {
        List<String> errors = new ArrayList<>();
        if (!(startingBalance > 0)) {
            errors.add("startingBalance must be positive");
        }
        if (!(maxPositionFraction > 0 && maxPositionFraction <= 1.0)) {
            errors.add("maxPositionFraction must be in (0, 1]");
        }
        if (!(fullConfidenceFraction > 0 && fullConfidenceFraction <= 1.0)) {
            errors.add("fullConfidenceFraction must be in (0, 1]");
        }
        if (!(stopLossPct > 0 && stopLossPct < 100)) {
            errors.add("stopLossPct must be in (0, 100)");
        }
        if (!(takeProfitPct > 0)) {
            errors.add("takeProfitPct must be positive");
        }
        if (!(minConfidence >= 0 && minConfidence <= 1.0)) {
            errors.add("minConfidence must be in [0, 1]");
        }
        if (!(maxDrawdownPct > 0 && maxDrawdownPct <= 100)) {
            errors.add("maxDrawdownPct must be in (0, 100]");
        }
        if (!(feeRate >= 0 && feeRate < 0.1)) {
            errors.add("feeRate must be in [0, 0.1)");
        }
        if (!(minTradeNotional >= 0)) {
            errors.add("minTradeNotional must not be negative");
        }
        if (atrStopMultiplier < 0) {
            errors.add("atrStopMultiplier must not be negative");
        }
        if (usesAtrStops() && !(atrTakeMultiplier > 0)) {
            errors.add("atrTakeMultiplier must be positive when ATR stops are on");
        }
        if (usesAtrStops() && atrPeriod < 1) {
            errors.add("atrPeriod must be at least 1 when ATR stops are on");
        }
        if (!errors.isEmpty()) {
            throw new InvalidRiskPolicyException("Invalid risk policy: " + String.join("; ", errors));
        }
        return this;
    }
}
