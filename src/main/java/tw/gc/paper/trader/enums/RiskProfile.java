package tw.gc.paper.trader.enums;

import tw.gc.paper.trader.services.positionsizing.RiskPolicy;

/**
 * Selectable risk configurations exposed to the control surface.
 * Each profile maps to a distinct {@link RiskPolicy}.
 */
public enum RiskProfile {
    DEFAULT(RiskPolicy.builder()
            .startingBalance(100_000.0)
            .maxPositionFraction(0.20)
            .fullConfidenceFraction(0.25)
            .stopLossPct(2.0)
            .takeProfitPct(4.0)
            .minConfidence(0.20)
            .maxDrawdownPct(15.0)
            .feeRate(0.001)
            .minTradeNotional(100.0)
            .flipOnReversal(false)
            .build()),

    CONSERVATIVE(RiskPolicy.builder()
            .startingBalance(200_000.0)
            .maxPositionFraction(0.10)
            .fullConfidenceFraction(0.12)
            .stopLossPct(1.5)
            .takeProfitPct(3.0)
            .minConfidence(0.80)
            .maxDrawdownPct(10.0)
            .feeRate(0.001)
            .minTradeNotional(100.0)
            .flipOnReversal(false)
            .build()),

    AGGRESSIVE(RiskPolicy.builder()
            .startingBalance(500_000.0)
            .maxPositionFraction(0.30)
            .fullConfidenceFraction(0.40)
            .stopLossPct(3.0)
            .takeProfitPct(6.0)
            .minConfidence(0.60)
            .maxDrawdownPct(25.0)
            .feeRate(0.001)
            .minTradeNotional(500.0)
            .flipOnReversal(true)
            .build()),

    // Loose confidence floor so new strategy variants actually trade and build history
    LEARNING(RiskPolicy.builder()
            .startingBalance(100_000.0)
            .maxPositionFraction(0.15)
            .fullConfidenceFraction(0.20)
            .stopLossPct(2.0)
            .takeProfitPct(4.0)
            .minConfidence(0.25)
            .maxDrawdownPct(15.0)
            .feeRate(0.001)
            .minTradeNotional(200.0)
            .flipOnReversal(false)
            .build());

    private final RiskPolicy policy;

    RiskProfile(RiskPolicy policy) {
        this.policy = policy;
    }

    public RiskPolicy getPolicy() {
        return policy;
    }

    /**
     * Parse from any string (case-insensitive).
     */
    public static RiskProfile fromStringIgnoreCase(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Risk profile must not be null");
        }
        for (RiskProfile profile : values()) {
            if (profile.name().equalsIgnoreCase(value.trim())) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown risk profile: " + value);
    }
}
