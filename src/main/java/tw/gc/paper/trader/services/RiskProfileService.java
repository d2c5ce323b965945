package tw.gc.paper.trader.services;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.exceptions.InvalidRiskPolicyException;
import tw.gc.paper.trader.services.positionsizing.RiskPolicy;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the effective {@link RiskPolicy} of every profile (built-in values plus configured
 * overrides) and tracks which profile is selected.
 *
 * <p>All policies are validated at startup; a malformed one stops the application.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskProfileService {

    private final TradingProperties tradingProperties;

    private final Map<RiskProfile, RiskPolicy> policies = new EnumMap<>(RiskProfile.class);
    private volatile RiskProfile activeProfile;

    @PostConstruct
    public void initialize() {
        for (RiskProfile profile : RiskProfile.values()) {
            TradingProperties.PolicyOverride override = tradingProperties.getRiskOverrides().get(profile);
            RiskPolicy policy = applyOverride(profile.getPolicy(), override);
            try {
                policies.put(profile, policy.validate());
            } catch (InvalidRiskPolicyException e) {
                log.error("❌ Risk profile {} is misconfigured: {}", profile, e.getMessage());
                throw new InvalidRiskPolicyException(profile + ": " + e.getMessage());
            }
        }
        activeProfile = tradingProperties.getRiskProfile() == null ? RiskProfile.DEFAULT : tradingProperties.getRiskProfile();
        log.info("🛡️ Risk profile {} active: {}", activeProfile, policies.get(activeProfile));
    }

    public RiskPolicy policyFor(RiskProfile profile) {
        RiskPolicy policy = policies.get(profile);
        if (policy == null) {
            throw new IllegalStateException("Risk profiles not initialized");
        }
        return policy;
    }

    public RiskPolicy currentPolicy() {
        return policyFor(activeProfile);
    }

    public RiskProfile getActiveProfile() {
        return activeProfile;
    }

    public void setActiveProfile(RiskProfile profile) {
        this.activeProfile = profile;
    }

    static RiskPolicy applyOverride(RiskPolicy base, TradingProperties.PolicyOverride override) {
        if (override == null) {
            return base;
        }
        RiskPolicy.RiskPolicyBuilder builder = base.toBuilder();
        if (override.getStartingBalance() != null) {
            builder.startingBalance(override.getStartingBalance());
        }
        if (override.getMaxPositionFraction() != null) {
            builder.maxPositionFraction(override.getMaxPositionFraction());
        }
        if (override.getFullConfidenceFraction() != null) {
            builder.fullConfidenceFraction(override.getFullConfidenceFraction());
        }
        if (override.getStopLossPct() != null) {
            builder.stopLossPct(override.getStopLossPct());
        }
        if (override.getTakeProfitPct() != null) {
            builder.takeProfitPct(override.getTakeProfitPct());
        }
        if (override.getMinConfidence() != null) {
            builder.minConfidence(override.getMinConfidence());
        }
        if (override.getMaxDrawdownPct() != null) {
            builder.maxDrawdownPct(override.getMaxDrawdownPct());
        }
        if (override.getFeeRate() != null) {
            builder.feeRate(override.getFeeRate());
        }
        if (override.getMinTradeNotional() != null) {
            builder.minTradeNotional(override.getMinTradeNotional());
        }
        if (override.getFlipOnReversal() != null) {
            builder.flipOnReversal(override.getFlipOnReversal());
        }
        if (override.getAtrStopMultiplier() != null) {
            builder.atrStopMultiplier(override.getAtrStopMultiplier());
        }
        if (override.getAtrTakeMultiplier() != null) {
            builder.atrTakeMultiplier(override.getAtrTakeMultiplier());
        }
        if (override.getAtrPeriod() != null) {
            builder.atrPeriod(override.getAtrPeriod());
        }
        return builder.build();
    }
}
