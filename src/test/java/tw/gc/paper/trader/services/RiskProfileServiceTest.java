package tw.gc.paper.trader.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.exceptions.InvalidRiskPolicyException;
import tw.gc.paper.trader.services.positionsizing.RiskPolicy;

import static org.junit.jupiter.api.Assertions.*;

class RiskProfileServiceTest {

    private TradingProperties properties;
    private RiskProfileService service;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        service = new RiskProfileService(properties);
    }

    @Test
    void testBuiltInPoliciesWithoutOverrides() {
        service.initialize();

        assertEquals(RiskProfile.DEFAULT, service.getActiveProfile());
        for (RiskProfile profile : RiskProfile.values()) {
            assertEquals(profile.getPolicy(), service.policyFor(profile));
        }
        assertEquals(100_000.0, service.currentPolicy().getStartingBalance());
    }

    @Test
    void testConfiguredProfileIsActive() {
        properties.setRiskProfile(RiskProfile.CONSERVATIVE);

        service.initialize();

        assertEquals(RiskProfile.CONSERVATIVE, service.getActiveProfile());
        assertEquals(0.8, service.currentPolicy().getMinConfidence());
    }

    @Test
    void testOverrideReplacesOnlySetFields() {
        TradingProperties.PolicyOverride override = new TradingProperties.PolicyOverride();
        override.setStopLossPct(1.0);
        override.setFlipOnReversal(true);
        properties.getRiskOverrides().put(RiskProfile.DEFAULT, override);

        service.initialize();

        RiskPolicy policy = service.policyFor(RiskProfile.DEFAULT);
        assertEquals(1.0, policy.getStopLossPct());
        assertTrue(policy.isFlipOnReversal());
        assertEquals(4.0, policy.getTakeProfitPct());
        assertEquals(0.20, policy.getMaxPositionFraction());
        assertEquals(RiskProfile.AGGRESSIVE.getPolicy(), service.policyFor(RiskProfile.AGGRESSIVE));
    }

    @Test
    void testInvalidOverrideIsFatal() {
        TradingProperties.PolicyOverride override = new TradingProperties.PolicyOverride();
        override.setMaxPositionFraction(1.5);
        properties.getRiskOverrides().put(RiskProfile.AGGRESSIVE, override);

        InvalidRiskPolicyException e = assertThrows(InvalidRiskPolicyException.class, () -> service.initialize());
        assertTrue(e.getMessage().startsWith("AGGRESSIVE"));
        assertTrue(e.getMessage().contains("maxPositionFraction"));
    }

    @Test
    void testSetActiveProfileSwitchesCurrentPolicy() {
        service.initialize();

        service.setActiveProfile(RiskProfile.AGGRESSIVE);

        assertEquals(RiskProfile.AGGRESSIVE, service.getActiveProfile());
        assertEquals(500_000.0, service.currentPolicy().getStartingBalance());
        assertTrue(service.currentPolicy().isFlipOnReversal());
    }

    @Test
    void testPolicyLookupBeforeInitializationFails() {
        assertThrows(IllegalStateException.class, () -> service.policyFor(RiskProfile.DEFAULT));
    }

    @Test
    void testApplyOverrideWithNullKeepsBase() {
        RiskPolicy base = RiskProfile.LEARNING.getPolicy();

        assertSame(base, RiskProfileService.applyOverride(base, null));
    }
}
