package tw.gc.paper.trader.services.positionsizing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.paper.trader.entities.Order;
import tw.gc.paper.trader.enums.RejectionReason;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.enums.TradeDirection;
import tw.gc.paper.trader.services.ledger.PortfolioLedger;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionSizingServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    private PositionSizingService service;
    private RiskPolicy policy;
    private PortfolioLedger ledger;

    @BeforeEach
    void setUp() {
        service = new PositionSizingService();
        policy = RiskProfile.DEFAULT.getPolicy();
        ledger = new PortfolioLedger(100_000.0, policy.getFeeRate());
    }

    private static TradeSignal longSignal(double confidence) {
        return TradeSignal.longSignal(confidence, "test").stamped("TEST[x=1]v1", NOW);
    }

    @Test
    void testConfidenceScaledLongOrder() {
        SizingDecision decision = service.size(longSignal(0.5), ledger, 100.0, NOW, policy);

        assertTrue(decision.isAccepted());
        Order order = decision.order();
        assertEquals(TradeDirection.LONG, order.getDirection());
        assertEquals(0.125, order.getSizeFraction(), 1e-9);
        assertEquals(12_500.0, order.getNotional(), 1e-9);
        assertEquals(98.0, order.getStopLoss(), 1e-9);
        assertEquals(104.0, order.getTakeProfit(), 1e-9);
        assertEquals("TEST[x=1]v1", order.getStrategyId());
        assertEquals(NOW, order.getOpenedAt());
    }

    @Test
    void testFractionCappedAtMaxPosition() {
        SizingDecision decision = service.size(longSignal(1.0), ledger, 100.0, NOW, policy);

        assertEquals(policy.getMaxPositionFraction(), decision.order().getSizeFraction(), 1e-9);
        assertEquals(20_000.0, decision.order().getNotional(), 1e-9);
    }

    @Test
    void testShortOrderMirrorsExits() {
        TradeSignal signal = TradeSignal.shortSignal(0.8, "test").stamped("id", NOW);

        Order order = service.size(signal, ledger, 200.0, NOW, policy).order();

        assertEquals(TradeDirection.SHORT, order.getDirection());
        assertEquals(204.0, order.getStopLoss(), 1e-9);
        assertEquals(192.0, order.getTakeProfit(), 1e-9);
        assertTrue(order.hasMonotonicExits());
    }

    @Test
    void testFlatSignalRejected() {
        SizingDecision decision = service.size(TradeSignal.flat("nothing"), ledger, 100.0, NOW, policy);

        assertFalse(decision.isAccepted());
        assertEquals(RejectionReason.FLAT_SIGNAL, decision.rejection());
    }

    @Test
    void testLowConfidenceRejected() {
        assertEquals(RejectionReason.LOW_CONFIDENCE,
                service.size(longSignal(0.1), ledger, 100.0, NOW, policy).rejection());
    }

    @Test
    void testOpenPositionRejected() {
        ledger.applyOrder(service.size(longSignal(0.5), ledger, 100.0, NOW, policy).order());

        assertEquals(RejectionReason.POSITION_ALREADY_OPEN,
                service.size(longSignal(0.9), ledger, 101.0, NOW, policy).rejection());
    }

    @Test
    void testInvalidEntryPriceRejected() {
        assertEquals(RejectionReason.INVALID_ORDER, service.size(longSignal(0.5), ledger, 0.0, NOW, policy).rejection());
        assertEquals(RejectionReason.INVALID_ORDER,
                service.size(longSignal(0.5), ledger, Double.NaN, NOW, policy).rejection());
    }

    @Test
    void testNoEquityRejected() {
        PortfolioLedger broke = PortfolioLedger.restore(100_000.0, 0.0, null, List.of(), List.of(), null, 0.0);

        assertEquals(RejectionReason.INSUFFICIENT_EQUITY,
                service.size(longSignal(0.5), broke, 100.0, NOW, policy).rejection());
    }

    @Test
    void testRequestedFractionAboveLimitRejectedNotShrunk() {
        TradeSignal signal = longSignal(0.9).toBuilder().requestedFraction(0.5).build();

        SizingDecision decision = service.size(signal, ledger, 100.0, NOW, policy);

        assertEquals(RejectionReason.SIZE_EXCEEDS_LIMIT, decision.rejection());
        assertNull(decision.order());
    }

    @Test
    void testRequestedFractionWithinLimitUsedAsIs() {
        TradeSignal signal = longSignal(0.9).toBuilder().requestedFraction(0.05).build();

        assertEquals(5_000.0, service.size(signal, ledger, 100.0, NOW, policy).order().getNotional(), 1e-9);
    }

    @Test
    void testBelowMinimumNotionalRejected() {
        PortfolioLedger small = new PortfolioLedger(500.0, 0.0);

        assertEquals(RejectionReason.BELOW_MINIMUM_SIZE,
                service.size(longSignal(0.5), small, 100.0, NOW, policy).rejection());
    }

    @Test
    void testStopOnWrongSideRejected() {
        RiskPolicy broken = policy.toBuilder().stopLossPct(-1.0).build();

        assertEquals(RejectionReason.INVALID_STOP_PLACEMENT,
                service.size(longSignal(0.5), ledger, 100.0, NOW, broken).rejection());
    }

    @Test
    void testAtrStopsScaleWithAverageTrueRange() {
        RiskPolicy atrPolicy = policy.toBuilder().atrStopMultiplier(2.0).atrTakeMultiplier(3.0).atrPeriod(14).build();

        Order longOrder = service.size(longSignal(0.5), ledger, 100.0, NOW, atrPolicy, 1.5).order();
        assertEquals(97.0, longOrder.getStopLoss(), 1e-9);
        assertEquals(104.5, longOrder.getTakeProfit(), 1e-9);

        TradeSignal shortSignal = TradeSignal.shortSignal(0.5, "test").stamped("TEST[x=1]v1", NOW);
        Order shortOrder = service.size(shortSignal, ledger, 100.0, NOW, atrPolicy, 1.5).order();
        assertEquals(103.0, shortOrder.getStopLoss(), 1e-9);
        assertEquals(95.5, shortOrder.getTakeProfit(), 1e-9);
    }

    @Test
    void testAtrStopsRejectedWithoutUsableRange() {
        RiskPolicy atrPolicy = policy.toBuilder().atrStopMultiplier(2.0).atrTakeMultiplier(3.0).atrPeriod(14).build();

        assertEquals(RejectionReason.INVALID_STOP_PLACEMENT,
                service.size(longSignal(0.5), ledger, 100.0, NOW, atrPolicy, null).rejection());
        assertEquals(RejectionReason.INVALID_STOP_PLACEMENT,
                service.size(longSignal(0.5), ledger, 100.0, NOW, atrPolicy, 0.0).rejection());
    }

    @Test
    void testShortTargetAtOrBelowZeroRejected() {
        RiskPolicy atrPolicy = policy.toBuilder().atrStopMultiplier(1.0).atrTakeMultiplier(3.0).atrPeriod(14).build();
        TradeSignal shortSignal = TradeSignal.shortSignal(0.5, "test").stamped("TEST[x=1]v1", NOW);

        assertEquals(RejectionReason.INVALID_STOP_PLACEMENT,
                service.size(shortSignal, ledger, 100.0, NOW, atrPolicy, 40.0).rejection());
    }

    @Test
    void testPercentageStopsIgnoreAtr() {
        Order order = service.size(longSignal(0.5), ledger, 100.0, NOW, policy, 10.0).order();

        assertEquals(98.0, order.getStopLoss(), 1e-9);
        assertEquals(104.0, order.getTakeProfit(), 1e-9);
    }

    @Test
    void testEverySignalYieldsOrderOrRejection() {
        for (double confidence = 0.0; confidence <= 1.0; confidence += 0.05) {
            SizingDecision decision = service.size(longSignal(confidence), ledger, 100.0, NOW, policy);
            assertTrue(decision.isAccepted() ^ decision.rejection() != null);
            if (decision.isAccepted()) {
                assertTrue(decision.order().getSizeFraction() <= policy.getMaxPositionFraction() + 1e-12);
            }
        }
    }
}
