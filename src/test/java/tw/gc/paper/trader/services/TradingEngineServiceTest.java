package tw.gc.paper.trader.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.paper.trader.AppConfig;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.EngineState;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.services.marketdata.BufferedMarketDataFeed;
import tw.gc.paper.trader.services.positionsizing.PositionSizingService;
import tw.gc.paper.trader.strategy.factory.CryptoStrategyFactory;
import tw.gc.paper.trader.testutil.PriceSeriesFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TradingEngineServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private StrategyOptimizationScheduler strategyOptimizationScheduler;

    private TradingProperties properties;
    private BufferedMarketDataFeed feed;
    private DecisionPipeline pipeline;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        properties.getEngine().setAutoStart(false);
        properties.getPersistence().setStateFile(tempDir.resolve("engine-state.json").toString());
        feed = new BufferedMarketDataFeed();
        objectMapper = new AppConfig().objectMapper();
    }

    private TradingEngineService newEngine() {
        return newEngine(feed);
    }

    private TradingEngineService newEngine(BufferedMarketDataFeed engineFeed) {
        StrategyCatalog catalog = new StrategyCatalog(new CryptoStrategyFactory());
        pipeline = spy(new DecisionPipeline(new SignalEvaluator(catalog), new PositionSizingService()));
        RiskProfileService riskProfileService = new RiskProfileService(properties);
        riskProfileService.initialize();
        TradingEngineService engine = new TradingEngineService(properties, engineFeed, pipeline, new ActiveStrategyService(),
                riskProfileService, new PerformanceMonitorService(properties, riskProfileService),
                new EngineStateStore(objectMapper, properties), catalog, strategyOptimizationScheduler);
        engine.initialize();
        return engine;
    }

    @Test
    void testEmptyFeedLeavesPortfolioUntouched() {
        TradingEngineService engine = newEngine();
        engine.start();
        EngineState before = engine.captureState();

        for (int i = 0; i < 3; i++) {
            assertTrue(engine.tick().isEmpty());
        }

        EngineState after = engine.captureState();
        assertEquals(before.getCash(), after.getCash());
        assertTrue(after.getTrades().isEmpty());
        assertTrue(after.getEquityCurve().isEmpty());
        assertNull(after.getOpenPosition());
        assertEquals(0, engine.status().getTicksProcessed());
        assertEquals(3, engine.status().getTicksSkipped());
        verify(pipeline, never()).process(any(), any(), any(), any(), any());
    }

    @Test
    void testUnavailableFeedSkipsTick() {
        TradingEngineService engine = newEngine();
        engine.start();
        feed.publish(PriceSeriesFactory.candle(0, 100, 101));
        feed.setAvailable(false);

        assertTrue(engine.tick().isEmpty());
        assertEquals(1, engine.status().getTicksSkipped());
        assertEquals(1, feed.pendingCount(PriceSeriesFactory.TIMEFRAME));

        feed.setAvailable(true);
        assertTrue(engine.tick().isPresent());
    }

    @Test
    void testTickConsumesOneSampleAndPublishesSnapshot() {
        TradingEngineService engine = newEngine();
        engine.start();
        feed.publish(PriceSeriesFactory.candle(0, 100, 101));
        feed.publish(PriceSeriesFactory.candle(1, 101, 102));

        Optional<TickOutcome> outcome = engine.tick();

        assertTrue(outcome.isPresent());
        assertEquals(1, feed.pendingCount(PriceSeriesFactory.TIMEFRAME));
        EngineStatus status = engine.status();
        assertEquals(1, status.getTicksProcessed());
        assertEquals(101.0, status.getPortfolio().getLastPrice());
        assertNotNull(status.getLastSignal());
        assertEquals(status.getActiveStrategyId(), status.getLastSignal().getStrategyId());
    }

    @Test
    void testStoppedEngineDoesNotConsumeSamples() {
        TradingEngineService engine = newEngine();
        feed.publish(PriceSeriesFactory.candle(0, 100, 101));

        assertTrue(engine.tick().isEmpty());
        assertEquals(1, feed.pendingCount(PriceSeriesFactory.TIMEFRAME));
        assertFalse(engine.status().isRunning());
    }

    @Test
    void testStartAndStopAreIdempotent() {
        TradingEngineService engine = newEngine();

        assertTrue(engine.start());
        assertFalse(engine.start());
        assertTrue(engine.status().isRunning());
        assertTrue(engine.stop());
        assertFalse(engine.stop());
        assertTrue(Files.exists(tempDir.resolve("engine-state.json")));
    }

    @Test
    void testSelectRiskProfileResetsPristineStoppedLedger() {
        TradingEngineService engine = newEngine();

        EngineStatus status = engine.selectRiskProfile(RiskProfile.AGGRESSIVE);

        assertEquals(RiskProfile.AGGRESSIVE, status.getRiskProfile());
        assertEquals(500_000.0, status.getPortfolio().getStartingBalance());
        assertEquals(500_000.0, status.getPortfolio().getCash());
    }

    @Test
    void testSelectRiskProfileKeepsTradedLedger() {
        TradingEngineService engine = newEngine();
        engine.start();
        feed.publish(PriceSeriesFactory.candle(0, 100, 101));
        engine.tick();

        EngineStatus status = engine.selectRiskProfile(RiskProfile.CONSERVATIVE);

        assertEquals(RiskProfile.CONSERVATIVE, status.getRiskProfile());
        assertEquals(100_000.0, status.getPortfolio().getStartingBalance());
        assertTrue(status.isRunning());
    }

    @Test
    void testLongRunKeepsEquityPositive() {
        TradingEngineService engine = newEngine();
        engine.start();
        List<PriceSample> series = PriceSeriesFactory.randomWalk(400, 100, 0.01, 21L);
        series.forEach(feed::publish);

        for (int i = 0; i < series.size(); i++) {
            assertTrue(engine.tick().isPresent());
            assertTrue(engine.status().getPortfolio().getEquity() > 0);
        }

        assertEquals(400, engine.status().getTicksProcessed());
        assertEquals(400, engine.captureState().getEquityCurve().size());
    }

    @Test
    void testRestartRestoresPortfolioAndWindow() {
        TradingEngineService first = newEngine();
        first.start();
        List<PriceSample> series = PriceSeriesFactory.oscillating(200, 100, 10, 40);
        series.forEach(feed::publish);
        for (int i = 0; i < series.size(); i++) {
            first.tick();
        }
        first.stop();
        EngineState saved = first.captureState();

        TradingEngineService second = newEngine();
        EngineState restored = second.captureState();

        assertEquals(saved.getCash(), restored.getCash());
        assertEquals(saved.getTrades(), restored.getTrades());
        assertEquals(saved.getOpenPosition(), restored.getOpenPosition());
        assertEquals(saved.getRecentSamples(), restored.getRecentSamples());
        assertEquals(saved.getActiveStrategy().getId(), restored.getActiveStrategy().getId());
        assertEquals(saved.getRiskProfile(), restored.getRiskProfile());
    }

    private static void runAll(TradingEngineService engine, BufferedMarketDataFeed engineFeed, List<PriceSample> samples) {
        samples.forEach(engineFeed::publish);
        for (int i = 0; i < samples.size(); i++) {
            engine.tick();
        }
    }

    @Test
    void testRestoredEngineDropsSamplesOlderThanItsWindow() {
        TradingEngineService first = newEngine();
        first.start();
        runAll(first, feed, PriceSeriesFactory.oscillating(200, 100, 10, 40));
        first.stop();
        EngineState saved = first.captureState();

        BufferedMarketDataFeed freshFeed = new BufferedMarketDataFeed();
        TradingEngineService second = newEngine(freshFeed);
        second.start();
        freshFeed.publish(PriceSeriesFactory.candle(5, 100, 100));

        assertTrue(second.tick().isEmpty());
        assertEquals(1, second.status().getTicksSkipped());
        assertEquals(0, second.status().getTicksProcessed());
        EngineState afterStale = second.captureState();
        assertEquals(saved.getRecentSamples(), afterStale.getRecentSamples());
        assertEquals(saved.getEquityCurve(), afterStale.getEquityCurve());

        freshFeed.publish(PriceSeriesFactory.candle(200, 100, 101));
        assertTrue(second.tick().isPresent());
        List<PriceSample> window = second.captureState().getRecentSamples();
        assertEquals(PriceSeriesFactory.timeAt(200), window.get(window.size() - 1).getTimestamp());
    }

    @Test
    void testRestoredEngineBehavesLikeUninterruptedEngine() {
        List<PriceSample> series = PriceSeriesFactory.oscillating(400, 100, 10, 40);
        List<PriceSample> before = series.subList(0, 200);
        List<PriceSample> after = series.subList(200, 400);

        TradingEngineService uninterrupted = newEngine();
        uninterrupted.start();
        runAll(uninterrupted, feed, before);
        uninterrupted.stop();

        BufferedMarketDataFeed restoredFeed = new BufferedMarketDataFeed();
        TradingEngineService restored = newEngine(restoredFeed);
        properties.getPersistence().setEnabled(false);

        uninterrupted.start();
        restored.start();
        runAll(uninterrupted, feed, after);
        runAll(restored, restoredFeed, after);

        EngineState expected = uninterrupted.captureState();
        EngineState actual = restored.captureState();
        assertFalse(expected.getTrades().isEmpty());
        assertEquals(expected.getCash(), actual.getCash());
        assertEquals(expected.getTrades(), actual.getTrades());
        assertEquals(expected.getOpenPosition(), actual.getOpenPosition());
        assertEquals(expected.getEquityCurve(), actual.getEquityCurve());
        assertEquals(expected.getRecentSamples(), actual.getRecentSamples());
    }

    @Test
    void testStatusReportsLastCycle() {
        CycleReport report = CycleReport.builder().cycleNumber(3).build();
        when(strategyOptimizationScheduler.getLastReport()).thenReturn(report);
        TradingEngineService engine = newEngine();

        assertSame(report, engine.status().getLastCycle());
    }
}
