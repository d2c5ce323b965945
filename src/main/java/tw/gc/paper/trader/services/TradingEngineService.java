package tw.gc.paper.trader.services;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.EngineState;
import tw.gc.paper.trader.entities.PortfolioSnapshot;
import tw.gc.paper.trader.entities.Position;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.entities.Trade;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.exceptions.FeedUnavailableException;
import tw.gc.paper.trader.exceptions.StatePersistenceException;
import tw.gc.paper.trader.services.ledger.PortfolioLedger;
import tw.gc.paper.trader.services.marketdata.MarketDataFeed;
import tw.gc.paper.trader.services.positionsizing.RiskPolicy;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The live decision loop. Each tick takes at most one new sample from the feed, reads the
 * active strategy exactly once and runs the shared decision pipeline against the live ledger.
 *
 * <p>The live ledger is touched only under {@code tickLock}, which is held by the tick itself and by
 * the lifecycle operations (start, stop, risk profile selection). Status reads never take the lock;
 * they see the snapshot published at the end of the last tick.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradingEngineService {

    /** Persist at least this often even when nothing traded, so the price window stays fresh. */
    private static final int PERSIST_EVERY_TICKS = 60;

    /** Minimum samples kept for the rolling window; covers the longest lookback any strategy asks for. */
    private static final int MAX_RETAINED_SAMPLES = 500;

    /** Consecutive empty ticks before a feed gap is reported at WARN. */
    private static final int GAP_WARN_TICKS = 30;

    private final TradingProperties tradingProperties;
    private final MarketDataFeed marketDataFeed;
    private final DecisionPipeline decisionPipeline;
    private final ActiveStrategyService activeStrategyService;
    private final RiskProfileService riskProfileService;
    private final PerformanceMonitorService performanceMonitorService;
    private final EngineStateStore engineStateStore;
    private final StrategyCatalog strategyCatalog;
    private final StrategyOptimizationScheduler strategyOptimizationScheduler;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final Deque<PriceSample> window = new ArrayDeque<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PortfolioSnapshot> portfolioSnapshot = new AtomicReference<>();
    private final AtomicLong ticksProcessed = new AtomicLong();
    private final AtomicLong ticksSkipped = new AtomicLong();

    private PortfolioLedger ledger;
    private volatile TradeSignal lastSignal;
    private volatile LocalDateTime startedAt;
    private int consecutiveGaps;
    private int ticksSincePersist;
    private int persistedTradeCount = -1;
    private Position persistedPosition;
    private String persistedStrategyId;

    @PostConstruct
    public void initialize() {
        tickLock.lock();
        try {
            Optional<EngineState> saved = engineStateStore.load();
            if (saved.isPresent()) {
                restore(saved.get());
            } else {
                RiskPolicy policy = riskProfileService.currentPolicy();
                ledger = new PortfolioLedger(policy.getStartingBalance(), policy.getFeeRate());
                StrategyDefinition initial = strategyCatalog.defaultDefinition(
                        tradingProperties.getEngine().getDefaultStrategyFamily());
                activeStrategyService.initialize(new ActiveStrategy(initial, 0.0, null, now()));
            }
            markPersisted();
            publishSnapshot();
        } finally {
            tickLock.unlock();
        }
        log.info("🚀 Paper trading engine ready: {} {} | profile {} | equity {}", tradingProperties.getSymbol(),
                tradingProperties.getTimeframe(), riskProfileService.getActiveProfile(),
                String.format("%.2f", portfolioSnapshot.get().getEquity()));
        if (tradingProperties.getEngine().isAutoStart()) {
            start();
        }
    }

    @Scheduled(fixedRateString = "${trading.engine.tick-interval-ms:1000}")
    public void tradingLoop() {
        if (!running.get()) {
            return;
        }
        try {
            tick();
        } catch (Exception e) {
            log.error("🚨 Trading loop error", e);
        }
    }

    /**
     * One pass of the decision loop.
     *
     * @return the outcome, or empty if the engine is stopped or no new sample was available
     */
    public Optional<TickOutcome> tick() {
        tickLock.lock();
        try {
            if (!running.get()) {
                return Optional.empty();
            }
            Optional<PriceSample> next;
            try {
                next = marketDataFeed.nextSample(tradingProperties.getTimeframe());
            } catch (FeedUnavailableException e) {
                recordGap(e.getMessage());
                return Optional.empty();
            }
            if (next.isEmpty()) {
                recordGap("no new sample");
                return Optional.empty();
            }
            PriceSample sample = next.get();
            PriceSample previous = window.peekLast();
            if (previous != null && !sample.getTimestamp().isAfter(previous.getTimestamp())) {
                ticksSkipped.incrementAndGet();
                log.warn("⚠️ Dropping stale sample at {}: window already ends at {}", sample.getTimestamp(),
                        previous.getTimestamp());
                return Optional.empty();
            }
            checkContinuity(sample);
            consecutiveGaps = 0;

            ActiveStrategy active = activeStrategyService.current();
            window.addLast(sample);
            while (window.size() > Math.max(MAX_RETAINED_SAMPLES, tradingProperties.getEngine().getLookback())) {
                window.removeFirst();
            }
            int windowSize = decisionPipeline.windowSize(active.definition(), tradingProperties.getEngine().getLookback());
            List<PriceSample> retained = new ArrayList<>(window);
            List<PriceSample> view = retained.subList(Math.max(0, retained.size() - windowSize), retained.size());

            RiskPolicy policy = riskProfileService.currentPolicy();
            TickOutcome outcome = decisionPipeline.process(sample, view, active.definition(), ledger, policy);
            ticksProcessed.incrementAndGet();
            lastSignal = outcome.signal();
            logOutcome(outcome);

            performanceMonitorService.recordSample(outcome.equityPoint(), active, outcome.closedTrades());
            persistIfChanged(false);
            publishSnapshot();
            return Optional.of(outcome);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * @return false if the engine was already running
     */
    public boolean start() {
        tickLock.lock();
        try {
            if (!running.compareAndSet(false, true)) {
                return false;
            }
            startedAt = now();
            log.info("▶️ Engine started with strategy {}", activeStrategyService.getActiveStrategyId());
            return true;
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Stop ticking and persist state. Open positions stay open.
     *
     * @return false if the engine was not running
     */
    public boolean stop() {
        tickLock.lock();
        try {
            if (!running.compareAndSet(true, false)) {
                return false;
            }
            persistIfChanged(true);
            publishSnapshot();
            log.info("⏹️ Engine stopped after {} ticks", ticksProcessed.get());
            return true;
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Switch risk profile. Applies to subsequent orders; if the engine is stopped and has never traded,
     * the ledger is recreated with the profile's starting balance.
     */
    public EngineStatus selectRiskProfile(RiskProfile profile) {
        tickLock.lock();
        try {
            RiskProfile previous = riskProfileService.getActiveProfile();
            riskProfileService.setActiveProfile(profile);
            RiskPolicy policy = riskProfileService.currentPolicy();
            if (!running.get() && ledger.isPristine()) {
                ledger = new PortfolioLedger(policy.getStartingBalance(), policy.getFeeRate());
                log.info("🛡️ Risk profile {} → {}: ledger reset to {}", previous, profile,
                        String.format("%.2f", policy.getStartingBalance()));
            } else {
                ledger.setFeeRate(policy.getFeeRate());
                log.info("🛡️ Risk profile {} → {}: applies to new orders", previous, profile);
            }
            persistIfChanged(true);
            publishSnapshot();
        } finally {
            tickLock.unlock();
        }
        return status();
    }

    public EngineStatus status() {
        ActiveStrategy active = activeStrategyService.current();
        LocalDateTime since = startedAt;
        boolean isRunning = running.get();
        return EngineStatus.builder()
                .running(isRunning)
                .riskProfile(riskProfileService.getActiveProfile())
                .portfolio(portfolioSnapshot.get())
                .activeStrategyId(active == null ? null : active.id())
                .activeScore(active == null ? 0.0 : active.score())
                .lastSignal(lastSignal)
                .startedAt(since)
                .uptime(isRunning && since != null ? Duration.between(since, now()) : Duration.ZERO)
                .ticksProcessed(ticksProcessed.get())
                .ticksSkipped(ticksSkipped.get())
                .lastCycle(strategyOptimizationScheduler.getLastReport())
                .build();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Live trade history, copied under the tick lock.
     */
    public List<Trade> trades() {
        tickLock.lock();
        try {
            return List.copyOf(ledger.getTrades());
        } finally {
            tickLock.unlock();
        }
    }

    public EngineState captureState() {
        tickLock.lock();
        try {
            return buildState();
        } finally {
            tickLock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("🛑 Shutting down paper trading engine");
        if (!stop()) {
            tickLock.lock();
            try {
                persistIfChanged(true);
            } finally {
                tickLock.unlock();
            }
        }
    }

    private void restore(EngineState state) {
        RiskProfile profile = state.getRiskProfile() == null ? RiskProfile.DEFAULT : state.getRiskProfile();
        riskProfileService.setActiveProfile(profile);
        RiskPolicy policy = riskProfileService.currentPolicy();
        ledger = PortfolioLedger.restore(state.getStartingBalance(), state.getCash(), state.getOpenPosition(),
                state.getTrades(), state.getEquityCurve(), state.getLastPrice(), policy.getFeeRate());

        strategyCatalog.restoreDiscoverySequence(state.getDiscoverySequence());
        StrategyDefinition definition = state.getActiveStrategy() == null
                ? strategyCatalog.defaultDefinition(tradingProperties.getEngine().getDefaultStrategyFamily())
                : strategyCatalog.register(state.getActiveStrategy());
        activeStrategyService.initialize(new ActiveStrategy(definition, state.getActiveScore(), null, now()));

        window.clear();
        if (state.getRecentSamples() != null) {
            window.addAll(state.getRecentSamples());
        }
        log.info("♻️ Restored portfolio: cash {}, {} trades, position {}", String.format("%.2f", state.getCash()),
                ledger.getTrades().size(), ledger.hasOpenPosition() ? ledger.getOpenPosition().getDirection() : "FLAT");
    }

    private EngineState buildState() {
        ActiveStrategy active = activeStrategyService.current();
        return EngineState.builder()
                .schemaVersion(EngineStateStore.SCHEMA_VERSION)
                .savedAt(now())
                .riskProfile(riskProfileService.getActiveProfile())
                .startingBalance(ledger.getStartingBalance())
                .cash(ledger.getCash())
                .lastPrice(ledger.getLastPrice())
                .openPosition(ledger.getOpenPosition())
                .trades(List.copyOf(ledger.getTrades()))
                .equityCurve(List.copyOf(ledger.getEquityCurve()))
                .activeStrategy(active == null ? null : active.definition())
                .activeScore(active == null ? 0.0 : active.score())
                .recentSamples(List.copyOf(window))
                .discoverySequence(strategyCatalog.getDiscoverySequence())
                .build();
    }

    private void persistIfChanged(boolean force) {
        ticksSincePersist++;
        boolean changed = ledger.getTrades().size() != persistedTradeCount
                || ledger.getOpenPosition() != persistedPosition
                || !Objects.equals(activeStrategyService.getActiveStrategyId(), persistedStrategyId);
        if (!force && !changed && ticksSincePersist < PERSIST_EVERY_TICKS) {
            return;
        }
        try {
            engineStateStore.save(buildState());
            markPersisted();
        } catch (StatePersistenceException e) {
            log.error("❌ Failed to persist engine state, will retry next tick", e);
        }
    }

    private void markPersisted() {
        persistedTradeCount = ledger.getTrades().size();
        persistedPosition = ledger.getOpenPosition();
        persistedStrategyId = activeStrategyService.getActiveStrategyId();
        ticksSincePersist = 0;
    }

    private void publishSnapshot() {
        portfolioSnapshot.set(ledger.snapshot());
    }

    private void recordGap(String reason) {
        ticksSkipped.incrementAndGet();
        consecutiveGaps++;
        if (consecutiveGaps == GAP_WARN_TICKS) {
            log.warn("⚠️ Feed gap: {} consecutive ticks without data ({})", consecutiveGaps, reason);
        } else {
            log.debug("Tick skipped: {}", reason);
        }
    }

    private void checkContinuity(PriceSample sample) {
        PriceSample previous = window.peekLast();
        if (previous == null) {
            return;
        }
        Duration step = Duration.between(previous.getTimestamp(), sample.getTimestamp());
        Duration expected = tradingProperties.getTimeframe().getDuration();
        if (step.compareTo(expected.multipliedBy(2)) >= 0) {
            log.warn("⚠️ Feed gap: {} → {} ({} missing candles)", previous.getTimestamp(), sample.getTimestamp(),
                    step.dividedBy(expected) - 1);
        }
    }

    private void logOutcome(TickOutcome outcome) {
        for (Trade trade : outcome.closedTrades()) {
            log.info("{} Closed {} {} → {} ({}): P&L {}", trade.isWin() ? "💰" : "📉", trade.getDirection(),
                    String.format("%.2f", trade.getEntryPrice()), String.format("%.2f", trade.getExitPrice()),
                    trade.getExitReason(), String.format("%.2f", trade.getRealizedPnl()));
        }
        if (outcome.openedOrder() != null) {
            log.info("📈 Opened {} {} @ {} (stop {}, target {}) by {}", outcome.openedOrder().getDirection(),
                    String.format("%.2f", outcome.openedOrder().getNotional()),
                    String.format("%.2f", outcome.openedOrder().getEntryPrice()),
                    String.format("%.2f", outcome.openedOrder().getStopLoss()),
                    String.format("%.2f", outcome.openedOrder().getTakeProfit()),
                    outcome.openedOrder().getStrategyId());
        }
        if (outcome.rejection() != null) {
            log.debug("Signal {} rejected: {} ({})", outcome.signal().getDirection(), outcome.rejection(),
                    outcome.rejectionDetail());
        }
    }

    private static LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
