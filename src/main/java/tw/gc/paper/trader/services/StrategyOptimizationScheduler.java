package tw.gc.paper.trader.services;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.OptimizationResult;
import tw.gc.paper.trader.entities.PriceSample;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.enums.Timeframe;
import tw.gc.paper.trader.exceptions.FeedUnavailableException;
import tw.gc.paper.trader.exceptions.InsufficientHistoryException;
import tw.gc.paper.trader.services.BacktestService.ScoredBacktest;
import tw.gc.paper.trader.services.CycleReport.Trigger;
import tw.gc.paper.trader.services.marketdata.MarketDataFeed;
import tw.gc.paper.trader.services.positionsizing.RiskPolicy;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic backtest sweeps that search for a better strategy than the active one.
 *
 * <p>Each cycle replays every candidate over the available history on its own ledger, in parallel,
 * ranks the results and promotes the winner if it clears the promotion threshold and strictly beats
 * the active strategy's refreshed score. Candidates that cannot be replayed are excluded.
 *
 * <p>When extra timeframes are configured the same population is also replayed on each of them.
 * Those results compete for the winner set, which seeds later perturbation, but promotion only
 * considers results from the live timeframe the engine trades on.
 *
 * <p>Cycles never overlap: a trigger that fires while a cycle runs is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StrategyOptimizationScheduler {

    private final TradingProperties tradingProperties;
    private final MarketDataFeed marketDataFeed;
    private final BacktestService backtestService;
    private final StrategyRankingService strategyRankingService;
    private final StrategyDiscoveryService strategyDiscoveryService;
    private final StrategyCatalog strategyCatalog;
    private final ActiveStrategyService activeStrategyService;
    private final RiskProfileService riskProfileService;
    private final ExecutorService optimizationExecutor;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private final ExecutorService cycleRunner = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "optimization-cycle");
        thread.setDaemon(true);
        return thread;
    });

    @Scheduled(initialDelayString = "${trading.optimization.initial-delay-ms:30000}",
            fixedRateString = "${trading.optimization.interval-ms:600000}")
    public void scheduledOptimization() {
        if (tradingProperties.getOptimization().isEnabled()) {
            trigger(Trigger.OPTIMIZATION);
        }
    }

    @Scheduled(initialDelayString = "${trading.optimization.discovery-interval-ms:1800000}",
            fixedRateString = "${trading.optimization.discovery-interval-ms:1800000}")
    public void scheduledDiscovery() {
        if (tradingProperties.getOptimization().isEnabled()) {
            trigger(Trigger.DISCOVERY);
        }
    }

    /**
     * Start a cycle in the background unless one is already running.
     *
     * @return false if the trigger was skipped
     */
    public boolean trigger(Trigger trigger) {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.info("⏭️ {} trigger skipped: previous cycle still running", trigger);
            return false;
        }
        try {
            cycleRunner.execute(() -> {
                try {
                    executeCycle(trigger);
                } catch (RuntimeException e) {
                    log.error("❌ {} cycle failed", trigger, e);
                } finally {
                    cycleRunning.set(false);
                }
            });
            return true;
        } catch (RuntimeException e) {
            cycleRunning.set(false);
            throw e;
        }
    }

    /**
     * Run a cycle on the calling thread unless one is already running.
     */
    public Optional<CycleReport> runCycle(Trigger trigger) {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.info("⏭️ {} cycle skipped: previous cycle still running", trigger);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(executeCycle(trigger));
        } finally {
            cycleRunning.set(false);
        }
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    public CycleReport getLastReport() {
        return lastReport.get();
    }

    private CycleReport executeCycle(Trigger trigger) {
        long cycleNumber = cycleCounter.incrementAndGet();
        LocalDateTime startedAt = LocalDateTime.now(ZoneOffset.UTC);
        TradingProperties.Optimization config = tradingProperties.getOptimization();
        log.info("🔬 Starting {} cycle #{}", trigger, cycleNumber);

        Timeframe live = tradingProperties.getTimeframe();
        List<PriceSample> history;
        try {
            history = fetchHistory(live, startedAt, config);
        } catch (FeedUnavailableException e) {
            log.warn("⚠️ {} cycle #{} skipped: {}", trigger, cycleNumber, e.getMessage());
            return null;
        }

        ActiveStrategy active = activeStrategyService.current();
        if (active == null) {
            log.warn("⚠️ {} cycle #{} skipped: no active strategy", trigger, cycleNumber);
            return null;
        }
        Random random = new Random(config.getSeed() + cycleNumber);
        List<StrategyDefinition> population = buildPopulation(trigger, active, random);
        RiskPolicy policy = riskProfileService.currentPolicy();

        Map<String, ScoredBacktest> scored = evaluate(population, live, history, policy, config);
        int evaluated = scored.size();
        int excluded = population.size() - scored.size();
        List<Timeframe> swept = new ArrayList<>(List.of(live));
        List<OptimizationResult> allResults = new ArrayList<>();
        scored.values().forEach(s -> allResults.add(s.result()));

        for (Timeframe timeframe : extraTimeframes(live, config)) {
            List<PriceSample> extraHistory;
            try {
                extraHistory = fetchHistory(timeframe, startedAt, config);
            } catch (FeedUnavailableException e) {
                log.info("Skipping {} sweep: {}", timeframe, e.getMessage());
                continue;
            }
            if (extraHistory.size() < config.getMinReplaySamples()) {
                log.info("Skipping {} sweep: {} samples, need {}", timeframe, extraHistory.size(),
                        config.getMinReplaySamples());
                continue;
            }
            Map<String, ScoredBacktest> extra = evaluate(population, timeframe, extraHistory, policy, config);
            evaluated += extra.size();
            excluded += population.size() - extra.size();
            swept.add(timeframe);
            extra.values().forEach(s -> allResults.add(s.result()));
        }

        strategyRankingService.updateWinners(strategyRankingService.rank(allResults), config.getWinnersToKeep());
        List<OptimizationResult> ranked = strategyRankingService.rank(
                scored.values().stream().map(ScoredBacktest::result).toList());

        ActiveStrategy current = active;
        ScoredBacktest activeEvaluation = scored.get(active.id());
        if (activeEvaluation != null) {
            ActiveStrategy refreshed = activeStrategyService.refreshScore(active,
                    activeEvaluation.result().getScore(), activeEvaluation.backtest());
            if (refreshed != null) {
                current = refreshed;
            }
        }

        boolean promoted = false;
        OptimizationResult best = ranked.isEmpty() ? null : ranked.get(0);
        if (best != null && !best.getStrategyId().equals(current.id())) {
            if (best.getScore() > config.getPromotionThreshold() && best.getScore() > current.score()) {
                ScoredBacktest winner = scored.get(best.getStrategyId());
                ActiveStrategy challenger = new ActiveStrategy(best.getStrategy(), best.getScore(),
                        winner.backtest(), LocalDateTime.now(ZoneOffset.UTC));
                promoted = activeStrategyService.promote(current, challenger);
            } else {
                log.info("📊 Best candidate {} ({}) not promoted: threshold {}, active {} ({})",
                        best.getStrategyId(), String.format("%.3f", best.getScore()), config.getPromotionThreshold(),
                        current.id(), String.format("%.3f", current.score()));
            }
        }

        ActiveStrategy after = activeStrategyService.current();
        CycleReport report = CycleReport.builder()
                .trigger(trigger)
                .cycleNumber(cycleNumber)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now(ZoneOffset.UTC))
                .populationSize(population.size())
                .timeframesSwept(List.copyOf(swept))
                .evaluated(evaluated)
                .excluded(excluded)
                .bestStrategyId(best == null ? null : best.getStrategyId())
                .bestScore(best == null ? 0.0 : best.getScore())
                .activeStrategyId(after.id())
                .activeScore(after.score())
                .promoted(promoted)
                .build();
        lastReport.set(report);
        log.info("✅ {} cycle #{} done over {}: {} evaluated, {} excluded, active {} ({}){}", trigger, cycleNumber,
                swept, evaluated, excluded, after.id(), String.format("%.3f", after.score()),
                promoted ? " [PROMOTED]" : "");
        return report;
    }

    private List<StrategyDefinition> buildPopulation(Trigger trigger, ActiveStrategy active, Random random) {
        TradingProperties.Optimization config = tradingProperties.getOptimization();
        Map<String, StrategyDefinition> byId = new LinkedHashMap<>();
        byId.put(active.id(), active.definition());
        for (StrategyDefinition seed : strategyCatalog.seedDefinitions()) {
            byId.putIfAbsent(seed.getId(), seed);
        }
        List<StrategyDefinition> winners = new ArrayList<>();
        for (OptimizationResult winner : strategyRankingService.getWinners()) {
            winners.add(winner.getStrategy());
            byId.putIfAbsent(winner.getStrategyId(), winner.getStrategy());
        }

        List<StrategyDefinition> generated;
        if (trigger == Trigger.DISCOVERY) {
            generated = strategyDiscoveryService.discover(config.getDiscoveryCandidates(), random);
        } else {
            List<StrategyDefinition> bases = winners.isEmpty() ? List.of(active.definition()) : winners;
            generated = strategyDiscoveryService.perturb(bases, config.getPerturbationsPerCycle(), random);
        }
        for (StrategyDefinition candidate : generated) {
            byId.putIfAbsent(candidate.getId(), candidate);
        }
        return new ArrayList<>(byId.values());
    }

    private List<PriceSample> fetchHistory(Timeframe timeframe, LocalDateTime now,
                                           TradingProperties.Optimization config) {
        LocalDateTime end = marketDataFeed.latestTimestamp(timeframe).orElse(now);
        return marketDataFeed.historicalRange(timeframe, end.minusDays(config.getHistoryDays()), end);
    }

    private List<Timeframe> extraTimeframes(Timeframe live, TradingProperties.Optimization config) {
        Set<Timeframe> extra = new LinkedHashSet<>(config.getTimeframes());
        extra.remove(live);
        return new ArrayList<>(extra);
    }

    /**
     * Replay every candidate on one timeframe's history. Results come back tagged with that timeframe.
     */
    private Map<String, ScoredBacktest> evaluate(List<StrategyDefinition> population, Timeframe timeframe,
                                                 List<PriceSample> history, RiskPolicy policy,
                                                 TradingProperties.Optimization config) {
        int lookback = tradingProperties.getEngine().getLookback();
        List<Callable<ScoredBacktest>> tasks = new ArrayList<>(population.size());
        for (StrategyDefinition candidate : population) {
            tasks.add(() -> backtestService.evaluate(candidate, history, policy, lookback, config.getMinReplaySamples()));
        }

        Map<String, ScoredBacktest> scored = new LinkedHashMap<>();
        List<Future<ScoredBacktest>> futures;
        try {
            futures = optimizationExecutor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Optimization interrupted before candidates finished");
            return scored;
        }

        for (int i = 0; i < futures.size(); i++) {
            StrategyDefinition candidate = population.get(i);
            try {
                ScoredBacktest result = futures.get(i).get();
                OptimizationResult tagged = result.result().toBuilder().timeframe(timeframe).build();
                scored.put(candidate.getId(), new ScoredBacktest(tagged, result.backtest()));
            } catch (ExecutionException e) {
                if (e.getCause() instanceof InsufficientHistoryException) {
                    log.info("Excluding {} on {}: {}", candidate.getId(), timeframe, e.getCause().getMessage());
                } else {
                    log.warn("⚠️ Excluding {} on {}: backtest failed", candidate.getId(), timeframe, e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ Optimization interrupted while collecting results");
                break;
            }
        }
        return scored;
    }

    @PreDestroy
    public void shutdown() {
        cycleRunner.shutdownNow();
    }
}
