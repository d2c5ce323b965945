package tw.gc.paper.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.EquityPoint;
import tw.gc.paper.trader.entities.Trade;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the live equity curve since the active strategy was activated and compares it with that
 * strategy's backtest curve over the same elapsed time.
 *
 * <p>Observability only: it receives copies of values and never feeds back into decisions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private final TradingProperties tradingProperties;
    private final RiskProfileService riskProfileService;

    private final Deque<EquityPoint> liveCurve = new ArrayDeque<>();
    private ActiveStrategy tracked;
    private double baselineEquity;
    private LocalDateTime trackingSince;
    private int liveTrades;
    private int liveWins;
    private boolean drawdownAlerted;

    /**
     * Record one live equity point. Restarts tracking whenever a different strategy becomes active.
     */
    public synchronized void recordSample(EquityPoint point, ActiveStrategy active, List<Trade> closedTrades) {
        if (active == null || point == null) {
            return;
        }
        if (tracked == null || !tracked.id().equals(active.id()) || !tracked.activatedAt().equals(active.activatedAt())) {
            liveCurve.clear();
            baselineEquity = point.equity();
            trackingSince = point.timestamp();
            liveTrades = 0;
            liveWins = 0;
            drawdownAlerted = false;
            log.info("📡 Tracking live performance of {} from equity {}", active.id(),
                    String.format("%.2f", baselineEquity));
        }
        tracked = active;
        liveCurve.addLast(point);
        while (liveCurve.size() > tradingProperties.getMonitor().getMaxSamples()) {
            liveCurve.removeFirst();
        }
        for (Trade trade : closedTrades) {
            if (active.id().equals(trade.getStrategyId())) {
                liveTrades++;
                if (trade.isWin()) {
                    liveWins++;
                }
            }
        }

        double drawdownPct = liveDrawdown() * 100;
        boolean breached = drawdownPct > riskProfileService.currentPolicy().getMaxDrawdownPct();
        if (breached && !drawdownAlerted) {
            log.warn("🚨 Live drawdown {}% exceeds limit {}% for {}", String.format("%.2f", drawdownPct),
                    riskProfileService.currentPolicy().getMaxDrawdownPct(), active.id());
        }
        drawdownAlerted = breached;
    }

    public synchronized Optional<DriftReport> report() {
        if (tracked == null || liveCurve.isEmpty()) {
            return Optional.empty();
        }
        EquityPoint last = liveCurve.peekLast();
        Duration elapsed = Duration.between(trackingSince, last.timestamp());

        double liveReturn = baselineEquity > 0 ? last.equity() / baselineEquity - 1.0 : 0.0;
        double liveWinRate = liveTrades == 0 ? 0.0 : (double) liveWins / liveTrades;
        BacktestResult backtest = tracked.backtest();
        double backtestReturn = backtest == null ? 0.0 : backtestReturnOver(backtest, elapsed);
        double backtestWinRate = backtest == null ? 0.0 : backtest.statistics().winRate();

        double divergence = liveReturn - backtestReturn;
        double deviation = backtestReturn != 0.0 ? divergence / Math.abs(backtestReturn) : 0.0;
        double returnAccuracy = 1.0 - Math.min(1.0, Math.abs(deviation));
        double winRateAccuracy = 1.0 - Math.abs(liveWinRate - backtestWinRate);
        double accuracy = (returnAccuracy + winRateAccuracy) / 2.0;
        double liveDrawdown = liveDrawdown();

        return Optional.of(DriftReport.builder()
                .strategyId(tracked.id())
                .trackingSince(trackingSince)
                .elapsed(elapsed)
                .liveSamples(liveCurve.size())
                .liveReturn(liveReturn)
                .backtestReturn(backtestReturn)
                .divergence(divergence)
                .liveWinRate(liveWinRate)
                .backtestWinRate(backtestWinRate)
                .liveDrawdown(liveDrawdown)
                .accuracyScore(accuracy)
                .confidenceLevel(DriftReport.ConfidenceLevel.of(accuracy))
                .driftAlert(Math.abs(divergence) > tradingProperties.getMonitor().getDriftAlertThreshold())
                .drawdownAlert(liveDrawdown * 100 > riskProfileService.currentPolicy().getMaxDrawdownPct())
                .build());
    }

    /**
     * Live curve since activation, oldest first. Holds at most {@code monitor.max-samples} points.
     */
    public synchronized List<EquityPoint> liveCurve() {
        return new ArrayList<>(liveCurve);
    }

    /**
     * Cumulative backtest return from the start of the replay to {@code elapsed} later.
     */
    static double backtestReturnOver(BacktestResult backtest, Duration elapsed) {
        List<EquityPoint> curve = backtest.equityCurve();
        if (curve.isEmpty() || backtest.startingBalance() <= 0) {
            return 0.0;
        }
        LocalDateTime cutoff = curve.get(0).timestamp().plus(elapsed);
        double equity = curve.get(0).equity();
        for (EquityPoint point : curve) {
            if (point.timestamp().isAfter(cutoff)) {
                break;
            }
            equity = point.equity();
        }
        return equity / backtest.startingBalance() - 1.0;
    }

    private double liveDrawdown() {
        double peak = baselineEquity;
        double maxDrawdown = 0.0;
        for (EquityPoint point : liveCurve) {
            peak = Math.max(peak, point.equity());
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - point.equity()) / peak);
            }
        }
        return maxDrawdown;
    }
}
