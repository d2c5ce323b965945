package tw.gc.paper.trader.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The single active-strategy slot shared by the decision loop (reader) and the optimization
 * scheduler (writer). Reads never block; every write is a compare-and-set against the instance
 * the writer last observed, so concurrent writers cannot both win.
 */
@Service
@Slf4j
public class ActiveStrategyService {

    private final AtomicReference<ActiveStrategy> slot = new AtomicReference<>();

    /**
     * Current slot content; null before {@link #initialize}.
     */
    public ActiveStrategy current() {
        return slot.get();
    }

    public String getActiveStrategyId() {
        ActiveStrategy active = slot.get();
        return active == null ? null : active.id();
    }

    /**
     * Set the slot at startup or on state restore.
     */
    public void initialize(ActiveStrategy active) {
        slot.set(active);
        log.info("🎯 Active strategy: {} (score {})", active.id(), String.format("%.3f", active.score()));
    }

    /**
     * Replace {@code expected} with {@code challenger}. Refuses a challenger that does not strictly
     * beat the expected score.
     *
     * @return false if the challenger is not better or the slot no longer holds {@code expected}
     */
    public boolean promote(ActiveStrategy expected, ActiveStrategy challenger) {
        if (expected != null && challenger.score() <= expected.score()) {
            log.info("⏸️ Promotion refused: {} ({}) does not beat {} ({})", challenger.id(),
                    String.format("%.3f", challenger.score()), expected.id(), String.format("%.3f", expected.score()));
            return false;
        }
        if (!slot.compareAndSet(expected, challenger)) {
            log.warn("⚠️ Promotion of {} lost the race, slot changed to {}", challenger.id(), getActiveStrategyId());
            return false;
        }
        log.info("🔄 Switching strategy: {} → {} (score {})",
                expected == null ? "none" : expected.id(), challenger.id(), String.format("%.3f", challenger.score()));
        return true;
    }

    /**
     * Record a re-evaluated score for the strategy currently held. No-op if the slot moved on.
     *
     * @return the refreshed slot content, or null if the slot no longer holds {@code expected}
     */
    public ActiveStrategy refreshScore(ActiveStrategy expected, double score, BacktestResult backtest) {
        ActiveStrategy refreshed = expected.withScore(score, backtest);
        if (slot.compareAndSet(expected, refreshed)) {
            log.debug("Refreshed score of {}: {} → {}", expected.id(),
                    String.format("%.3f", expected.score()), String.format("%.3f", score));
            return refreshed;
        }
        return null;
    }
}
