package tw.gc.paper.trader.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.entities.OptimizationResult;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ranks optimization results and keeps the top-N winners of the latest cycle.
 * Order: higher score, then lower max drawdown, then earlier discovery.
 */
@Service
@Slf4j
public class StrategyRankingService {

    public static final Comparator<OptimizationResult> RANKING = Comparator
            .comparingDouble(OptimizationResult::getScore).reversed()
            .thenComparingDouble(OptimizationResult::getMaxDrawdown)
            .thenComparingLong(r -> r.getStrategy().getDiscoverySequence());

    private final AtomicReference<List<OptimizationResult>> winners = new AtomicReference<>(List.of());

    public List<OptimizationResult> rank(Collection<OptimizationResult> results) {
        return results.stream().sorted(RANKING).toList();
    }

    /**
     * Replace the winner set with the first {@code keep} entries of an already ranked list.
     */
    public List<OptimizationResult> updateWinners(List<OptimizationResult> ranked, int keep) {
        List<OptimizationResult> top = List.copyOf(ranked.subList(0, Math.min(Math.max(keep, 0), ranked.size())));
        winners.set(top);
        if (!top.isEmpty()) {
            log.info("🏆 Winner set updated: {} strategies, best {} ({})", top.size(),
                    top.get(0).getStrategyId(), String.format("%.3f", top.get(0).getScore()));
        }
        return top;
    }

    public List<OptimizationResult> getWinners() {
        return winners.get();
    }
}
