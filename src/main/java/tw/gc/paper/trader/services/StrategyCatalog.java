package tw.gc.paper.trader.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.strategy.IStrategy;
import tw.gc.paper.trader.strategy.StrategyFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of strategy families and of every definition created so far.
 * Definitions are interned by id, so one parameter combination keeps the discovery
 * sequence of its first creation.
 */
@Component
@Slf4j
public class StrategyCatalog {

    private final Map<String, IStrategy> families;
    private final Map<String, StrategyDefinition> definitions = new ConcurrentHashMap<>();
    private final AtomicLong discoverySequence = new AtomicLong();

    public StrategyCatalog(StrategyFactory strategyFactory) {
        Map<String, IStrategy> byFamily = new LinkedHashMap<>();
        for (IStrategy strategy : strategyFactory.createStrategies()) {
            if (byFamily.putIfAbsent(strategy.getFamily(), strategy) != null) {
                throw new IllegalStateException("Duplicate strategy family: " + strategy.getFamily());
            }
        }
        this.families = Collections.unmodifiableMap(byFamily);
        log.info("📚 Strategy catalog loaded {} families: {}", families.size(), families.keySet());
    }

    public IStrategy strategy(String family) {
        IStrategy strategy = families.get(family);
        if (strategy == null) {
            throw new IllegalArgumentException("Unknown strategy family: " + family);
        }
        return strategy;
    }

    public IStrategy strategy(StrategyDefinition definition) {
        return strategy(definition.getFamily());
    }

    public Set<String> families() {
        return families.keySet();
    }

    /**
     * Intern a definition for {@code family} with {@code parameters}.
     *
     * @throws IllegalArgumentException if the combination violates the family's parameter space
     */
    public StrategyDefinition define(String family, Map<String, Double> parameters) {
        IStrategy strategy = strategy(family);
        if (!strategy.isValid(parameters)) {
            throw new IllegalArgumentException("Invalid parameters for " + family + ": " + parameters);
        }
        String id = StrategyDefinition.buildId(family, parameters, strategy.getVersion());
        return definitions.computeIfAbsent(id, key ->
                StrategyDefinition.of(family, parameters, strategy.getVersion(), discoverySequence.getAndIncrement()));
    }

    public StrategyDefinition defaultDefinition(String family) {
        return define(family, strategy(family).defaultParameters());
    }

    /**
     * Seed variants of every family, in catalog order.
     */
    public List<StrategyDefinition> seedDefinitions() {
        List<StrategyDefinition> seeds = new ArrayList<>();
        for (IStrategy strategy : families.values()) {
            for (Map<String, Double> params : strategy.seedVariants()) {
                seeds.add(define(strategy.getFamily(), params));
            }
        }
        return seeds;
    }

    /**
     * Re-register a definition loaded from persisted state, keeping its original sequence.
     */
    public StrategyDefinition register(StrategyDefinition definition) {
        strategy(definition.getFamily());
        StrategyDefinition interned = definitions.putIfAbsent(definition.getId(), definition);
        discoverySequence.accumulateAndGet(definition.getDiscoverySequence() + 1, Math::max);
        return interned == null ? definition : interned;
    }

    public long getDiscoverySequence() {
        return discoverySequence.get();
    }

    public void restoreDiscoverySequence(long sequence) {
        discoverySequence.accumulateAndGet(sequence, Math::max);
    }
}
