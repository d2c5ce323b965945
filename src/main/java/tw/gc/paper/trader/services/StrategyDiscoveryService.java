package tw.gc.paper.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.paper.trader.entities.StrategyDefinition;
import tw.gc.paper.trader.strategy.IStrategy;
import tw.gc.paper.trader.strategy.StrategyParameterDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Generates new candidate definitions: local perturbations of known strategies and
 * random draws from each family's parameter grid.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StrategyDiscoveryService {

    private static final int MAX_ATTEMPTS_PER_CANDIDATE = 20;
    private static final int MAX_STEP_SHIFT = 3;

    private final StrategyCatalog strategyCatalog;

    /**
     * Neighbours of {@code bases}: each parameter is moved up to a few grid steps with probability one half.
     */
    public List<StrategyDefinition> perturb(List<StrategyDefinition> bases, int count, Random random) {
        Set<StrategyDefinition> generated = new LinkedHashSet<>();
        if (bases.isEmpty() || count <= 0) {
            return List.of();
        }
        int attempts = 0;
        while (generated.size() < count && attempts < count * MAX_ATTEMPTS_PER_CANDIDATE) {
            StrategyDefinition base = bases.get(attempts % bases.size());
            attempts++;
            IStrategy strategy = strategyCatalog.strategy(base);
            Map<String, Double> params = new LinkedHashMap<>(base.getParameters());
            boolean changed = false;
            for (StrategyParameterDefinition definition : strategy.parameterSpace()) {
                if (random.nextBoolean()) {
                    int shift = random.nextInt(MAX_STEP_SHIFT) + 1;
                    double value = params.getOrDefault(definition.name(), definition.defaultValue());
                    double moved = definition.snap(value + (random.nextBoolean() ? shift : -shift) * definition.step());
                    changed |= moved != value;
                    params.put(definition.name(), moved);
                }
            }
            if (changed && strategy.isValid(params)) {
                StrategyDefinition candidate = strategyCatalog.define(base.getFamily(), params);
                if (!candidate.getId().equals(base.getId())) {
                    generated.add(candidate);
                }
            }
        }
        log.debug("🧬 Generated {} perturbations from {} bases", generated.size(), bases.size());
        return new ArrayList<>(generated);
    }

    /**
     * Uniform random grid points across all families.
     */
    public List<StrategyDefinition> discover(int count, Random random) {
        List<String> families = new ArrayList<>(strategyCatalog.families());
        Set<StrategyDefinition> generated = new LinkedHashSet<>();
        int attempts = 0;
        while (generated.size() < count && attempts < count * MAX_ATTEMPTS_PER_CANDIDATE) {
            attempts++;
            String family = families.get(random.nextInt(families.size()));
            IStrategy strategy = strategyCatalog.strategy(family);
            Map<String, Double> params = new LinkedHashMap<>();
            for (StrategyParameterDefinition definition : strategy.parameterSpace()) {
                params.put(definition.name(), definition.valueAt(random.nextInt(definition.gridSize())));
            }
            if (strategy.isValid(params)) {
                generated.add(strategyCatalog.define(family, params));
            }
        }
        log.info("🔭 Discovered {} candidate strategies", generated.size());
        return new ArrayList<>(generated);
    }
}
