package tw.gc.paper.trader.strategy;

import tw.gc.paper.trader.entities.PriceSample;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capability shared by every strategy family.
 *
 * Implementations are pure: the signal depends only on the window and the parameters passed in,
 * never on state kept between calls. The live loop and the backtester call the same instance with
 * the same inputs and must get the same answer.
 */
public interface IStrategy {

    /**
     * Produce exactly one signal for the latest sample in {@code window}.
     * Return {@link TradeSignal#flat(String)} when there is nothing to do.
     *
     * @param window ordered samples, oldest first, latest last
     * @param params one concrete parameter combination from {@link #parameterSpace()}
     */
    TradeSignal evaluate(List<PriceSample> window, Map<String, Double> params);

    /**
     * Family key, e.g. "RSI". Part of every strategy id.
     */
    String getFamily();

    String getName();

    /**
     * Implementation version stamped on every definition of this family.
     */
    default int getVersion() {
        return 1;
    }

    StrategyType getType();

    List<StrategyParameterDefinition> parameterSpace();

    /**
     * Minimum number of samples {@link #evaluate} needs before it can emit a non-flat signal.
     */
    int requiredLookback(Map<String, Double> params);

    /**
     * Parameter combinations always included in an optimization population.
     */
    List<Map<String, Double>> seedVariants();

    /**
     * Cross-parameter constraints, e.g. fast period below slow period.
     */
    default boolean isValid(Map<String, Double> params) {
        for (StrategyParameterDefinition definition : parameterSpace()) {
            Double value = params.get(definition.name());
            if (value == null || !definition.contains(value)) {
                return false;
            }
        }
        return true;
    }

    default Map<String, Double> defaultParameters() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        for (StrategyParameterDefinition definition : parameterSpace()) {
            defaults.put(definition.name(), definition.defaultValue());
        }
        return defaults;
    }

    static double param(Map<String, Double> params, String name) {
        Double value = params.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing strategy parameter: " + name);
        }
        return value;
    }

    static int intParam(Map<String, Double> params, String name) {
        return (int) Math.round(param(params, name));
    }
}
