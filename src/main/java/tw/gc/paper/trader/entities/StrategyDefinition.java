package tw.gc.paper.trader.entities;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * An immutable strategy instance: a family plus one concrete parameter combination.
 * A different parameter set is a different definition with a different id, so backtest
 * results stay attributable to exactly one configuration.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StrategyDefinition {

    String id;
    String family;
    Map<String, Double> parameters;
    int version;

    /**
     * Global order in which the definition was first created; earlier wins ranking ties.
     */
    long discoverySequence;

    public static StrategyDefinition of(String family, Map<String, Double> parameters, int version, long discoverySequence) {
        Map<String, Double> sorted = Collections.unmodifiableMap(new TreeMap<>(parameters));
        return StrategyDefinition.builder()
                .id(buildId(family, sorted, version))
                .family(family)
                .parameters(sorted)
                .version(version)
                .discoverySequence(discoverySequence)
                .build();
    }

    public double param(String name) {
        Double value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Strategy " + id + " has no parameter " + name);
        }
        return value;
    }

    public int intParam(String name) {
        return (int) Math.round(param(name));
    }

    /**
     * Deterministic id, e.g. {@code RSI[overbought=70,oversold=30,period=14]v1}.
     */
    public static String buildId(String family, Map<String, Double> parameters, int version) {
        String params = new TreeMap<>(parameters).entrySet().stream()
                .map(e -> e.getKey() + "=" + formatValue(e.getValue()))
                .collect(Collectors.joining(","));
        return family + "[" + params + "]v" + version;
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e9) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.4f", value).replaceAll("0+$", "");
    }
}
