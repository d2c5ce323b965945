package tw.gc.paper.trader.strategy;

/**
 * Defines an optimizable parameter for a strategy family.
 * Used by discovery to perturb parameters inside a bounded grid.
 *
 * @param name The parameter name
 * @param minValue Minimum value in the search space (inclusive)
 * @param maxValue Maximum value in the search space (inclusive)
 * @param step Grid step; perturbed values are snapped onto it
 * @param defaultValue Default value
 */
public record StrategyParameterDefinition(
    String name,
    double minValue,
    double maxValue,
    double step,
    double defaultValue
) {
    public StrategyParameterDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be null or blank");
        }
        if (minValue > maxValue) {
            throw new IllegalArgumentException("minValue (%s) cannot be greater than maxValue (%s)"
                .formatted(minValue, maxValue));
        }
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive, got: %s".formatted(step));
        }
        if (defaultValue < minValue || defaultValue > maxValue) {
            throw new IllegalArgumentException("defaultValue (%s) must be between minValue (%s) and maxValue (%s)"
                .formatted(defaultValue, minValue, maxValue));
        }
    }

    public static StrategyParameterDefinition ofInt(String name, int minValue, int maxValue, int step, int defaultValue) {
        return new StrategyParameterDefinition(name, minValue, maxValue, step, defaultValue);
    }

    public static StrategyParameterDefinition ofDouble(String name, double minValue, double maxValue, double step, double defaultValue) {
        return new StrategyParameterDefinition(name, minValue, maxValue, step, defaultValue);
    }

    public int gridSize() {
        return (int) Math.floor((maxValue - minValue) / step + 1e-9) + 1;
    }

    public double valueAt(int index) {
        int size = gridSize();
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index %d out of range [0, %d)".formatted(index, size));
        }
        return Math.min(minValue + (index * step), maxValue);
    }

    /**
     * Clamps a raw value into range and snaps it to the nearest grid point.
     */
    public double snap(double value) {
        double clamped = Math.max(minValue, Math.min(maxValue, value));
        int index = (int) Math.round((clamped - minValue) / step);
        return valueAt(Math.min(index, gridSize() - 1));
    }

    public boolean contains(double value) {
        return value >= minValue && value <= maxValue;
    }
}
