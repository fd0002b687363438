package tw.gc.strategy.validation.services.walkforward;

/**
 * One axis of a discrete parameter grid searched during a walk-forward training pass.
 * Consumed by {@link ParameterOptimizer} (every grid point) and {@link RandomParameterSearch}
 * (uniformly drawn grid points).
 *
 * <p>Example usage:
 * <pre>
 * var lookback = ParameterDefinition.ofInt("lookback", 2, 100, 1);
 * var threshold = ParameterDefinition.ofDouble("threshold", 0.01, 0.10, 0.01);
 * </pre>
 *
 * @param name parameter name, the key under which values are handed to scorers
 * @param minValue first grid value (inclusive)
 * @param maxValue last grid value (inclusive, when reachable by whole steps)
 * @param step distance between neighbouring grid values, strictly positive
 */
public record ParameterDefinition(String name, double minValue, double maxValue, double step) {

    /** Absorbs rounding in (max - min) / step so that e.g. 0.01..0.10 by 0.01 has ten points */
    private static final double GRID_EPSILON = 1.0e-9;

    /**
     * Rejects unnamed axes, inverted ranges and non-positive steps.
     */
    public ParameterDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be null or blank");
        }
        if (minValue > maxValue) {
            throw new IllegalArgumentException("Parameter '%s': minValue %s exceeds maxValue %s"
                .formatted(name, minValue, maxValue));
        }
        if (step <= 0) {
            throw new IllegalArgumentException("Parameter '%s': step must be positive, got: %s"
                .formatted(name, step));
        }
    }

    /**
     * Grid of whole numbers, e.g. a lookback in bars.
     *
     * @param name parameter name
     * @param minValue smallest value
     * @param maxValue largest value
     * @param step increment, typically 1
     * @return the axis
     */
    public static ParameterDefinition ofInt(String name, int minValue, int maxValue, int step) {
        return new ParameterDefinition(name, minValue, maxValue, step);
    }

    /**
     * Grid of real values, e.g. a breakout threshold.
     *
     * @param name parameter name
     * @param minValue smallest value
     * @param maxValue largest value
     * @param step increment
     * @return the axis
     */
    public static ParameterDefinition ofDouble(String name, double minValue, double maxValue, double step) {
        return new ParameterDefinition(name, minValue, maxValue, step);
    }

    /**
     * A single-valued axis, for parameters held constant during a search.
     *
     * @param name parameter name
     * @param value the only grid value
     * @return an axis of size one
     */
    public static ParameterDefinition fixed(String name, double value) {
        return new ParameterDefinition(name, value, value, 1.0);
    }

    /**
     * @return number of grid points, at least one
     */
    public int gridSize() {
        return (int) Math.floor((maxValue - minValue) / step + GRID_EPSILON) + 1;
    }

    /**
     * Grid value at a position, counting from {@code minValue}. The last point is capped at
     * {@code maxValue}.
     *
     * @param index zero-based grid position
     * @return {@code min(minValue + index * step, maxValue)}
     * @throws IndexOutOfBoundsException if index is outside [0, gridSize)
     */
    public double valueAt(int index) {
        int size = gridSize();
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index %d out of range [0, %d) for parameter '%s'"
                .formatted(index, size, name));
        }
        return Math.min(minValue + index * step, maxValue);
    }
}
