package tw.gc.strategy.validation.services.stats;

/**
 * Sort-and-index helpers shared by every estimator that reads empirical quantiles.
 *
 * <p>Quantile positions follow the {@code (n + 1)} convention: the lower bound for tail mass
 * {@code q} sits at zero-based index {@code floor(q * (n + 1)) - 1}, and the matching upper bound
 * at the mirror index {@code n - 1 - lower}.
 */
public final class OrderStatistics {

    private OrderStatistics() {}

    /**
     * Zero-based index of the lower bound for a one-sided tail mass.
     *
     * @param tailMass fraction in the lower tail, NaN is read as index 0
     * @param count number of sorted values, at least 1
     */
    public static int lowerBoundIndex(double tailMass, int count) {
        int k = (int) (tailMass * (count + 1)) - 1;
        return Math.min(Math.max(k, 0), count - 1);
    }

    /**
     * Zero-based index of the upper bound mirroring {@link #lowerBoundIndex(double, int)}.
     */
    public static int upperBoundIndex(double tailMass, int count) {
        return count - 1 - lowerBoundIndex(tailMass, count);
    }

    /**
     * Reads the empirical quantile at {@code fractile} from an ascending array.
     */
    public static double quantile(double[] sorted, double fractile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot take a quantile of an empty array");
        }
        return sorted[lowerBoundIndex(fractile, sorted.length)];
    }
}
