package tw.gc.strategy.validation.services.stats;

/**
 * Standard normal CDF and its inverse, using the polynomial approximations of
 * Abramowitz and Stegun (26.2.17 and 26.2.23).
 *
 * <p>The inverse is accurate to about 4.5e-4, which is plenty for picking a bootstrap order
 * statistic.
 */
public final class NormalDistribution {

    private static final double INV_SQRT_2PI = 1.0 / Math.sqrt(2.0 * Math.PI);

    private NormalDistribution() {}

    public static double cdf(double z) {
        double zz = Math.abs(z);
        double pdf = Math.exp(-0.5 * zz * zz) * INV_SQRT_2PI;
        double t = 1.0 / (1.0 + zz * 0.2316419);
        double poly = ((((1.330274429 * t - 1.821255978) * t + 1.781477937) * t
                - 0.356563782) * t + 0.319381530) * t;
        return z > 0.0 ? 1.0 - pdf * poly : pdf * poly;
    }

    /**
     * @param p probability in (0, 1); 0 and 1 give NaN
     */
    public static double inverseCdf(double p) {
        double pp = p <= 0.5 ? p : 1.0 - p;
        double t = Math.sqrt(Math.log(1.0 / (pp * pp)));
        double numer = (0.010328 * t + 0.802853) * t + 2.515517;
        double denom = ((0.001308 * t + 0.189269) * t + 1.432788) * t + 1.0;
        double x = t - numer / denom;
        return p <= 0.5 ? -x : x;
    }
}
