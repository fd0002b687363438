package tw.gc.strategy.validation.testutil;

import java.util.Arrays;

import tw.gc.strategy.validation.services.random.Mwc256Random;
import tw.gc.strategy.validation.services.random.UniformRandom;

/**
 * Builds synthetic log-price series for tests.
 */
public final class SyntheticSeriesFactory {

    private static final double START_PRICE = Math.log(100.0);

    private SyntheticSeriesFactory() {}

    /**
     * Gaussian random walk in log prices.
     */
    public static double[] randomWalk(long seed, int length, double drift, double volatility) {
        UniformRandom random = new Mwc256Random(seed);
        double[] prices = new double[length];
        prices[0] = START_PRICE;
        for (int i = 1; i < length; i++) {
            prices[i] = prices[i - 1] + drift + volatility * random.nextNormal();
        }
        return prices;
    }

    /**
     * Straight line in log prices, rising by {@code slope} per bar.
     */
    public static double[] linearTrend(int length, double slope) {
        double[] prices = new double[length];
        for (int i = 0; i < length; i++) {
            prices[i] = START_PRICE + slope * i;
        }
        return prices;
    }

    public static double[] constant(int length, double value) {
        double[] values = new double[length];
        Arrays.fill(values, value);
        return values;
    }

    /**
     * {@code 0, 1, 2, ...}: handy when a test needs to see which bars a window covers.
     */
    public static double[] indexSeries(int length) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = i;
        }
        return values;
    }
}
