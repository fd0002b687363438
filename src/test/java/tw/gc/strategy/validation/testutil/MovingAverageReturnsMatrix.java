package tw.gc.strategy.validation.testutil;

/**
 * One-bar returns of every short/long moving-average crossover pair, laid out as a row-major
 * {@code nSystems x nCases} matrix for CSCV.
 *
 * <p>Systems are ordered by long lookback {@code 2..maxLookback}, then short lookback
 * {@code 1..long-1}. Cases are the decision bars {@code maxLookback-1 .. n-2}; each case holds
 * the next-bar log return taken long when the short average is above the long one, short when
 * below, and 0 on equality.
 */
public record MovingAverageReturnsMatrix(double[] returns, int nSystems, int nCases) {

    public static MovingAverageReturnsMatrix build(double[] prices, int maxLookback) {
        if (maxLookback < 2 || prices.length <= maxLookback) {
            throw new IllegalArgumentException(
                "Need maxLookback >= 2 and more than %d prices, got %d".formatted(maxLookback, prices.length));
        }
        int nCases = prices.length - maxLookback;
        int nSystems = maxLookback * (maxLookback - 1) / 2;
        double[] returns = new double[nSystems * nCases];

        int cell = 0;
        for (int longLookback = 2; longLookback <= maxLookback; longLookback++) {
            for (int shortLookback = 1; shortLookback < longLookback; shortLookback++) {
                for (int bar = maxLookback - 1; bar < prices.length - 1; bar++) {
                    double shortMean = mean(prices, bar, shortLookback);
                    double longMean = mean(prices, bar, longLookback);
                    double change = prices[bar + 1] - prices[bar];
                    if (shortMean > longMean) {
                        returns[cell] = change;
                    } else if (shortMean < longMean) {
                        returns[cell] = -change;
                    }
                    cell++;
                }
            }
        }
        return new MovingAverageReturnsMatrix(returns, nSystems, nCases);
    }

    private static double mean(double[] prices, int lastBar, int lookback) {
        double sum = 0.0;
        for (int i = lastBar - lookback + 1; i <= lastBar; i++) {
            sum += prices[i];
        }
        return sum / lookback;
    }
}
