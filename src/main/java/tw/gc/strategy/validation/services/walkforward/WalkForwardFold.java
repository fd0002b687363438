package tw.gc.strategy.validation.services.walkforward;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One walk-forward iteration: parameters trained on one window, then frozen and traded on the
 * window right after it.
 *
 * <pre>
 * ┌──────────────┬──────────┐
 * │   Training   │   Test   │
 * └──────────────┴──────────┘
 *        ┌──────────────┬──────────┐
 *        │   Training   │   Test   │
 *        └──────────────┴──────────┘
 * </pre>
 *
 * <p>Each fold's start is advanced by the number of test bars the previous fold consumed, so test
 * windows never overlap.
 *
 * @param foldIndex zero-based position of this fold in the run
 * @param trainStart first training bar (absolute index)
 * @param trainLength training bars
 * @param testStart first test bar, always {@code trainStart + trainLength}
 * @param testLength test bars; the final fold may be shorter than the configured length
 * @param parameters parameters chosen on the training window
 * @param inSampleCriterion training criterion of those parameters
 * @param outOfSampleReturns returns the evaluator produced on the test window
 */
public record WalkForwardFold(
    int foldIndex,
    int trainStart,
    int trainLength,
    int testStart,
    int testLength,
    Map<String, Double> parameters,
    double inSampleCriterion,
    double[] outOfSampleReturns
) {
    public WalkForwardFold {
        if (foldIndex < 0) {
            throw new IllegalArgumentException("foldIndex must be non-negative, got: " + foldIndex);
        }
        if (trainStart < 0 || trainLength < 1 || testLength < 1) {
            throw new IllegalArgumentException("Invalid fold geometry: train [%d, +%d) test +%d"
                .formatted(trainStart, trainLength, testLength));
        }
        if (testStart != trainStart + trainLength) {
            throw new IllegalArgumentException("testStart (%d) must immediately follow the training window ending at %d"
                .formatted(testStart, trainStart + trainLength));
        }
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        outOfSampleReturns = outOfSampleReturns.clone();
    }

    /**
     * @return absolute index one past the last test bar
     */
    public int testEnd() {
        return testStart + testLength;
    }

    @Override
    public double[] outOfSampleReturns() {
        return outOfSampleReturns.clone();
    }

    public String describe() {
        return "Fold %d: train [%d, %d) test [%d, %d) params=%s IS=%.5f OOS returns=%d".formatted(
            foldIndex, trainStart, testStart, testStart, testEnd(), parameters,
            inSampleCriterion, outOfSampleReturns.length);
    }
}
