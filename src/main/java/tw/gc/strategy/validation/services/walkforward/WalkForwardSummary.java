package tw.gc.strategy.validation.services.walkforward;

import java.util.List;

/**
 * Pooled out-of-sample view of a walk-forward run.
 *
 * @param folds the folds, in order
 * @param pooledReturns every fold's out-of-sample returns, concatenated in fold order
 * @param outOfSampleCriterion the criterion evaluated on {@code pooledReturns}
 * @param averageInSampleCriterion mean training criterion across folds
 */
public record WalkForwardSummary(
    List<WalkForwardFold> folds,
    double[] pooledReturns,
    double outOfSampleCriterion,
    double averageInSampleCriterion
) {
    public WalkForwardSummary {
        folds = List.copyOf(folds);
        pooledReturns = pooledReturns.clone();
    }

    @Override
    public double[] pooledReturns() {
        return pooledReturns.clone();
    }

    public int totalReturns() {
        return pooledReturns.length;
    }

    public int totalTestBars() {
        return folds.stream().mapToInt(WalkForwardFold::testLength).sum();
    }
}
