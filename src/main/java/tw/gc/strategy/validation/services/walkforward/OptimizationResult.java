package tw.gc.strategy.validation.services.walkforward;

import java.util.Map;

/**
 * Winner of a parameter search.
 *
 * @param bestParameters parameters of the best candidate, empty if nothing was evaluated
 * @param bestScore score of the best candidate, null if nothing was evaluated
 * @param candidatesEvaluated number of candidates scored
 */
public record OptimizationResult(
    Map<String, Double> bestParameters,
    CandidateScore bestScore,
    int candidatesEvaluated
) {
    public boolean isValid() {
        return bestScore != null && !bestParameters.isEmpty();
    }

    public double bestCriterion() {
        return bestScore == null ? Double.NEGATIVE_INFINITY : bestScore.criterion();
    }
}
