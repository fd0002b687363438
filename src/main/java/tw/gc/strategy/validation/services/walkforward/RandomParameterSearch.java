package tw.gc.strategy.validation.services.walkforward;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.services.bias.SelectionBiasTracker;
import tw.gc.strategy.validation.services.random.UniformRandom;

/**
 * Stochastic search: draws a fixed number of candidates uniformly from the parameter grid.
 *
 * <p>Each candidate picks one grid index per axis, axes visited in definition order, so a given
 * generator state always yields the same candidate sequence. Duplicates are possible and are
 * scored again. This is the kind of unguided generation a selection-bias tracker may collect
 * from.
 */
@Slf4j
public class RandomParameterSearch implements ParameterSearch {

    private final UniformRandom random;
    private final int candidateCount;

    public RandomParameterSearch(UniformRandom random, int candidateCount) {
        if (candidateCount < 1) {
            throw new IllegalArgumentException("candidateCount must be >= 1, got: " + candidateCount);
        }
        this.random = random;
        this.candidateCount = candidateCount;
    }

    @Override
    public OptimizationResult search(
            List<ParameterDefinition> parameters,
            Function<Map<String, Double>, CandidateScore> objective,
            SelectionBiasTracker biasTracker) {

        if (parameters.isEmpty()) {
            throw new IllegalArgumentException("At least one parameter is required for optimization");
        }

        Map<String, Double> bestParameters = Map.of();
        CandidateScore bestScore = null;

        for (int candidate = 0; candidate < candidateCount; candidate++) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (ParameterDefinition param : parameters) {
                values.put(param.name(), param.valueAt(random.nextIndex(param.gridSize())));
            }
            Map<String, Double> frozen = Collections.unmodifiableMap(values);

            CandidateScore score = objective.apply(frozen);
            if (score == null) {
                continue;
            }
            if (biasTracker != null) {
                biasTracker.process(score.returns());
            }
            if (bestScore == null || score.criterion() > bestScore.criterion()) {
                bestScore = score;
                bestParameters = frozen;
            }
        }

        log.debug("Random search drew {} candidates, best criterion {}",
            candidateCount, bestScore == null ? Double.NaN : bestScore.criterion());
        return new OptimizationResult(bestParameters, bestScore, candidateCount);
    }
}
