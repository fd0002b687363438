package tw.gc.strategy.validation.services.walkforward;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.services.bias.SelectionBiasTracker;
import tw.gc.strategy.validation.services.concurrent.ReplicationExecutor;

/**
 * Exhaustive grid search over named parameters.
 *
 * <p>Combinations are generated in canonical order: the first definition is the outermost loop
 * and the last one changes fastest. The winner is the first combination in that order whose
 * criterion is strictly greater than everything before it, so ties always resolve to the
 * earliest candidate.
 *
 * <p>With a parallel {@link ReplicationExecutor} the candidates are scored concurrently, but the
 * winner is still picked (and the bias tracker still fed) by walking the scores in canonical
 * order, so the outcome does not depend on thread timing. The objective must then be safe to
 * call from several threads.
 */
@Slf4j
public class ParameterOptimizer implements ParameterSearch {

    private final ReplicationExecutor replicationExecutor;

    public ParameterOptimizer() {
        this(ReplicationExecutor.sequential());
    }

    public ParameterOptimizer(ReplicationExecutor replicationExecutor) {
        this.replicationExecutor = replicationExecutor;
    }

    @Override
    public OptimizationResult search(
            List<ParameterDefinition> parameters,
            Function<Map<String, Double>, CandidateScore> objective,
            SelectionBiasTracker biasTracker) {

        if (parameters.isEmpty()) {
            throw new IllegalArgumentException("At least one parameter is required for optimization");
        }

        List<Map<String, Double>> combinations = generateAllCombinations(parameters);
        log.debug("Grid search over {} parameters ({} combinations)", parameters.size(), combinations.size());

        CandidateScore[] scores = new CandidateScore[combinations.size()];
        replicationExecutor.forEachIndex(scores.length, i -> scores[i] = objective.apply(combinations.get(i)));

        Map<String, Double> bestParameters = Map.of();
        CandidateScore bestScore = null;
        for (int i = 0; i < scores.length; i++) {
            CandidateScore score = scores[i];
            if (score == null) {
                continue;
            }
            if (biasTracker != null) {
                biasTracker.process(score.returns());
            }
            if (bestScore == null || score.criterion() > bestScore.criterion()) {
                bestScore = score;
                bestParameters = combinations.get(i);
            }
        }

        return new OptimizationResult(bestParameters, bestScore, combinations.size());
    }

    /**
     * All grid combinations in canonical (outer-to-inner) order.
     */
    public List<Map<String, Double>> generateAllCombinations(List<ParameterDefinition> parameters) {
        List<Map<String, Double>> combinations = new ArrayList<>();
        generateCombinationsRecursive(parameters, 0, new LinkedHashMap<>(), combinations);
        return combinations;
    }

    private void generateCombinationsRecursive(
            List<ParameterDefinition> parameters,
            int paramIndex,
            Map<String, Double> current,
            List<Map<String, Double>> results) {

        if (paramIndex >= parameters.size()) {
            results.add(Collections.unmodifiableMap(new LinkedHashMap<>(current)));
            return;
        }

        var param = parameters.get(paramIndex);
        for (int i = 0; i < param.gridSize(); i++) {
            current.put(param.name(), param.valueAt(i));
            generateCombinationsRecursive(parameters, paramIndex + 1, current, results);
        }
        current.remove(param.name());
    }
}
