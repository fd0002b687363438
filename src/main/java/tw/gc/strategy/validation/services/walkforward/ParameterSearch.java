package tw.gc.strategy.validation.services.walkforward;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import tw.gc.strategy.validation.services.bias.SelectionBiasTracker;

/**
 * Strategy for exploring a parameter grid.
 */
public interface ParameterSearch {

    /**
     * Evaluates candidates and returns the one with the highest criterion. Among equal criteria
     * the candidate generated first wins.
     *
     * @param parameters grid axes, first entry is the outermost loop
     * @param objective scores a candidate
     * @param biasTracker optional; when non-null every candidate's returns are passed to
     *                    {@link SelectionBiasTracker#process(double[])} in generation order
     */
    OptimizationResult search(
        List<ParameterDefinition> parameters,
        Function<Map<String, Double>, CandidateScore> objective,
        SelectionBiasTracker biasTracker);

    default OptimizationResult search(
            List<ParameterDefinition> parameters,
            Function<Map<String, Double>, CandidateScore> objective) {
        return search(parameters, objective, null);
    }
}
