package tw.gc.strategy.validation.services.walkforward;

import java.util.Map;

/**
 * Scores one parameter candidate on a training window. This is where a concrete trading system
 * plugs its signal logic and criterion into the training search.
 */
@FunctionalInterface
public interface CandidateScorer {

    CandidateScore score(SeriesWindow trainingWindow, Map<String, Double> parameters);
}
