package tw.gc.strategy.validation.services.walkforward;

import java.util.List;

/**
 * Trains by running a {@link ParameterSearch} over a grid, scoring every candidate on the
 * training window with a {@link CandidateScorer}.
 */
public class SearchTrainer implements WalkForwardTrainer {

    private final ParameterSearch search;
    private final List<ParameterDefinition> parameters;
    private final CandidateScorer scorer;

    public SearchTrainer(ParameterSearch search, List<ParameterDefinition> parameters, CandidateScorer scorer) {
        this.search = search;
        this.parameters = List.copyOf(parameters);
        this.scorer = scorer;
    }

    /**
     * Exhaustive grid search trainer.
     */
    public static SearchTrainer grid(List<ParameterDefinition> parameters, CandidateScorer scorer) {
        return new SearchTrainer(new ParameterOptimizer(), parameters, scorer);
    }

    @Override
    public TrainingResult train(SeriesWindow trainingWindow) {
        OptimizationResult result = search.search(parameters, params -> scorer.score(trainingWindow, params));
        if (!result.isValid()) {
            throw new IllegalStateException(
                "No parameter candidate could be scored on training window [%d, %d)"
                    .formatted(trainingWindow.start(), trainingWindow.end()));
        }
        return new TrainingResult(
            result.bestParameters(),
            result.bestScore().criterion(),
            result.bestScore().finalPosition());
    }
}
