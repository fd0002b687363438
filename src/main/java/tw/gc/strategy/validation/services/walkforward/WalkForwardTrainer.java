package tw.gc.strategy.validation.services.walkforward;

/**
 * Chooses parameters from a training window. Grid and random searches are provided by
 * {@link SearchTrainer}; any other optimizer can be plugged in behind the same contract.
 */
@FunctionalInterface
public interface WalkForwardTrainer {

    TrainingResult train(SeriesWindow trainingWindow);
}
