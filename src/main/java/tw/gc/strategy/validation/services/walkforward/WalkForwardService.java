package tw.gc.strategy.validation.services.walkforward;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.exceptions.ValidationConfigurationException;
import tw.gc.strategy.validation.services.stats.SampleStatistic;

/**
 * Rolling walk-forward train/test harness.
 *
 * <p>Starting at bar 0, each iteration:
 * <ol>
 *   <li>trains on {@code [start, start + nTrain)}</li>
 *   <li>freezes the chosen parameters and evaluates
 *       {@code [start + nTrain, start + nTrain + min(nTest, N - start - nTrain))}, handing the
 *       evaluator the position held at the end of training so the first test decision follows on
 *       from the last training decision</li>
 *   <li>advances {@code start} by the number of test bars actually used</li>
 * </ol>
 * and stops once {@code start + nTrain >= N}. The last fold's test window may be short.
 *
 * <p>Geometry is checked up front; {@code nTrain + nTest > N} is a configuration error and no
 * training runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalkForwardService {

    private final ValidationProperties properties;

    /**
     * Fold geometry for one run.
     */
    public record WalkForwardConfig(int trainBars, int testBars) {

        public WalkForwardConfig {
            if (trainBars < 1) {
                throw new ValidationConfigurationException("trainBars must be >= 1, got: " + trainBars);
            }
            if (testBars < 1) {
                throw new ValidationConfigurationException("testBars must be >= 1, got: " + testBars);
            }
        }

        public static WalkForwardConfig from(ValidationProperties properties) {
            var walkForward = properties.getWalkForward();
            return new WalkForwardConfig(walkForward.getTrainBars(), walkForward.getTestBars());
        }
    }

    /**
     * Runs with the configured {@code validation.walk-forward} geometry.
     */
    public List<WalkForwardFold> run(double[] series, WalkForwardTrainer trainer, WalkForwardEvaluator evaluator) {
        WalkForwardConfig config = WalkForwardConfig.from(properties);
        return run(series, config.trainBars(), config.testBars(), trainer, evaluator);
    }

    /**
     * Walks forward through {@code series}.
     *
     * @param series ordered series (prices or log prices); not modified
     * @param nTrain training bars per fold
     * @param nTest test bars per fold
     * @param trainer picks parameters from a training window
     * @param evaluator trades a test window with frozen parameters
     * @return folds in order; test windows are contiguous and non-overlapping
     * @throws ValidationConfigurationException if the first fold does not fit in the series
     */
    public List<WalkForwardFold> run(
            double[] series,
            int nTrain,
            int nTest,
            WalkForwardTrainer trainer,
            WalkForwardEvaluator evaluator) {

        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(trainer, "trainer");
        Objects.requireNonNull(evaluator, "evaluator");
        new WalkForwardConfig(nTrain, nTest);

        int total = series.length;
        if (nTrain + nTest > total) {
            throw new ValidationConfigurationException(
                "nTrain + nTest (%d + %d) must not exceed the series length %d".formatted(nTrain, nTest, total));
        }

        log.info("Starting walk-forward over {} bars (train={}, test={})", total, nTrain, nTest);

        List<WalkForwardFold> folds = new ArrayList<>();
        int trainStart = 0;
        while (true) {
            SeriesWindow trainingWindow = new SeriesWindow(series, trainStart, nTrain);
            TrainingResult training = trainer.train(trainingWindow);

            int testStart = trainStart + nTrain;
            int testLength = Math.min(nTest, total - testStart);

            SeriesWindow testWindow = new SeriesWindow(series, testStart, testLength);
            EvaluationResult evaluation = evaluator.evaluate(
                testWindow, training.parameters(), training.finalPosition());

            WalkForwardFold fold = new WalkForwardFold(
                folds.size(),
                trainStart,
                nTrain,
                testStart,
                testLength,
                training.parameters(),
                training.criterion(),
                evaluation.returns());
            folds.add(fold);
            log.debug("   {}", fold.describe());

            trainStart += testLength;
            if (trainStart + nTrain >= total) {
                break;
            }
        }

        log.info("Walk-forward complete: {} folds, {} out-of-sample returns",
            folds.size(), folds.stream().mapToInt(f -> f.outOfSampleReturns().length).sum());
        return folds;
    }

    /**
     * Pools the folds' out-of-sample returns and evaluates {@code criterion} on them.
     */
    public WalkForwardSummary summarize(List<WalkForwardFold> folds, SampleStatistic criterion) {
        int totalReturns = folds.stream().mapToInt(f -> f.outOfSampleReturns().length).sum();
        double[] pooled = new double[totalReturns];
        int offset = 0;
        for (WalkForwardFold fold : folds) {
            double[] returns = fold.outOfSampleReturns();
            System.arraycopy(returns, 0, pooled, offset, returns.length);
            offset += returns.length;
        }

        double averageInSample = folds.stream()
            .mapToDouble(WalkForwardFold::inSampleCriterion)
            .average().orElse(0.0);
        double outOfSample = criterion.apply(pooled);

        log.info("Walk-forward OOS criterion {} over {} returns (avg IS criterion {})",
            outOfSample, totalReturns, averageInSample);
        return new WalkForwardSummary(folds, pooled, outOfSample, averageInSample);
    }
}
