package tw.gc.strategy.validation.services.walkforward;

import java.util.Map;

import tw.gc.strategy.validation.enums.ReturnType;

/**
 * Trades a test window with frozen parameters.
 *
 * <p>An evaluator emits exactly one kind of return stream per call (see {@link ReturnType});
 * {@link TradeReturnCollector} implements all three.
 */
@FunctionalInterface
public interface WalkForwardEvaluator {

    /**
     * @param testWindow the out-of-sample window; earlier bars are reachable for lookback
     * @param parameters parameters chosen on the preceding training window
     * @param priorPosition position at the end of training
     */
    EvaluationResult evaluate(SeriesWindow testWindow, Map<String, Double> parameters, int priorPosition);
}
