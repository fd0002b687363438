package tw.gc.strategy.validation.services.walkforward;

/**
 * Out-of-sample returns produced by one evaluator call.
 *
 * @param returns returns in the order they were realized
 * @param finalPosition position held after the last test bar
 */
public record EvaluationResult(double[] returns, int finalPosition) {

    public EvaluationResult {
        returns = returns.clone();
    }

    @Override
    public double[] returns() {
        return returns.clone();
    }
}
