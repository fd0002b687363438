package tw.gc.strategy.validation.services.walkforward;

/**
 * How one parameter candidate did on a training window.
 *
 * @param criterion value the search maximizes
 * @param finalPosition position held at the end of the window
 * @param returns the candidate's per-bar returns, used to feed a selection-bias tracker; may be
 *                empty when no tracker is attached
 */
public record CandidateScore(double criterion, int finalPosition, double[] returns) {

    private static final double[] NO_RETURNS = new double[0];

    public CandidateScore {
        returns = returns == null ? NO_RETURNS : returns.clone();
    }

    public static CandidateScore of(double criterion, int finalPosition) {
        return new CandidateScore(criterion, finalPosition, NO_RETURNS);
    }

    @Override
    public double[] returns() {
        return returns.clone();
    }
}
