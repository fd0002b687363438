package tw.gc.strategy.validation.services.bootstrap;

import tw.gc.strategy.validation.enums.ConfidenceLevel;

/**
 * Lower and upper confidence bounds at the 2.5%, 5% and 10% one-sided tail masses.
 *
 * <p>For large samples {@code lower <= statistic <= upper} is expected, but a single finite
 * bootstrap run does not guarantee it.
 */
public record ConfidenceBounds(
    double lower2p5,
    double upper2p5,
    double lower5,
    double upper5,
    double lower10,
    double upper10
) {
    /**
     * All six bounds equal to the point estimate, used when the sample is too small to resample.
     */
    public static ConfidenceBounds collapsed(double pointEstimate) {
        return new ConfidenceBounds(
            pointEstimate, pointEstimate, pointEstimate, pointEstimate, pointEstimate, pointEstimate);
    }

    public double lower(ConfidenceLevel level) {
        return switch (level) {
            case TWO_POINT_FIVE -> lower2p5;
            case FIVE -> lower5;
            case TEN -> lower10;
        };
    }

    public double upper(ConfidenceLevel level) {
        return switch (level) {
            case TWO_POINT_FIVE -> upper2p5;
            case FIVE -> upper5;
            case TEN -> upper10;
        };
    }

    /**
     * Reflects these bounds around {@code pointEstimate}: each new lower bound is
     * {@code 2 * pointEstimate - upper} and each new upper bound is {@code 2 * pointEstimate - lower}.
     */
    public ConfidenceBounds reflectAround(double pointEstimate) {
        double twice = 2.0 * pointEstimate;
        return new ConfidenceBounds(
            twice - upper2p5, twice - lower2p5,
            twice - upper5, twice - lower5,
            twice - upper10, twice - lower10);
    }

    public String describe() {
        return "2.5%%: [%.5f, %.5f]  5%%: [%.5f, %.5f]  10%%: [%.5f, %.5f]".formatted(
            lower2p5, upper2p5, lower5, upper5, lower10, upper10);
    }
}
