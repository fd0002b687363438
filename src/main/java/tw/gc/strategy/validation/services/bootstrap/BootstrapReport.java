package tw.gc.strategy.validation.services.bootstrap;

import tw.gc.strategy.validation.enums.BootstrapMethod;

/**
 * Point estimate plus the bounds from every bootstrap method for one sample.
 *
 * @param pointEstimate the statistic evaluated on the full sample
 * @param sampleSize number of observations in the sample
 * @param replications bootstrap replications per method
 * @param percentile percentile-method bounds
 * @param bca bias-corrected and accelerated bounds
 * @param pivot pivot bounds, derived from the percentile draw
 */
public record BootstrapReport(
    double pointEstimate,
    int sampleSize,
    int replications,
    ConfidenceBounds percentile,
    ConfidenceBounds bca,
    ConfidenceBounds pivot
) {
    public ConfidenceBounds bounds(BootstrapMethod method) {
        return switch (method) {
            case PERCENTILE -> percentile;
            case BCA -> bca;
            case PIVOT -> pivot;
        };
    }
}
