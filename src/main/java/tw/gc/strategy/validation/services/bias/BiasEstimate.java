package tw.gc.strategy.validation.services.bias;

/**
 * Training-bias estimate from a {@link SelectionBiasTracker}.
 *
 * @param inSampleReturn mean over held-out cases of the best in-sample total, rescaled to a full
 *        sample
 * @param outOfSampleReturn total return of the held-out cases under their in-sample winners
 * @param bias {@code inSampleReturn - outOfSampleReturn}
 */
public record BiasEstimate(double inSampleReturn, double outOfSampleReturn, double bias) {

    public String describe() {
        return "IS=%.6f OOS=%.6f bias=%.6f".formatted(inSampleReturn, outOfSampleReturn, bias);
    }
}
