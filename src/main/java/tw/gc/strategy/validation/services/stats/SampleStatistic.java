package tw.gc.strategy.validation.services.stats;

/**
 * A scalar statistic of an ordered sample of returns.
 *
 * <p>Implementations must be total: any non-empty sample, including one where every value is
 * equal, yields a finite number. Division is guarded with small additive floors rather than
 * special-cased.
 */
@FunctionalInterface
public interface SampleStatistic {

    double apply(double[] sample);
}
