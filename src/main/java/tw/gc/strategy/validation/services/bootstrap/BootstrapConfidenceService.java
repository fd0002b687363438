package tw.gc.strategy.validation.services.bootstrap;

import java.util.Arrays;
import java.util.Objects;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.BootstrapMethod;
import tw.gc.strategy.validation.enums.ConfidenceLevel;
import tw.gc.strategy.validation.exceptions.ValidationConfigurationException;
import tw.gc.strategy.validation.services.concurrent.ReplicationExecutor;
import tw.gc.strategy.validation.services.random.Mwc256Random;
import tw.gc.strategy.validation.services.random.UniformRandom;
import tw.gc.strategy.validation.services.stats.NormalDistribution;
import tw.gc.strategy.validation.services.stats.OrderStatistics;
import tw.gc.strategy.validation.services.stats.SampleStatistic;

/**
 * Bootstrap confidence intervals for an arbitrary scalar statistic of a return sample.
 *
 * <p>Three constructions are supported:
 * <ul>
 *   <li><b>Percentile</b>: bounds are order statistics of the sorted bootstrap distribution</li>
 *   <li><b>BCa</b>: the percentile read is shifted by a bias correction {@code z0} and a
 *       jackknife acceleration {@code a}</li>
 *   <li><b>Pivot</b>: percentile bounds reflected around the full-sample estimate</li>
 * </ul>
 *
 * <p>Samples with fewer than two observations cannot be resampled meaningfully; every bound then
 * collapses to the point estimate. Replication counts below the configured minimum should be
 * rejected by the caller with {@link #requireReplications(int)}; this service only refuses counts
 * below one.
 *
 * <p>Resample indices are always drawn in order from the single generator passed in, and only
 * the statistic evaluations are spread over the {@link ReplicationExecutor}. Results are the same
 * for any parallelism.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BootstrapConfidenceService {

    private static final double ACCELERATION_DENOMINATOR_FLOOR = 1.0e-60;

    private final ValidationProperties properties;
    private final ReplicationExecutor replicationExecutor;

    /**
     * Bounds using the configured replication count, method and seed.
     */
    public ConfidenceBounds estimate(double[] sample, SampleStatistic statistic) {
        var bootstrap = properties.getBootstrap();
        return estimate(sample, statistic, bootstrap.getReplications(), bootstrap.getMethod());
    }

    /**
     * Bounds using a fresh generator seeded from configuration, so identical calls give
     * bit-identical results.
     */
    public ConfidenceBounds estimate(double[] sample, SampleStatistic statistic, int nboot, BootstrapMethod method) {
        return estimate(sample, statistic, nboot, method, newRandom());
    }

    /**
     * Computes confidence bounds for {@code statistic} on {@code sample}.
     *
     * @param sample the observed returns, not modified
     * @param statistic statistic to bound
     * @param nboot number of bootstrap replications, at least 1
     * @param method interval construction
     * @param random generator the resample indices are drawn from
     * @return bounds at the 2.5%, 5% and 10% tail masses
     */
    public ConfidenceBounds estimate(
            double[] sample,
            SampleStatistic statistic,
            int nboot,
            BootstrapMethod method,
            UniformRandom random) {

        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(statistic, "statistic");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(random, "random");
        checkReplications(nboot);

        double pointEstimate = statistic.apply(sample);
        if (sample.length < 2) {
            log.warn("Sample of {} observation(s) cannot be resampled; {} bounds collapse to {}",
                sample.length, method, pointEstimate);
            return ConfidenceBounds.collapsed(pointEstimate);
        }

        log.debug("{} bootstrap: n={} nboot={} estimate={}", method, sample.length, nboot, pointEstimate);

        ConfidenceBounds bounds = switch (method) {
            case PERCENTILE -> percentileBounds(sample, statistic, nboot, random);
            case BCA -> bcaBounds(sample, statistic, pointEstimate, nboot, random);
            case PIVOT -> percentileBounds(sample, statistic, nboot, random).reflectAround(pointEstimate);
        };

        log.debug("{} bounds {}", method, bounds.describe());
        return bounds;
    }

    /**
     * Runs all three methods with the configured seed.
     */
    public BootstrapReport estimateAll(double[] sample, SampleStatistic statistic, int nboot) {
        return estimateAll(sample, statistic, nboot, newRandom());
    }

    /**
     * Runs all three methods on one sample. The percentile and pivot bounds share one bootstrap
     * distribution; the BCa bounds use a second draw continuing the same generator.
     */
    public BootstrapReport estimateAll(double[] sample, SampleStatistic statistic, int nboot, UniformRandom random) {
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(statistic, "statistic");
        Objects.requireNonNull(random, "random");
        checkReplications(nboot);

        double pointEstimate = statistic.apply(sample);
        if (sample.length < 2) {
            log.warn("Sample of {} observation(s) cannot be resampled; all bounds collapse to {}",
                sample.length, pointEstimate);
            ConfidenceBounds collapsed = ConfidenceBounds.collapsed(pointEstimate);
            return new BootstrapReport(pointEstimate, sample.length, nboot, collapsed, collapsed, collapsed);
        }

        ConfidenceBounds percentile = percentileBounds(sample, statistic, nboot, random);
        ConfidenceBounds bca = bcaBounds(sample, statistic, pointEstimate, nboot, random);
        ConfidenceBounds pivot = percentile.reflectAround(pointEstimate);

        log.info("Bootstrap of {} observations, {} replications: estimate={}", sample.length, nboot, pointEstimate);
        log.info("   Percentile {}", percentile.describe());
        log.info("   BCa        {}", bca.describe());
        log.info("   Pivot      {}", pivot.describe());

        return new BootstrapReport(pointEstimate, sample.length, nboot, percentile, bca, pivot);
    }

    /**
     * Rejects replication counts below {@code validation.bootstrap.min-replications}.
     *
     * @throws ValidationConfigurationException if {@code nboot} is too small
     */
    public void requireReplications(int nboot) {
        int minimum = properties.getBootstrap().getMinReplications();
        if (nboot < minimum) {
            throw new ValidationConfigurationException(
                "nboot must be at least %d, got: %d".formatted(minimum, nboot));
        }
    }

    /**
     * A generator seeded with {@code validation.random.seed}.
     */
    public UniformRandom newRandom() {
        return new Mwc256Random(properties.getRandom().getSeed());
    }

    private void checkReplications(int nboot) {
        if (nboot < 1) {
            throw new ValidationConfigurationException("nboot must be positive, got: " + nboot);
        }
    }

    private ConfidenceBounds percentileBounds(double[] sample, SampleStatistic statistic, int nboot, UniformRandom random) {
        double[] distribution = bootstrapDistribution(sample, statistic, nboot, random);
        Arrays.sort(distribution);

        double[] bounds = new double[6];
        ConfidenceLevel[] levels = ConfidenceLevel.values();
        for (int i = 0; i < levels.length; i++) {
            double tail = levels[i].getTailMass();
            bounds[2 * i] = OrderStatistics.quantile(distribution, tail);
            bounds[2 * i + 1] = distribution[OrderStatistics.upperBoundIndex(tail, nboot)];
        }
        return toBounds(bounds);
    }

    private ConfidenceBounds bcaBounds(
            double[] sample, SampleStatistic statistic, double thetaHat, int nboot, UniformRandom random) {

        double[] distribution = bootstrapDistribution(sample, statistic, nboot, random);

        int belowCount = 0;
        for (double value : distribution) {
            if (value < thetaHat) {
                belowCount++;
            }
        }
        // Keep z0 finite
        if (belowCount >= nboot) {
            belowCount = nboot - 1;
        }
        if (belowCount <= 0) {
            belowCount = 1;
        }
        double z0 = NormalDistribution.inverseCdf((double) belowCount / nboot);
        double acceleration = jackknifeAcceleration(sample, statistic);

        Arrays.sort(distribution);

        double[] bounds = new double[6];
        ConfidenceLevel[] levels = ConfidenceLevel.values();
        for (int i = 0; i < levels.length; i++) {
            double tail = levels[i].getTailMass();
            double zLow = NormalDistribution.inverseCdf(tail);
            double zHigh = NormalDistribution.inverseCdf(1.0 - tail);
            double adjustedLow = NormalDistribution.cdf(z0 + (z0 + zLow) / (1.0 - acceleration * (z0 + zLow)));
            double adjustedHigh = NormalDistribution.cdf(z0 + (z0 + zHigh) / (1.0 - acceleration * (z0 + zHigh)));
            bounds[2 * i] = OrderStatistics.quantile(distribution, adjustedLow);
            bounds[2 * i + 1] = distribution[OrderStatistics.upperBoundIndex(1.0 - adjustedHigh, nboot)];
        }

        log.debug("BCa z0={} acceleration={}", z0, acceleration);
        return toBounds(bounds);
    }

    /**
     * Jackknife estimate of the BCa acceleration constant.
     *
     * <p>Deviation from the textbook leave-one-out: case {@code i} is not removed, its value is
     * overwritten by the last case's value and the statistic is evaluated on all {@code n}
     * entries. This matches the established results of this engine and is kept on purpose.
     */
    static double jackknifeAcceleration(double[] sample, SampleStatistic statistic) {
        int n = sample.length;
        double[] work = sample.clone();
        double last = sample[n - 1];
        double[] jackknife = new double[n];
        double thetaDot = 0.0;

        for (int i = 0; i < n; i++) {
            double saved = work[i];
            work[i] = last;
            jackknife[i] = statistic.apply(work);
            thetaDot += jackknife[i];
            work[i] = saved;
        }
        thetaDot /= n;

        double numer = 0.0;
        double denom = 0.0;
        for (double value : jackknife) {
            double diff = thetaDot - value;
            double squared = diff * diff;
            denom += squared;
            numer += squared * diff;
        }
        denom = Math.sqrt(denom);
        denom = denom * denom * denom;
        return numer / (6.0 * denom + ACCELERATION_DENOMINATOR_FLOOR);
    }

    /**
     * Statistic values of {@code nboot} resamples, unsorted, in draw order.
     */
    private double[] bootstrapDistribution(double[] sample, SampleStatistic statistic, int nboot, UniformRandom random) {
        int n = sample.length;
        double[] distribution = new double[nboot];

        if (replicationExecutor.parallelism() == 1) {
            double[] resample = new double[n];
            for (int rep = 0; rep < nboot; rep++) {
                for (int i = 0; i < n; i++) {
                    resample[i] = sample[random.nextIndex(n)];
                }
                distribution[rep] = statistic.apply(resample);
            }
            return distribution;
        }

        double[][] resamples = new double[nboot][];
        for (int rep = 0; rep < nboot; rep++) {
            double[] resample = new double[n];
            for (int i = 0; i < n; i++) {
                resample[i] = sample[random.nextIndex(n)];
            }
            resamples[rep] = resample;
        }
        replicationExecutor.forEachIndex(nboot, rep -> distribution[rep] = statistic.apply(resamples[rep]));
        return distribution;
    }

    private ConfidenceBounds toBounds(double[] bounds) {
        return new ConfidenceBounds(bounds[0], bounds[1], bounds[2], bounds[3], bounds[4], bounds[5]);
    }
}
