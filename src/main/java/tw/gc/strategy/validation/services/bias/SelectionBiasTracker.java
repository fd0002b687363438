package tw.gc.strategy.validation.services.bias;

import java.util.Arrays;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.exceptions.ValidationConfigurationException;

/**
 * Estimates training bias from the candidates seen by an unguided (random or exhaustive)
 * parameter search.
 *
 * <p>For every case {@code i} the tracker remembers the best total return over all other cases
 * seen so far, and the return of case {@code i} under that same candidate. Case {@code i} is
 * therefore out-of-sample for the candidate that won on the remaining cases.
 *
 * <p>Usage: enable collection, then for each candidate fill {@link #returns()} with its bar
 * returns (or pass them to {@link #process(double[])}) and call {@link #process()}. Collection
 * must stay off during guided searches, whose candidates depend on earlier scores.
 *
 * <p>Not thread-safe. Feed it from one thread in a deterministic order.
 */
@Slf4j
public class SelectionBiasTracker {

    private final int nreturns;
    private final double[] returns;
    private final double[] isBest;
    private final double[] oos;
    private boolean collecting;
    private boolean gotFirstCase;

    /**
     * @param nreturns number of bar returns every candidate produces, at least 2
     */
    public SelectionBiasTracker(int nreturns) {
        if (nreturns < 2) {
            throw new ValidationConfigurationException("nreturns must be >= 2, got: " + nreturns);
        }
        this.nreturns = nreturns;
        this.returns = new double[nreturns];
        this.isBest = new double[nreturns];
        this.oos = new double[nreturns];
    }

    public int numReturns() {
        return nreturns;
    }

    public void setCollecting(boolean collecting) {
        this.collecting = collecting;
    }

    public boolean isCollecting() {
        return collecting;
    }

    /**
     * Working buffer for the current candidate's returns. Writes go straight into the tracker.
     */
    public double[] returns() {
        return returns;
    }

    /**
     * Copies {@code candidateReturns} into the working buffer and processes them.
     *
     * @throws IllegalArgumentException if collecting and the length is not {@link #numReturns()}
     */
    public void process(double[] candidateReturns) {
        if (!collecting) {
            return;
        }
        if (candidateReturns.length != nreturns) {
            throw new IllegalArgumentException(
                "Expected %d returns, got %d".formatted(nreturns, candidateReturns.length));
        }
        System.arraycopy(candidateReturns, 0, returns, 0, nreturns);
        process();
    }

    /**
     * Folds the working buffer into the running best. No-op while collection is off.
     */
    public void process() {
        if (!collecting) {
            return;
        }

        double total = 0.0;
        for (double value : returns) {
            total += value;
        }

        if (!gotFirstCase) {
            gotFirstCase = true;
            for (int i = 0; i < nreturns; i++) {
                isBest[i] = total - returns[i];
                oos[i] = returns[i];
            }
            return;
        }

        for (int i = 0; i < nreturns; i++) {
            double candidate = total - returns[i];
            // strict: earlier candidates keep ties
            if (candidate > isBest[i]) {
                isBest[i] = candidate;
                oos[i] = returns[i];
            }
        }
    }

    /**
     * Each in-sample best covers {@code nreturns - 1} cases, so the summed bests are divided by
     * {@code nreturns - 1} to put them on a full-sample footing.
     */
    public BiasEstimate compute() {
        double inSample = 0.0;
        double outOfSample = 0.0;
        for (int i = 0; i < nreturns; i++) {
            inSample += isBest[i];
            outOfSample += oos[i];
        }
        inSample /= (nreturns - 1);

        BiasEstimate estimate = new BiasEstimate(inSample, outOfSample, inSample - outOfSample);
        log.info("Selection bias over {} returns: {}", nreturns, estimate.describe());
        return estimate;
    }

    public double[] isBest() {
        return isBest.clone();
    }

    public double[] outOfSample() {
        return oos.clone();
    }

    /**
     * Clears accumulated state so the tracker can be reused for another search. Collection is
     * switched off.
     */
    public void reset() {
        Arrays.fill(returns, 0.0);
        Arrays.fill(isBest, 0.0);
        Arrays.fill(oos, 0.0);
        gotFirstCase = false;
        collecting = false;
    }
}
