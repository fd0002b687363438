package tw.gc.strategy.validation.services.cscv;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.exceptions.ValidationConfigurationException;
import tw.gc.strategy.validation.services.concurrent.ReplicationExecutor;
import tw.gc.strategy.validation.services.stats.SampleStatistic;

/**
 * Combinatorially symmetric cross-validation (CSCV) estimate of the probability of backtest
 * overfitting.
 *
 * <p>The input is a row-major {@code nSystems x nCases} matrix of per-case returns, one row per
 * candidate system, case index changing fastest. Cases are cut into an even number of blocks and
 * every half/half split of the blocks is visited once. In each split the system with the best
 * in-sample criterion is found (first system wins ties) and its out-of-sample criterion is ranked
 * against all systems:
 *
 * <pre>
 *   rank = #{ s : s == best || oos[best] >= oos[s] } / (nSystems + 1)
 * </pre>
 *
 * A rank of 0.5 or less is a vote for overfitting. The estimate is {@code votes / splits}.
 *
 * <p>Splits are independent and read only the matrix, so they may be fanned out over the
 * {@link ReplicationExecutor}; each writes its vote to its own slot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CscvOverfittingEstimator {

    private final ValidationProperties properties;
    private final ReplicationExecutor replicationExecutor;

    /**
     * Probability using the configured {@code validation.cscv.blocks}.
     */
    public double cscvProbability(double[] returns, int nSystems, int nCases, SampleStatistic criterion) {
        return cscvProbability(returns, nSystems, nCases, properties.getCscv().getBlocks(), criterion);
    }

    public double cscvProbability(
            double[] returns, int nSystems, int nCases, int nBlocks, SampleStatistic criterion) {
        return analyze(returns, nSystems, nCases, nBlocks, criterion).probability();
    }

    /**
     * Runs CSCV and returns the probability with its supporting counts.
     *
     * @param returns row-major {@code nSystems x nCases} matrix, not modified
     * @param nSystems number of candidate systems (rows)
     * @param nCases number of cases per system (columns)
     * @param nBlocks requested block count; odd values are rounded down to even
     * @param criterion performance criterion evaluated on a subset of one system's cases
     * @throws ValidationConfigurationException if the matrix does not match the dimensions, the
     *                                          effective block count is below 2, or there are
     *                                          fewer cases than blocks
     */
    public CscvResult analyze(
            double[] returns, int nSystems, int nCases, int nBlocks, SampleStatistic criterion) {

        Objects.requireNonNull(returns, "returns");
        Objects.requireNonNull(criterion, "criterion");
        validateMatrix(returns, nSystems, nCases);

        int effectiveBlocks = normalizeBlocks(nBlocks);
        CscvBlockPartition partition = CscvBlockPartition.of(nCases, effectiveBlocks);

        List<boolean[]> combinations = new ArrayList<>();
        new BlockCombinationIterator(effectiveBlocks).forEachRemaining(combinations::add);

        log.info("Starting CSCV: {} systems x {} cases, {} blocks, {} combinations",
            nSystems, nCases, effectiveBlocks, combinations.size());

        boolean[] overfitVotes = new boolean[combinations.size()];
        replicationExecutor.forEachIndex(combinations.size(), i ->
            overfitVotes[i] = evaluateCombination(returns, nSystems, nCases, partition, combinations.get(i), criterion));

        int votes = 0;
        for (boolean vote : overfitVotes) {
            if (vote) {
                votes++;
            }
        }

        CscvResult result = new CscvResult(
            (double) votes / combinations.size(),
            combinations.size(),
            votes,
            effectiveBlocks,
            partition.lengths());
        log.info("CSCV complete: {}", result.describe());
        return result;
    }

    /**
     * Criterion of the best system evaluated over all of its cases.
     */
    public double grandBestCriterion(double[] returns, int nSystems, int nCases, SampleStatistic criterion) {
        Objects.requireNonNull(returns, "returns");
        validateMatrix(returns, nSystems, nCases);

        double[] row = new double[nCases];
        double best = Double.NEGATIVE_INFINITY;
        for (int system = 0; system < nSystems; system++) {
            System.arraycopy(returns, system * nCases, row, 0, nCases);
            best = Math.max(best, criterion.apply(row));
        }
        return best;
    }

    private boolean evaluateCombination(
            double[] returns,
            int nSystems,
            int nCases,
            CscvBlockPartition partition,
            boolean[] flags,
            SampleStatistic criterion) {

        double[] inSample = new double[partition.casesOnSide(flags, true)];
        double[] outOfSample = new double[partition.casesOnSide(flags, false)];
        double[] oosCriteria = new double[nSystems];

        int best = 0;
        double bestInSample = Double.NEGATIVE_INFINITY;
        for (int system = 0; system < nSystems; system++) {
            int offset = system * nCases;
            partition.gather(returns, offset, flags, true, inSample);
            partition.gather(returns, offset, flags, false, outOfSample);

            double isCriterion = criterion.apply(inSample);
            oosCriteria[system] = criterion.apply(outOfSample);
            if (system == 0 || isCriterion > bestInSample) {
                bestInSample = isCriterion;
                best = system;
            }
        }

        double bestOutOfSample = oosCriteria[best];
        // Ties count in the winner's favour: when every system scores the same out of sample the
        // rank is nSystems / (nSystems + 1) > 0.5, so no split votes and the estimate is 0
        int atOrBelow = 0;
        for (int system = 0; system < nSystems; system++) {
            if (system == best || bestOutOfSample >= oosCriteria[system]) {
                atOrBelow++;
            }
        }
        double relativeRank = (double) atOrBelow / (nSystems + 1);
        return relativeRank <= 0.5;
    }

    private int normalizeBlocks(int nBlocks) {
        int effective = (nBlocks / 2) * 2;
        if (effective != nBlocks) {
            log.warn("nBlocks {} is odd, using {} blocks", nBlocks, effective);
        }
        if (effective < 2) {
            throw new ValidationConfigurationException("nBlocks must be >= 2 after rounding down to even, got: " + nBlocks);
        }
        return effective;
    }

    private static void validateMatrix(double[] returns, int nSystems, int nCases) {
        if (nSystems < 1) {
            throw new ValidationConfigurationException("nSystems must be >= 1, got: " + nSystems);
        }
        if (nCases < 1) {
            throw new ValidationConfigurationException("nCases must be >= 1, got: " + nCases);
        }
        if ((long) nSystems * nCases != returns.length) {
            throw new ValidationConfigurationException(
                "returns has %d entries, expected nSystems x nCases = %d x %d"
                    .formatted(returns.length, nSystems, nCases));
        }
    }
}
