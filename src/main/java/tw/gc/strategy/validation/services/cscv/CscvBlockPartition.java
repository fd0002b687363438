package tw.gc.strategy.validation.services.cscv;

import java.util.Arrays;

import tw.gc.strategy.validation.exceptions.ValidationConfigurationException;

/**
 * Contiguous, gap-free split of a case range into blocks.
 *
 * <p>Block {@code i} gets {@code ceil(remainingCases / remainingBlocks)} cases, assigned left to
 * right. Lengths sum to the case count and differ by at most one, longer blocks first.
 *
 * @param starts first case index of each block
 * @param lengths case count of each block
 */
public record CscvBlockPartition(int[] starts, int[] lengths) {

    public CscvBlockPartition {
        if (starts.length != lengths.length) {
            throw new IllegalArgumentException(
                "starts and lengths differ in size: %d vs %d".formatted(starts.length, lengths.length));
        }
        starts = starts.clone();
        lengths = lengths.clone();
    }

    /**
     * @throws ValidationConfigurationException if {@code nBlocks < 1} or there are fewer cases
     *                                          than blocks
     */
    public static CscvBlockPartition of(int nCases, int nBlocks) {
        if (nBlocks < 1) {
            throw new ValidationConfigurationException("nBlocks must be >= 1, got: " + nBlocks);
        }
        if (nCases < nBlocks) {
            throw new ValidationConfigurationException(
                "nCases (%d) must be at least nBlocks (%d)".formatted(nCases, nBlocks));
        }

        int[] starts = new int[nBlocks];
        int[] lengths = new int[nBlocks];
        int start = 0;
        for (int i = 0; i < nBlocks; i++) {
            int remainingCases = nCases - start;
            int remainingBlocks = nBlocks - i;
            starts[i] = start;
            lengths[i] = (remainingCases + remainingBlocks - 1) / remainingBlocks;
            start += lengths[i];
        }
        return new CscvBlockPartition(starts, lengths);
    }

    public int blockCount() {
        return starts.length;
    }

    @Override
    public int[] starts() {
        return starts.clone();
    }

    @Override
    public int[] lengths() {
        return lengths.clone();
    }

    public int start(int block) {
        return starts[block];
    }

    public int length(int block) {
        return lengths[block];
    }

    /**
     * Total cases covered by blocks whose flag equals {@code side}.
     */
    public int casesOnSide(boolean[] flags, boolean side) {
        int total = 0;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] == side) {
                total += lengths[i];
            }
        }
        return total;
    }

    /**
     * Copies one system's cases from the blocks flagged {@code side}, in block order, into
     * {@code target}.
     *
     * @param row the system's returns within a row-major matrix
     * @param rowOffset index of the system's first case in {@code row}
     * @return number of values written
     */
    public int gather(double[] row, int rowOffset, boolean[] flags, boolean side, double[] target) {
        int written = 0;
        for (int block = 0; block < flags.length; block++) {
            if (flags[block] == side) {
                System.arraycopy(row, rowOffset + starts[block], target, written, lengths[block]);
                written += lengths[block];
            }
        }
        return written;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CscvBlockPartition that
            && Arrays.equals(starts, that.starts)
            && Arrays.equals(lengths, that.lengths);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(starts) + Arrays.hashCode(lengths);
    }

    @Override
    public String toString() {
        return "CscvBlockPartition[starts=%s, lengths=%s]".formatted(Arrays.toString(starts), Arrays.toString(lengths));
    }
}
