package tw.gc.strategy.validation.services.cscv;

/**
 * Outcome of one CSCV run.
 *
 * @param probability fraction of combinations in which the in-sample winner ranked at or below
 *        the out-of-sample median; high values point to overfitting
 * @param combinations number of train/test splits evaluated
 * @param votes splits in which the winner ranked at or below the median
 * @param effectiveBlocks block count actually used after rounding down to even
 * @param blockLengths case count of each block
 */
public record CscvResult(
        double probability,
        int combinations,
        int votes,
        int effectiveBlocks,
        int[] blockLengths) {

    public CscvResult {
        blockLengths = blockLengths.clone();
    }

    @Override
    public int[] blockLengths() {
        return blockLengths.clone();
    }

    public String describe() {
        return "P(overfit)=%.4f (%d of %d combinations, %d blocks)"
            .formatted(probability, votes, combinations, effectiveBlocks);
    }
}
