package tw.gc.strategy.validation.services.cscv;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Enumerates every way of putting exactly half of {@code nBlocks} blocks in the training set.
 *
 * <p>Starts with the first half flagged {@code true}. Each step finds the leftmost {@code true}
 * whose right neighbour is {@code false}, swaps the pair, and packs the {@code true} flags that
 * were to its left back against index 0. The sequence ends when no such pair is left, after
 * exactly {@code C(nBlocks, nBlocks / 2)} combinations.
 *
 * <p>Each call to {@link #next()} returns a fresh array.
 */
public class BlockCombinationIterator implements Iterator<boolean[]> {

    private final boolean[] flags;
    private boolean exhausted;

    public BlockCombinationIterator(int nBlocks) {
        if (nBlocks < 2 || nBlocks % 2 != 0) {
            throw new IllegalArgumentException("nBlocks must be even and >= 2, got: " + nBlocks);
        }
        flags = new boolean[nBlocks];
        for (int i = 0; i < nBlocks / 2; i++) {
            flags[i] = true;
        }
    }

    /**
     * {@code C(nBlocks, nBlocks / 2)}.
     */
    public static long combinationCount(int nBlocks) {
        int half = nBlocks / 2;
        long count = 1;
        for (int i = 1; i <= half; i++) {
            count = count * (half + i) / i;
        }
        return count;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public boolean[] next() {
        if (exhausted) {
            throw new NoSuchElementException();
        }
        boolean[] current = flags.clone();
        advance();
        return current;
    }

    private void advance() {
        int trueCount = 0;
        for (int i = 0; i < flags.length - 1; i++) {
            if (!flags[i]) {
                continue;
            }
            trueCount++;
            if (!flags[i + 1]) {
                flags[i] = false;
                flags[i + 1] = true;
                int toPack = trueCount - 1;
                for (int j = 0; j < i; j++) {
                    flags[j] = j < toPack;
                }
                return;
            }
        }
        exhausted = true;
    }
}
