package tw.gc.strategy.validation.services.random;

/**
 * Marsaglia's MWC256 multiply-with-carry generator.
 *
 * <p>The 256-word lag table is filled from the seed with the LCG {@code j = 69069 * j + 12345}.
 * Identical seeds produce identical streams on every platform, which is what makes bootstrap and
 * CSCV results reproducible.
 *
 * <p>Not thread-safe. Give each concurrent search its own instance.
 */
public class Mwc256Random implements UniformRandom {

    public static final long DEFAULT_SEED = 123456789L;

    private static final long MULTIPLIER = 809430660L;
    private static final long INITIAL_CARRY = 362436L;
    private static final long MASK_32 = 0xFFFFFFFFL;
    private static final double UNIT_SCALE = 1.0 / (double) MASK_32;

    private final int[] lagTable = new int[256];
    private long carry;
    private int position;

    public Mwc256Random() {
        this(DEFAULT_SEED);
    }

    /**
     * @param seed only the low 32 bits are used
     */
    public Mwc256Random(long seed) {
        int j = (int) seed;
        for (int k = 0; k < lagTable.length; k++) {
            j = 69069 * j + 12345;
            lagTable[k] = j;
        }
        this.carry = INITIAL_CARRY;
        this.position = 255;
    }

    @Override
    public long nextUnsignedInt() {
        position = (position + 1) & 0xFF;
        long t = MULTIPLIER * (lagTable[position] & MASK_32) + carry;
        carry = t >>> 32;
        lagTable[position] = (int) t;
        return t & MASK_32;
    }

    @Override
    public double nextDouble() {
        return UNIT_SCALE * nextUnsignedInt();
    }
}
