package tw.gc.strategy.validation.services.random;

/**
 * Seedable source of uniform draws. Every resampling routine takes one of these explicitly;
 * there is no shared generator.
 */
public interface UniformRandom {

    /**
     * @return the next 32 random bits as an unsigned value in [0, 2^32)
     */
    long nextUnsignedInt();

    /**
     * @return a uniform draw in [0, 1]
     */
    double nextDouble();

    /**
     * Draws an index uniformly from [0, bound).
     *
     * @param bound exclusive upper limit, must be positive
     * @return index in [0, bound)
     */
    default int nextIndex(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive, got: " + bound);
        }
        int index = (int) (nextDouble() * bound);
        return Math.min(index, bound - 1);
    }

    /**
     * Standard normal draw by the Box-Muller transform.
     */
    default double nextNormal() {
        while (true) {
            double x1 = nextDouble();
            if (x1 > 0.0) {
                double x2 = nextDouble();
                return Math.sqrt(-2.0 * Math.log(x1)) * Math.cos(2.0 * Math.PI * x2);
            }
        }
    }
}
