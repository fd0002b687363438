package tw.gc.strategy.validation.services.walkforward;

import java.util.Arrays;
import java.util.Objects;

/**
 * A contiguous range {@code [start, start + length)} of an ordered series.
 *
 * <p>The window keeps a reference to the whole series rather than a copy, so evaluators can
 * read history before {@link #start()} (indicator lookback) through {@link #at(int)}. Treat
 * the series as read-only.
 *
 * @param series the full ordered series (prices or log prices)
 * @param start absolute index of the first element of the window
 * @param length number of elements in the window
 */
public record SeriesWindow(double[] series, int start, int length) {

    public SeriesWindow {
        Objects.requireNonNull(series, "series must be non-null");
        if (start < 0 || length < 0 || start + length > series.length) {
            throw new IndexOutOfBoundsException("Window [%d, %d) outside series of length %d"
                .formatted(start, start + length, series.length));
        }
    }

    /**
     * @return absolute index one past the last element of the window
     */
    public int end() {
        return start + length;
    }

    /**
     * @param offset position relative to {@link #start()}, in [0, length)
     */
    public double get(int offset) {
        if (offset < 0 || offset >= length) {
            throw new IndexOutOfBoundsException("Offset %d outside window of length %d".formatted(offset, length));
        }
        return series[start + offset];
    }

    /**
     * Reads any element of the underlying series by absolute index.
     */
    public double at(int absoluteIndex) {
        return series[absoluteIndex];
    }

    /**
     * @return a copy of just the window's elements
     */
    public double[] toArray() {
        return Arrays.copyOfRange(series, start, start + length);
    }
}
